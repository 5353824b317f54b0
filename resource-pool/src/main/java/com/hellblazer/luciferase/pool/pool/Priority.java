package com.hellblazer.luciferase.pool.pool;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH
}
