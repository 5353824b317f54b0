package com.hellblazer.luciferase.pool.pool;

public enum ResourceType {
    MEMORY,
    CPU,
    DISK,
    GENERIC
}
