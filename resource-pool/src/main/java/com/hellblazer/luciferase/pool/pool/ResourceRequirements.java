package com.hellblazer.luciferase.pool.pool;

import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * What a request needs. Every field is optional; a null field means no requirement.
 *
 * @param memory    bytes of memory
 * @param cpu       cpu share in percent of one core (150 means one and a half cores)
 * @param timeoutMs lease lifetime, overriding the pool's resource timeout
 */
public record ResourceRequirements(Long memory, Double cpu, Long timeoutMs) {

    private static final ResourceRequirements NONE = new ResourceRequirements(null, null, null);

    public static ResourceRequirements none() {
        return NONE;
    }

    public static ResourceRequirements of(Long memory, Double cpu) {
        return new ResourceRequirements(memory, cpu, null);
    }

    public ResourceRequirements withTimeoutMs(long timeout) {
        return new ResourceRequirements(memory, cpu, timeout);
    }

    public OptionalLong memoryBytes() {
        return memory == null ? OptionalLong.empty() : OptionalLong.of(memory);
    }

    public OptionalDouble cpuPercent() {
        return cpu == null ? OptionalDouble.empty() : OptionalDouble.of(cpu);
    }

    public OptionalLong timeout() {
        return timeoutMs == null ? OptionalLong.empty() : OptionalLong.of(timeoutMs);
    }
}
