package com.hellblazer.luciferase.pool.pool;

/**
 * Quantized key for a request's requirements. Requests with the same type and the same memory and cpu
 * buckets can reuse one cached lease shape. A zero bucket means the requirement is absent.
 */
public record RequirementFingerprint(ResourceType type, long memoryBucket, long cpuBucket) {

    public static RequirementFingerprint of(ResourceRequest request) {
        var requirements = request.getRequirements();
        long memory = requirements.memoryBytes().isPresent()
                      ? PoolUtils.roundUpToPowerOf2(requirements.memoryBytes().getAsLong()) : 0;
        long cpu = requirements.cpuPercent().isPresent()
                   ? PoolUtils.cpuBucket(requirements.cpuPercent().getAsDouble()) : 0;
        return new RequirementFingerprint(request.getType(), memory, cpu);
    }
}
