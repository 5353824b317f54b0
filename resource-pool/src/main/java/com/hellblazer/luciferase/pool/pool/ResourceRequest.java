package com.hellblazer.luciferase.pool.pool;

/**
 * Immutable request for a lease. Construction does not validate; {@code ResourcePoolManager.allocate}
 * rejects malformed requests with a validation error.
 */
public final class ResourceRequest {

    private final String id;
    private final ResourceType type;
    private final Priority priority;
    private final ResourceRequirements requirements;

    private ResourceRequest(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.priority = builder.priority;
        this.requirements = builder.requirements;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ResourceRequest of(String id, ResourceType type) {
        return builder().withId(id).withType(type).build();
    }

    public String getId() { return id; }
    public ResourceType getType() { return type; }
    public Priority getPriority() { return priority; }
    public ResourceRequirements getRequirements() { return requirements; }

    public static class Builder {
        private String id;
        private ResourceType type = ResourceType.GENERIC;
        private Priority priority = Priority.MEDIUM;
        private ResourceRequirements requirements = ResourceRequirements.none();

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withType(ResourceType type) {
            this.type = type;
            return this;
        }

        public Builder withPriority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder withRequirements(ResourceRequirements requirements) {
            this.requirements = requirements;
            return this;
        }

        public Builder withMemory(long bytes) {
            var current = requirements == null ? ResourceRequirements.none() : requirements;
            this.requirements = new ResourceRequirements(bytes, current.cpu(), current.timeoutMs());
            return this;
        }

        public Builder withCpu(double percent) {
            var current = requirements == null ? ResourceRequirements.none() : requirements;
            this.requirements = new ResourceRequirements(current.memory(), percent, current.timeoutMs());
            return this;
        }

        public Builder withTimeoutMs(long timeoutMs) {
            var current = requirements == null ? ResourceRequirements.none() : requirements;
            this.requirements = current.withTimeoutMs(timeoutMs);
            return this;
        }

        public ResourceRequest build() {
            return new ResourceRequest(this);
        }
    }

    @Override
    public String toString() {
        return String.format("ResourceRequest[id=%s, type=%s, priority=%s, requirements=%s]",
            id, type, priority, requirements);
    }
}
