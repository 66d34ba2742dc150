package kiln.engine.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable description of a unit of work.
 * The {@code type} selects the handler that runs it; {@code data} is passed to
 * that handler untouched.
 */
public final class Task {
    private final String id;
    private final String type;
    private final Object data;
    private final int priority;
    private final Duration timeout;

    private Task(Builder builder) {
        if (builder.type == null || builder.type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        if (builder.id != null && builder.id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (builder.timeout != null && (builder.timeout.isNegative() || builder.timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.id = builder.id;
        this.type = builder.type;
        this.data = builder.data;
        this.priority = builder.priority;
        this.timeout = builder.timeout;
    }

    /** Task id, or null when the pool should assign one at submission. */
    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public Object data() {
        return data;
    }

    public int priority() {
        return priority;
    }

    /** Per-task timeout, or null to use the pool default. */
    public Duration timeout() {
        return timeout;
    }

    public boolean hasId() {
        return id != null;
    }

    /** Copy of this task carrying the given id. */
    public Task withId(String newId) {
        return toBuilder().id(newId).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .data(data)
                .priority(priority)
                .timeout(timeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for a task with default priority and timeout. */
    public static Task of(String id, String type, Object data) {
        return builder().id(id).type(type).data(data).build();
    }

    public static final class Builder {
        private String id;
        private String type;
        private Object data;
        private int priority = 0;
        private Duration timeout;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder data(Object data) {
            this.data = data;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id) && Objects.equals(type, task.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type='" + type + "', priority=" + priority + "}";
    }
}
