package io.skillagent.spec;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.skillagent.util.Assert;
import io.skillagent.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A unit of work tracked across its lifecycle, created once per caller-supplied id.
 * <p>
 * Tasks are immutable values: every status change, history append or artifact update produces
 * a new {@code Task} that replaces the stored one. {@code history} and {@code artifacts} are
 * never null; JSON that omits them or sends {@code null} maps to empty lists.
 *
 * @param id caller-supplied identifier
 * @param contextId optional grouping identifier, fixed once set
 * @param status current status
 * @param history the exchanged messages, oldest first
 * @param artifacts the produced artifacts, in index order
 * @param metadata metadata supplied at creation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Task(@JsonProperty("id") String id,
                   @JsonProperty("contextId") @Nullable String contextId,
                   @JsonProperty("status") TaskStatus status,
                   @JsonProperty("history") List<Message> history,
                   @JsonProperty("artifacts") List<Artifact> artifacts,
                   @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {

    @JsonCreator
    public Task {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("status", status);
        history = history == null ? List.of() : List.copyOf(history);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        metadata = Utils.copyOfNullable(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Task task) {
        return new Builder(task);
    }

    public static class Builder {
        private @Nullable String id;
        private @Nullable String contextId;
        private @Nullable TaskStatus status;
        private @Nullable List<Message> history;
        private @Nullable List<Artifact> artifacts;
        private @Nullable Map<String, Object> metadata;

        private Builder() {
        }

        private Builder(Task task) {
            id = task.id;
            contextId = task.contextId;
            status = task.status;
            history = task.history;
            artifacts = task.artifacts;
            metadata = task.metadata;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder contextId(@Nullable String contextId) {
            this.contextId = contextId;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder history(@Nullable List<Message> history) {
            this.history = history;
            return this;
        }

        public Builder artifacts(@Nullable List<Artifact> artifacts) {
            this.artifacts = artifacts;
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Task build() {
            return new Task(
                    Assert.checkNotNullParam("id", id),
                    contextId,
                    Assert.checkNotNullParam("status", status),
                    history,
                    artifacts,
                    metadata);
        }
    }
}
