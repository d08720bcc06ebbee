package io.skillagent.spec;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.skillagent.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Carries one artifact chunk during streaming.
 *
 * @param id the task id
 * @param artifact the chunk
 * @param metadata optional metadata
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskArtifactUpdateEvent(@JsonProperty("id") String id,
                                      @JsonProperty("artifact") Artifact artifact,
                                      @JsonProperty("metadata") @Nullable Map<String, Object> metadata)
        implements StreamingEventKind {

    public TaskArtifactUpdateEvent {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("artifact", artifact);
    }

    public TaskArtifactUpdateEvent(String id, Artifact artifact) {
        this(id, artifact, null);
    }
}
