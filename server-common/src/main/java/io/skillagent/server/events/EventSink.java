package io.skillagent.server.events;

import io.skillagent.spec.A2AError;
import io.skillagent.spec.Artifact;
import io.skillagent.spec.TaskStatus;
import org.jspecify.annotations.Nullable;

/**
 * Ordered destination for the events of one streaming request.
 * <p>
 * Events are written from a single thread, in the order they must reach the caller. Once the
 * sink reports {@link #isOpen()} {@code false}, for instance after the caller disconnected, the
 * producer stops writing. Implementations drop writes made after {@link #close()}.
 */
public interface EventSink extends AutoCloseable {

    /**
     * Writes a status event.
     *
     * @param taskId the task id
     * @param status the current status
     * @param isFinal whether this is the last event of the stream
     */
    void writeStatus(String taskId, TaskStatus status, boolean isFinal);

    void writeArtifact(String taskId, Artifact artifact);

    void writeError(int code, String message, @Nullable Object data);

    default void writeError(A2AError error) {
        writeError(error.getCode(), String.valueOf(error.getMessage()), error.getData());
    }

    boolean isOpen();

    /**
     * Closes the sink. Calling it more than once has no further effect.
     */
    @Override
    void close();
}
