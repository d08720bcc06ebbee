package io.skillagent.server.tasks;

import java.util.List;
import java.util.Map;

import io.skillagent.spec.Artifact;
import io.skillagent.spec.InvalidStateTransitionError;
import io.skillagent.spec.Message;
import io.skillagent.spec.Task;
import io.skillagent.spec.TaskNotFoundError;
import io.skillagent.spec.TaskState;
import org.jspecify.annotations.Nullable;

/**
 * Owner of every {@link Task} record.
 * <p>
 * A task is only changed through this interface. Each mutator replaces the stored record
 * atomically and returns the new one; operations on the same task id never interleave,
 * while operations on different ids do not block each other. Every status change is checked
 * against the {@link TaskStateMachine}.
 *
 * <h2>Failures</h2>
 * Mutators throw {@link TaskNotFoundError} when no task is stored under the id, and status
 * updates throw {@link InvalidStateTransitionError} when the transition is not allowed. A failed
 * mutation leaves the stored task unchanged.
 */
public interface TaskStore {

    /**
     * Creates a task in state {@code submitted}, or returns the stored one unchanged if the id
     * is already taken.
     *
     * @param id the task id
     * @param contextId optional context id, only used for a new task
     * @param metadata optional metadata, only used for a new task
     * @return the stored task
     */
    Task create(String id, @Nullable String contextId, @Nullable Map<String, Object> metadata);

    @Nullable Task get(String id);

    /**
     * Returns a stored task.
     *
     * @param id the task id
     * @return the task
     * @throws TaskNotFoundError if there is no such task
     */
    Task getOrFail(String id);

    /**
     * Moves a task to a new state, stamping the status with the current time.
     *
     * @param id the task id
     * @param state the requested state
     * @param message optional message describing the new status
     * @return the updated task
     * @throws TaskNotFoundError if there is no such task
     * @throws InvalidStateTransitionError if the current state does not allow {@code state}
     */
    Task updateStatus(String id, TaskState state, @Nullable Message message);

    default Task setWorking(String id) {
        return updateStatus(id, TaskState.WORKING, null);
    }

    default Task setCompleted(String id, @Nullable Message message) {
        return updateStatus(id, TaskState.COMPLETED, message);
    }

    default Task setFailed(String id, @Nullable Message message) {
        return updateStatus(id, TaskState.FAILED, message);
    }

    default Task setCanceled(String id) {
        return updateStatus(id, TaskState.CANCELED, null);
    }

    default Task setInputRequired(String id, @Nullable Message message) {
        return updateStatus(id, TaskState.INPUT_REQUIRED, message);
    }

    Task appendHistory(String id, Message message);

    Task addArtifact(String id, Artifact artifact);

    /**
     * Applies a streamed chunk to the artifact at {@code index}.
     * <p>
     * When {@code index} addresses a stored artifact and the chunk has {@code append=true}, each
     * chunk part is added to the stored parts, concatenating text onto a trailing text part. A
     * non-null {@code lastChunk} replaces the stored flag. An {@code index} past the stored
     * artifacts adds the chunk as a new artifact.
     *
     * @param id the task id
     * @param index the position of the artifact in {@link Task#artifacts()}
     * @param chunk the chunk to apply
     * @return the updated task
     * @throws TaskNotFoundError if there is no such task
     */
    Task updateArtifact(String id, int index, Artifact chunk);

    boolean delete(String id);

    void clear();

    /**
     * Returns the ids of all stored tasks.
     *
     * @return a snapshot of the ids
     */
    List<String> keys();

    int size();
}
