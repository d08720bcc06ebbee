package io.skillagent.server.tasks;

import static io.skillagent.spec.TaskState.CANCELED;
import static io.skillagent.spec.TaskState.COMPLETED;
import static io.skillagent.spec.TaskState.FAILED;
import static io.skillagent.spec.TaskState.INPUT_REQUIRED;
import static io.skillagent.spec.TaskState.SUBMITTED;
import static io.skillagent.spec.TaskState.UNKNOWN;
import static io.skillagent.spec.TaskState.WORKING;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;

import io.skillagent.spec.InvalidStateTransitionError;
import io.skillagent.spec.TaskState;

/**
 * The legal transitions between {@link TaskState}s.
 * <p>
 * Stateless; one instance may be shared by every caller.
 * <pre>
 * submitted      -&gt; working, canceled, failed
 * working        -&gt; completed, failed, canceled, input-required
 * input-required -&gt; working, canceled, failed
 * unknown        -&gt; submitted, working, completed, failed, canceled, input-required
 * completed, canceled, failed -&gt; (none)
 * </pre>
 */
@ApplicationScoped
public class TaskStateMachine {

    private static final Map<TaskState, Set<TaskState>> TRANSITIONS = new EnumMap<>(TaskState.class);

    static {
        TRANSITIONS.put(SUBMITTED, edges(WORKING, CANCELED, FAILED));
        TRANSITIONS.put(WORKING, edges(COMPLETED, FAILED, CANCELED, INPUT_REQUIRED));
        TRANSITIONS.put(INPUT_REQUIRED, edges(WORKING, CANCELED, FAILED));
        TRANSITIONS.put(COMPLETED, edges());
        TRANSITIONS.put(CANCELED, edges());
        TRANSITIONS.put(FAILED, edges());
        TRANSITIONS.put(UNKNOWN, edges(SUBMITTED, WORKING, COMPLETED, FAILED, CANCELED, INPUT_REQUIRED));
    }

    private static Set<TaskState> edges(TaskState... targets) {
        // insertion order is the order reported by validTransitions
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(targets)));
    }

    public boolean canTransition(TaskState from, TaskState to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * Checks a transition of the given task.
     *
     * @param taskId the task being moved, used in the error
     * @param from the current state
     * @param to the requested state
     * @throws InvalidStateTransitionError if the transition is not allowed
     */
    public void assertTransition(String taskId, TaskState from, TaskState to) {
        if (!canTransition(from, to)) {
            throw new InvalidStateTransitionError(taskId, from, to);
        }
    }

    public boolean isTerminal(TaskState state) {
        return TRANSITIONS.get(state).isEmpty();
    }

    /**
     * Returns the states reachable from {@code from} in table order.
     *
     * @param from the current state
     * @return an unmodifiable, ordered set, empty for terminal states
     */
    public Set<TaskState> validTransitions(TaskState from) {
        return TRANSITIONS.get(from);
    }
}
