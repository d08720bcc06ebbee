package io.skillagent.server.requesthandlers;

import io.skillagent.server.events.EventSink;
import io.skillagent.spec.A2AError;
import io.skillagent.spec.Task;
import io.skillagent.spec.TaskIdParams;
import io.skillagent.spec.TaskQueryParams;
import io.skillagent.spec.TaskSendParams;

/**
 * Handles the task methods independently of the transport that carried them.
 * <p>
 * Failures are reported as {@link A2AError}s. Anything else thrown by a skill reaches the
 * caller as an {@link io.skillagent.spec.InternalError}.
 */
public interface RequestHandler {

    /**
     * Runs a skill to completion and returns the finished task.
     *
     * @param params the request parameters
     * @return the task in state {@code completed}
     * @throws A2AError if the parameters are invalid or the skill failed, in which case the task
     *                  has been moved to {@code failed}
     */
    Task onSend(TaskSendParams params) throws A2AError;

    Task onGet(TaskQueryParams params) throws A2AError;

    Task onCancel(TaskIdParams params) throws A2AError;

    /**
     * Runs a skill and streams its progress to {@code sink}. Nothing is thrown: failures are
     * written to the sink, and the sink is closed before this method returns.
     *
     * @param params the request parameters
     * @param sink the destination of the events
     */
    void onSendSubscribe(TaskSendParams params, EventSink sink);
}
