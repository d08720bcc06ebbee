package io.skillagent.server.requesthandlers;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.skillagent.server.events.EventSink;
import io.skillagent.server.skills.SkillInvoker;
import io.skillagent.server.skills.SkillResult;
import io.skillagent.server.tasks.TaskStore;
import io.skillagent.server.util.ArtifactUtils;
import io.skillagent.spec.A2AError;
import io.skillagent.spec.Artifact;
import io.skillagent.spec.InvalidParamsError;
import io.skillagent.spec.InvalidStateTransitionError;
import io.skillagent.spec.Message;
import io.skillagent.spec.Part;
import io.skillagent.spec.Task;
import io.skillagent.spec.TaskIdParams;
import io.skillagent.spec.TaskNotCancelableError;
import io.skillagent.spec.TaskQueryParams;
import io.skillagent.spec.TaskSendParams;
import io.skillagent.spec.TextPart;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class DefaultRequestHandler implements RequestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRequestHandler.class);

    private static final String SKILL_ID_FIELD = "metadata." + TaskSendParams.SKILL_ID;
    private static final int STREAM_ARTIFACT_INDEX = 0;

    private final TaskStore taskStore;
    private final SkillInvoker skills;

    @Inject
    public DefaultRequestHandler(TaskStore taskStore, SkillInvoker skills) {
        this.taskStore = taskStore;
        this.skills = skills;
    }

    @Override
    public Task onSend(TaskSendParams params) throws A2AError {
        SendRequest request = validate(params, false);
        Task task = start(request);

        try {
            SkillResult result = skills.invoke(request.skillId(), request.message(), task);
            Message reply = Message.agentText(textOf(result));
            taskStore.setCompleted(task.id(), reply);
            return taskStore.appendHistory(task.id(), reply);
        } catch (Exception e) {
            A2AError error = A2AError.from(e);
            markFailed(task.id(), request.skillId(), error);
            throw error;
        } catch (Error e) {
            markFailed(task.id(), request.skillId(), A2AError.from(e));
            throw e;
        }
    }

    @Override
    public Task onGet(TaskQueryParams params) throws A2AError {
        String id = requireId(params.id());
        Integer historyLength = params.historyLength();
        if (historyLength != null && historyLength < 0) {
            throw new InvalidParamsError("historyLength must not be negative", "historyLength");
        }

        Task task = taskStore.getOrFail(id);
        if (historyLength == null || task.history().size() <= historyLength) {
            return task;
        }
        List<Message> history = task.history();
        return Task.builder(task)
                .history(history.subList(history.size() - historyLength, history.size()))
                .build();
    }

    @Override
    public Task onCancel(TaskIdParams params) throws A2AError {
        String id = requireId(params.id());
        try {
            return taskStore.setCanceled(id);
        } catch (InvalidStateTransitionError e) {
            throw new TaskNotCancelableError(id, e.getFrom());
        }
    }

    @Override
    public void onSendSubscribe(TaskSendParams params, EventSink sink) {
        try {
            SendRequest request;
            try {
                request = validate(params, true);
            } catch (A2AError e) {
                LOGGER.debug("Rejecting streaming request: {}", e.getMessage());
                sink.writeError(e);
                return;
            }
            stream(request, sink);
        } finally {
            sink.close();
        }
    }

    private void stream(SendRequest request, EventSink sink) {
        Task task;
        try {
            task = start(request);
        } catch (RuntimeException e) {
            LOGGER.warn("Unable to start task {}: {}", request.id(), e.getMessage());
            sink.writeError(A2AError.from(e));
            return;
        }
        String id = task.id();
        sink.writeStatus(id, task.status(), false);

        try {
            SkillResult result = skills.invoke(request.skillId(), request.message(), task);
            if (result instanceof SkillResult.Immediate immediate) {
                Artifact artifact = ArtifactUtils.newTextArtifact(immediate.value(), STREAM_ARTIFACT_INDEX);
                sink.writeArtifact(id, artifact);
                taskStore.addArtifact(id, artifact);
            } else {
                String text = streamChunks(id, ((SkillResult.Streamed) result).chunks(), sink);
                taskStore.addArtifact(id, ArtifactUtils.newTextArtifact(text, STREAM_ARTIFACT_INDEX));
            }

            List<Artifact> artifacts = taskStore.getOrFail(id).artifacts();
            List<Part<?>> replyParts = artifacts.isEmpty() || artifacts.get(0).parts().isEmpty()
                    ? List.of(new TextPart(""))
                    : artifacts.get(0).parts();
            Message reply = new Message(Message.Role.AGENT, replyParts);
            taskStore.setCompleted(id, reply);
            Task completed = taskStore.appendHistory(id, reply);
            sink.writeStatus(id, completed.status(), true);
        } catch (Exception e) {
            fail(id, request.skillId(), A2AError.from(e), sink);
        } catch (Error e) {
            fail(id, request.skillId(), A2AError.from(e), sink);
            throw e;
        }
    }

    private void fail(String id, String skillId, A2AError error, EventSink sink) {
        Task failed = markFailed(id, skillId, error);
        if (failed != null) {
            sink.writeStatus(id, failed.status(), true);
        } else {
            sink.writeError(error);
        }
    }

    private String streamChunks(String id, Iterator<String> chunks, EventSink sink) {
        StringBuilder text = new StringBuilder();
        boolean first = true;
        while (sink.isOpen() && chunks.hasNext()) {
            String chunk = chunks.next();
            if (!sink.isOpen()) {
                LOGGER.debug("Sink for task {} closed, dropping remaining output", id);
                break;
            }
            text.append(chunk);
            sink.writeArtifact(id, ArtifactUtils.newTextChunk(chunk, STREAM_ARTIFACT_INDEX, !first, false));
            first = false;
        }
        sink.writeArtifact(id, ArtifactUtils.newTextChunk("", STREAM_ARTIFACT_INDEX, true, true));
        return text.toString();
    }

    private Task start(SendRequest request) {
        TaskSendParams params = request.params();
        String id = request.id();
        taskStore.create(id, params.contextId(), params.metadata());
        // a rejected transition must leave the history untouched
        taskStore.setWorking(id);
        return taskStore.appendHistory(id, request.message());
    }

    private @Nullable Task markFailed(String id, String skillId, A2AError error) {
        LOGGER.warn("Skill {} failed for task {}: {}", skillId, id, error.getMessage());
        try {
            return taskStore.setFailed(id, Message.agentText("Error: " + error.getMessage()));
        } catch (A2AError e) {
            LOGGER.warn("Unable to mark task {} as failed", id, e);
            error.addSuppressed(e);
            return null;
        }
    }

    private static String textOf(SkillResult result) {
        if (result instanceof SkillResult.Immediate immediate) {
            return immediate.value();
        }
        StringBuilder text = new StringBuilder();
        ((SkillResult.Streamed) result).chunks().forEachRemaining(text::append);
        return text.toString();
    }

    private SendRequest validate(TaskSendParams params, boolean streaming) {
        String id = requireId(params.id());
        Message message = params.message();
        if (message == null) {
            throw InvalidParamsError.missing("message");
        }
        String skillId = params.skillId();
        if (skillId == null) {
            throw new InvalidParamsError(streaming
                    ? "Missing required metadata.skillId"
                    : "Missing required metadata.skillId - explicit skill routing required", SKILL_ID_FIELD);
        }
        if (!skills.hasSkill(skillId)) {
            String error = "Unknown skill: " + skillId;
            throw streaming
                    ? new InvalidParamsError(error, Map.of(TaskSendParams.SKILL_ID, skillId))
                    : new InvalidParamsError(error, SKILL_ID_FIELD);
        }
        return new SendRequest(id, message, skillId, params);
    }

    private static String requireId(@Nullable String id) {
        if (id == null || id.isEmpty()) {
            throw InvalidParamsError.missing("id");
        }
        return id;
    }

    private record SendRequest(String id, Message message, String skillId, TaskSendParams params) {
    }
}
