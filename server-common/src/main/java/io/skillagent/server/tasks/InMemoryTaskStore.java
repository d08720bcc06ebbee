package io.skillagent.server.tasks;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.skillagent.server.util.ArtifactUtils;
import io.skillagent.spec.Artifact;
import io.skillagent.spec.Message;
import io.skillagent.spec.Task;
import io.skillagent.spec.TaskNotFoundError;
import io.skillagent.spec.TaskState;
import io.skillagent.spec.TaskStatus;
import io.skillagent.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory implementation of {@link TaskStore}.
 * <p>
 * Tasks live in a {@link ConcurrentHashMap} and are lost when the process stops. Every
 * mutation runs inside {@link ConcurrentMap#compute}, so updates to one task id are applied one
 * at a time and readers see either the previous or the new record. Tasks are immutable values,
 * which keeps the critical sections short.
 */
@ApplicationScoped
public class InMemoryTaskStore implements TaskStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final TaskStateMachine stateMachine;

    public InMemoryTaskStore() {
        this(new TaskStateMachine());
    }

    @Inject
    public InMemoryTaskStore(TaskStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @Override
    public Task create(String id, @Nullable String contextId, @Nullable Map<String, Object> metadata) {
        Assert.checkNotEmptyParam("id", id);
        return tasks.computeIfAbsent(id, key -> {
            LOGGER.debug("Creating task {}", key);
            return Task.builder()
                    .id(key)
                    .contextId(contextId)
                    .status(new TaskStatus(TaskState.SUBMITTED))
                    .metadata(metadata)
                    .build();
        });
    }

    @Override
    public @Nullable Task get(String id) {
        return tasks.get(id);
    }

    @Override
    public Task getOrFail(String id) {
        Task task = tasks.get(id);
        if (task == null) {
            throw new TaskNotFoundError(id);
        }
        return task;
    }

    @Override
    public Task updateStatus(String id, TaskState state, @Nullable Message message) {
        return mutate(id, task -> {
            TaskState current = task.status().state();
            stateMachine.assertTransition(id, current, state);
            LOGGER.debug("Task {} {} -> {}", id, current, state);
            return Task.builder(task)
                    .status(new TaskStatus(state, message))
                    .build();
        });
    }

    @Override
    public Task appendHistory(String id, Message message) {
        Assert.checkNotNullParam("message", message);
        return mutate(id, task -> Task.builder(task)
                .history(appended(task.history(), message))
                .build());
    }

    @Override
    public Task addArtifact(String id, Artifact artifact) {
        Assert.checkNotNullParam("artifact", artifact);
        return mutate(id, task -> Task.builder(task)
                .artifacts(appended(task.artifacts(), artifact))
                .build());
    }

    @Override
    public Task updateArtifact(String id, int index, Artifact chunk) {
        Assert.checkNotNullParam("chunk", chunk);
        return mutate(id, task -> {
            List<Artifact> artifacts = task.artifacts();
            if (index < 0 || index >= artifacts.size()) {
                LOGGER.debug("Task {} has no artifact at index {}, adding chunk as artifact {}",
                        id, index, artifacts.size());
                return Task.builder(task)
                        .artifacts(appended(artifacts, chunk))
                        .build();
            }
            List<Artifact> updated = new ArrayList<>(artifacts);
            updated.set(index, ArtifactUtils.applyChunk(artifacts.get(index), chunk));
            return Task.builder(task)
                    .artifacts(updated)
                    .build();
        });
    }

    @Override
    public boolean delete(String id) {
        return tasks.remove(id) != null;
    }

    @Override
    public void clear() {
        tasks.clear();
    }

    @Override
    public List<String> keys() {
        return List.copyOf(tasks.keySet());
    }

    @Override
    public int size() {
        return tasks.size();
    }

    private Task mutate(String id, UnaryOperator<Task> update) {
        Task updated = tasks.computeIfPresent(id, (key, task) -> update.apply(task));
        if (updated == null) {
            throw new TaskNotFoundError(id);
        }
        return updated;
    }

    private static <T> List<T> appended(List<T> list, T element) {
        List<T> copy = new ArrayList<>(list.size() + 1);
        copy.addAll(list);
        copy.add(element);
        return copy;
    }
}
