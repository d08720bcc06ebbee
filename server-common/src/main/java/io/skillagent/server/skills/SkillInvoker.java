package io.skillagent.server.skills;

import io.skillagent.spec.Message;
import io.skillagent.spec.SkillNotFoundError;
import io.skillagent.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * Resolves skill ids to runnable skills.
 */
public interface SkillInvoker {

    boolean hasSkill(String skillId);

    /**
     * Returns whether a skill declares streamed output. This is a hint for discovery; the
     * result variant returned by {@link #invoke} is what callers act on.
     *
     * @param skillId the skill id
     * @return {@code false} for unknown skills
     */
    boolean isStreaming(String skillId);

    @Nullable SkillDescriptor describe(String skillId);

    /**
     * Runs a skill against a message, within a task.
     *
     * @param skillId the skill id
     * @param message the inbound message the arguments are extracted from
     * @param task the task the skill runs within
     * @return what the skill produced
     * @throws SkillNotFoundError if no skill has the id
     * @throws Exception whatever the skill body throws
     */
    SkillResult invoke(String skillId, Message message, Task task) throws Exception;
}
