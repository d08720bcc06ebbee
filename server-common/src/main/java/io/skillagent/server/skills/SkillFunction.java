package io.skillagent.server.skills;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * The body of a skill.
 * <p>
 * {@code args} holds one value per declared {@link ParamBinding}, in declaration order, or the
 * text of the first text part alone when the skill declares no bindings. File bindings receive
 * the {@link io.skillagent.spec.FileContent} and data bindings the JSON object or array; absent
 * file and data parts are passed as {@code null}.
 */
@FunctionalInterface
public interface SkillFunction {

    SkillResult apply(List<@Nullable Object> args) throws Exception;
}
