package io.skillagent.server.skills;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.skillagent.spec.Message;
import io.skillagent.spec.SkillNotFoundError;
import io.skillagent.spec.Task;
import io.skillagent.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SkillInvoker} over skills registered at setup time.
 * <pre>{@code
 * SkillRegistry skills = new SkillRegistry()
 *     .register(SkillDescriptor.builder("greet").name("Greeter").build(),
 *         List.of(ParamBinding.text()),
 *         args -> SkillResult.of("Hello, " + args.get(0) + "!"));
 * }</pre>
 */
@ApplicationScoped
public class SkillRegistry implements SkillInvoker {

    private static final Logger LOGGER = LoggerFactory.getLogger(SkillRegistry.class);

    private final Map<String, RegisteredSkill> skills = new ConcurrentHashMap<>();
    private final List<SkillDescriptor> order = new ArrayList<>();

    private record RegisteredSkill(SkillDescriptor descriptor, List<ParamBinding> bindings, SkillFunction function) {
    }

    /**
     * Registers a skill.
     *
     * @param descriptor the skill description, its id must be unused
     * @param bindings one binding per skill argument, empty for the first-text default
     * @param function the skill body
     * @return this registry
     * @throws IllegalArgumentException if a skill with the same id is already registered
     */
    public SkillRegistry register(SkillDescriptor descriptor, List<ParamBinding> bindings, SkillFunction function) {
        Assert.checkNotNullParam("descriptor", descriptor);
        Assert.checkNotNullParam("bindings", bindings);
        Assert.checkNotNullParam("function", function);
        RegisteredSkill skill = new RegisteredSkill(descriptor, List.copyOf(bindings), function);
        synchronized (order) {
            if (skills.putIfAbsent(descriptor.id(), skill) != null) {
                throw new IllegalArgumentException("Skill already registered: " + descriptor.id());
            }
            order.add(descriptor);
        }
        LOGGER.debug("Registered skill {} (streaming={})", descriptor.id(), descriptor.streaming());
        return this;
    }

    public SkillRegistry register(SkillDescriptor descriptor, SkillFunction function) {
        return register(descriptor, List.of(), function);
    }

    /**
     * Returns the descriptors of all registered skills.
     *
     * @return the descriptors in registration order
     */
    public List<SkillDescriptor> skills() {
        synchronized (order) {
            return List.copyOf(order);
        }
    }

    @Override
    public boolean hasSkill(String skillId) {
        return skills.containsKey(skillId);
    }

    @Override
    public boolean isStreaming(String skillId) {
        RegisteredSkill skill = skills.get(skillId);
        return skill != null && skill.descriptor().streaming();
    }

    @Override
    public @Nullable SkillDescriptor describe(String skillId) {
        RegisteredSkill skill = skills.get(skillId);
        return skill == null ? null : skill.descriptor();
    }

    @Override
    public SkillResult invoke(String skillId, Message message, Task task) throws Exception {
        RegisteredSkill skill = skills.get(skillId);
        if (skill == null) {
            throw new SkillNotFoundError(skillId);
        }
        List<@Nullable Object> args = ArgumentExtractor.extract(skill.bindings(), message, task);
        LOGGER.debug("Invoking skill {} for task {}", skillId, task.id());
        SkillResult result = skill.function().apply(args);
        if (result == null) {
            throw new IllegalStateException("Skill " + skillId + " returned no result");
        }
        return result;
    }
}
