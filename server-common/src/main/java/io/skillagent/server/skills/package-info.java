/**
 * Skill registration and invocation.
 * <p>
 * Skills are plain functions registered with a {@link io.skillagent.server.skills.SkillDescriptor} and
 * a list of {@link io.skillagent.server.skills.ParamBinding}s that say how each argument is taken
 * from the inbound message.
 */
@NullMarked
package io.skillagent.server.skills;

import org.jspecify.annotations.NullMarked;
