package io.skillagent.server.skills;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import io.skillagent.util.Assert;

/**
 * What a skill produced: a single value, or a lazy sequence of text chunks.
 * <p>
 * The skill body picks the variant when it runs; callers switch on it.
 * A {@link Streamed} sequence can be consumed once.
 */
public sealed interface SkillResult {

    record Immediate(String value) implements SkillResult {
        public Immediate {
            Assert.checkNotNullParam("value", value);
        }
    }

    record Streamed(Iterator<String> chunks) implements SkillResult {
        public Streamed {
            Assert.checkNotNullParam("chunks", chunks);
        }
    }

    static SkillResult of(String value) {
        return new Immediate(value);
    }

    static SkillResult streamed(Iterator<String> chunks) {
        return new Streamed(chunks);
    }

    static SkillResult streamed(Stream<String> chunks) {
        return new Streamed(chunks.iterator());
    }

    static SkillResult streamed(String... chunks) {
        return new Streamed(List.of(chunks).iterator());
    }
}
