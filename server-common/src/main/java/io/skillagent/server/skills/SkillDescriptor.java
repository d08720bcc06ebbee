package io.skillagent.server.skills;

import java.util.List;

import io.skillagent.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Describes a registered skill. Only {@code id} and {@code streaming} matter when tasks run;
 * the rest is carried for discovery.
 *
 * @param id unique skill id, routed through {@code metadata.skillId}
 * @param name human-readable name, defaults to the id
 * @param description optional description
 * @param tags keywords
 * @param examples example prompts
 * @param inputModes accepted input media types
 * @param outputModes produced output media types
 * @param streaming whether the skill produces its result as a sequence of chunks
 */
public record SkillDescriptor(String id,
                              String name,
                              @Nullable String description,
                              List<String> tags,
                              List<String> examples,
                              List<String> inputModes,
                              List<String> outputModes,
                              boolean streaming) {

    public SkillDescriptor {
        Assert.checkNotEmptyParam("id", id);
        name = name == null ? id : name;
        tags = tags == null ? List.of() : List.copyOf(tags);
        examples = examples == null ? List.of() : List.copyOf(examples);
        inputModes = inputModes == null ? List.of() : List.copyOf(inputModes);
        outputModes = outputModes == null ? List.of() : List.copyOf(outputModes);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private @Nullable String name;
        private @Nullable String description;
        private @Nullable List<String> tags;
        private @Nullable List<String> examples;
        private @Nullable List<String> inputModes;
        private @Nullable List<String> outputModes;
        private boolean streaming;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder examples(List<String> examples) {
            this.examples = examples;
            return this;
        }

        public Builder inputModes(List<String> inputModes) {
            this.inputModes = inputModes;
            return this;
        }

        public Builder outputModes(List<String> outputModes) {
            this.outputModes = outputModes;
            return this;
        }

        public Builder streaming(boolean streaming) {
            this.streaming = streaming;
            return this;
        }

        public SkillDescriptor build() {
            return new SkillDescriptor(id, name, description, tags, examples, inputModes, outputModes, streaming);
        }
    }
}
