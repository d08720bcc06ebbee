package io.skillagent.server.util;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import io.skillagent.spec.Artifact;
import io.skillagent.spec.Part;
import io.skillagent.spec.TextPart;

/**
 * Utility functions for creating and accumulating {@link Artifact}s.
 */
public final class ArtifactUtils {

    private ArtifactUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates a complete artifact holding a single text part, with a generated artifact id.
     *
     * @param text the text content
     * @param index the artifact index
     * @return the artifact, marked as the last chunk for {@code index}
     */
    public static Artifact newTextArtifact(String text, int index) {
        return Artifact.builder()
                .artifactId(UUID.randomUUID().toString())
                .parts(new TextPart(text))
                .index(index)
                .lastChunk(true)
                .build();
    }

    /**
     * Creates one streamed text chunk for the artifact at {@code index}.
     *
     * @param text the chunk text, may be empty
     * @param index the artifact index
     * @param append whether the chunk extends what was already sent
     * @param lastChunk whether the chunk closes the artifact
     * @return the chunk
     */
    public static Artifact newTextChunk(String text, int index, boolean append, boolean lastChunk) {
        return Artifact.builder()
                .parts(new TextPart(text))
                .index(index)
                .append(append)
                .lastChunk(lastChunk)
                .build();
    }

    /**
     * Applies a streamed chunk to a stored artifact.
     * <p>
     * With {@code append=true} every chunk part is added to the stored parts; a text part
     * following a trailing text part is concatenated onto it instead of being added. A chunk
     * without {@code append} leaves the parts alone. A non-null {@code lastChunk} on the chunk
     * replaces the stored flag.
     *
     * @param existing the stored artifact
     * @param chunk the chunk
     * @return the merged artifact
     */
    public static Artifact applyChunk(Artifact existing, Artifact chunk) {
        Artifact.Builder merged = Artifact.builder(existing);
        if (Boolean.TRUE.equals(chunk.append())) {
            List<Part<?>> parts = new ArrayList<>(existing.parts());
            for (Part<?> part : chunk.parts()) {
                appendPart(parts, part);
            }
            merged.parts(parts);
        }
        if (chunk.lastChunk() != null) {
            merged.lastChunk(chunk.lastChunk());
        }
        return merged.build();
    }

    private static void appendPart(List<Part<?>> parts, Part<?> part) {
        int last = parts.size() - 1;
        if (last >= 0 && parts.get(last) instanceof TextPart tail && part instanceof TextPart text) {
            parts.set(last, new TextPart(tail.text() + text.text(), tail.metadata()));
        } else {
            parts.add(part);
        }
    }
}
