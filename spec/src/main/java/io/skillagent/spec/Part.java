package io.skillagent.spec;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/**
 * Base type for content parts within {@link Message}s and {@link Artifact}s.
 * <p>
 * A Part can be:
 * <ul>
 *   <li>{@link TextPart} - plain text content</li>
 *   <li>{@link FilePart} - file content, as bytes or URI</li>
 *   <li>{@link DataPart} - structured data, a JSON object or array</li>
 * </ul>
 * Parts are serialized with a {@code "type"} discriminator property.
 *
 * @param <T> the type of content contained in this part
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type"
)
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextPart.class, name = TextPart.TEXT),
        @JsonSubTypes.Type(value = FilePart.class, name = FilePart.FILE),
        @JsonSubTypes.Type(value = DataPart.class, name = DataPart.DATA)
})
public sealed interface Part<T> permits DataPart, FilePart, TextPart {

    /**
     * The different types of content parts.
     */
    enum Kind {
        TEXT(TextPart.TEXT),
        FILE(FilePart.FILE),
        DATA(DataPart.DATA);

        private final String kind;

        Kind(String kind) {
            this.kind = kind;
        }

        @JsonValue
        public String asString() {
            return this.kind;
        }
    }

    /**
     * Returns the kind of this part.
     *
     * @return the Part.Kind indicating the content type
     */
    Kind kind();

    /**
     * Returns optional metadata associated with this part.
     *
     * @return map of metadata key-value pairs, or null if no metadata
     */
    @Nullable Map<String, Object> metadata();
}
