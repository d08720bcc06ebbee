package io.skillagent.spec;

import static io.skillagent.spec.FilePart.FILE;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.skillagent.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * File content within a {@link Message} or {@link Artifact}, either embedded as
 * base64 bytes ({@link FileWithBytes}) or referenced by URI ({@link FileWithUri}).
 *
 * @param file the file content
 * @param metadata optional metadata
 */
@JsonTypeName(FILE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FilePart(@JsonProperty("file") FileContent file,
                       @JsonProperty("metadata") @Nullable Map<String, Object> metadata) implements Part<FileContent> {

    public static final String FILE = "file";

    @JsonCreator
    public FilePart {
        Assert.checkNotNullParam("file", file);
        metadata = (metadata != null) ? Map.copyOf(metadata) : null;
    }

    public FilePart(FileContent file) {
        this(file, null);
    }

    @JsonIgnore
    @Override
    public Kind kind() {
        return Kind.FILE;
    }
}
