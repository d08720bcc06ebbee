package io.skillagent.spec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.skillagent.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * File content embedded as a base64 string.
 *
 * @param mimeType optional MIME type
 * @param name optional file name
 * @param bytes base64-encoded content
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(using = JsonDeserializer.None.class)
public record FileWithBytes(@Nullable String mimeType, @Nullable String name, String bytes) implements FileContent {

    public FileWithBytes {
        Assert.checkNotNullParam("bytes", bytes);
    }
}
