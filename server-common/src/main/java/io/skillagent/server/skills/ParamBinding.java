package io.skillagent.server.skills;

import io.skillagent.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Declares where one skill argument comes from.
 * <p>
 * A skill lists one binding per parameter, in parameter order. {@link Kind#TEXT},
 * {@link Kind#FILE} and {@link Kind#DATA} bindings pick a part of the inbound message: the
 * first part of that type, or the part at {@code partIndex} when one is given.
 *
 * <pre>{@code
 * List<ParamBinding> bindings = List.of(ParamBinding.text(), ParamBinding.data(1), ParamBinding.task());
 * }</pre>
 *
 * @param kind what the argument is bound to
 * @param partIndex optional position of the part within the message
 */
public record ParamBinding(Kind kind, @Nullable Integer partIndex) {

    public ParamBinding {
        Assert.checkNotNullParam("kind", kind);
        if (partIndex != null && partIndex < 0) {
            throw new IllegalArgumentException("partIndex must not be negative");
        }
    }

    public enum Kind {
        /** Text of a text part, {@code ""} when absent. */
        TEXT,
        /** The {@code FileContent} of a file part, {@code null} when absent. */
        FILE,
        /** The payload of a data part, {@code null} when absent. */
        DATA,
        /** The whole inbound message. */
        MESSAGE,
        /** The task the skill runs within. */
        TASK,
        /** All parts of the inbound message. */
        PARTS
    }

    public static ParamBinding text() {
        return new ParamBinding(Kind.TEXT, null);
    }

    public static ParamBinding text(int partIndex) {
        return new ParamBinding(Kind.TEXT, partIndex);
    }

    public static ParamBinding file() {
        return new ParamBinding(Kind.FILE, null);
    }

    public static ParamBinding file(int partIndex) {
        return new ParamBinding(Kind.FILE, partIndex);
    }

    public static ParamBinding data() {
        return new ParamBinding(Kind.DATA, null);
    }

    public static ParamBinding data(int partIndex) {
        return new ParamBinding(Kind.DATA, partIndex);
    }

    public static ParamBinding message() {
        return new ParamBinding(Kind.MESSAGE, null);
    }

    public static ParamBinding task() {
        return new ParamBinding(Kind.TASK, null);
    }

    public static ParamBinding parts() {
        return new ParamBinding(Kind.PARTS, null);
    }
}
