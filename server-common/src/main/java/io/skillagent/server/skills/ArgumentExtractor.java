package io.skillagent.server.skills;

import java.util.ArrayList;
import java.util.List;

import io.skillagent.spec.DataPart;
import io.skillagent.spec.FilePart;
import io.skillagent.spec.Message;
import io.skillagent.spec.Part;
import io.skillagent.spec.Task;
import io.skillagent.spec.TextPart;
import org.jspecify.annotations.Nullable;

/**
 * Computes skill arguments from an inbound message and its task.
 * <p>
 * Each binding is evaluated on its own. A positional binding that points past the parts, or at
 * a part of another type, is treated as absent.
 */
public final class ArgumentExtractor {

    private ArgumentExtractor() {
    }

    /**
     * Extracts one argument per binding, or the first text alone when there are no bindings.
     *
     * @param bindings the declared bindings, in parameter order
     * @param message the inbound message
     * @param task the task
     * @return the arguments; absent file and data parts are {@code null} entries
     */
    public static List<@Nullable Object> extract(List<ParamBinding> bindings, Message message, Task task) {
        if (bindings.isEmpty()) {
            List<@Nullable Object> args = new ArrayList<>(1);
            args.add(text(message, null));
            return args;
        }
        List<@Nullable Object> args = new ArrayList<>(bindings.size());
        for (ParamBinding binding : bindings) {
            args.add(extract(binding, message, task));
        }
        return args;
    }

    static @Nullable Object extract(ParamBinding binding, Message message, Task task) {
        return switch (binding.kind()) {
            case TEXT -> text(message, binding.partIndex());
            case FILE -> {
                FilePart part = find(message, FilePart.class, binding.partIndex());
                yield part == null ? null : part.file();
            }
            case DATA -> {
                DataPart part = find(message, DataPart.class, binding.partIndex());
                yield part == null ? null : part.data();
            }
            case MESSAGE -> message;
            case TASK -> task;
            case PARTS -> message.parts();
        };
    }

    private static String text(Message message, @Nullable Integer partIndex) {
        TextPart part = find(message, TextPart.class, partIndex);
        return part == null ? "" : part.text();
    }

    private static <P extends Part<?>> @Nullable P find(Message message, Class<P> type, @Nullable Integer partIndex) {
        List<Part<?>> parts = message.parts();
        if (partIndex != null) {
            if (partIndex >= parts.size()) {
                return null;
            }
            Part<?> part = parts.get(partIndex);
            return type.isInstance(part) ? type.cast(part) : null;
        }
        for (Part<?> part : parts) {
            if (type.isInstance(part)) {
                return type.cast(part);
            }
        }
        return null;
    }
}
