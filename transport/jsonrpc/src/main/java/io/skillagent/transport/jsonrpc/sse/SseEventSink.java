package io.skillagent.transport.jsonrpc.sse;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.skillagent.server.events.EventSink;
import io.skillagent.spec.Artifact;
import io.skillagent.spec.JSONRPCError;
import io.skillagent.spec.JSONRPCRequest;
import io.skillagent.spec.JSONRPCResponse;
import io.skillagent.spec.TaskArtifactUpdateEvent;
import io.skillagent.spec.TaskStatus;
import io.skillagent.spec.TaskStatusUpdateEvent;
import io.skillagent.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventSink} writing Server-Sent Events for one {@code tasks/sendSubscribe} request.
 * <p>
 * Every event is a JSON-RPC response envelope carrying the request id:
 * <pre>
 * id: sse-evt-1
 * event: message
 * data: {"jsonrpc":"2.0","id":1,"result":{"id":"task-1","status":{"state":"working",...},"final":false}}
 *
 * </pre>
 * A failed write marks the sink closed, which stops the producer at its next check.
 */
public class SseEventSink implements EventSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(SseEventSink.class);

    /**
     * Response headers for an event stream.
     */
    public static final Map<String, String> HEADERS;

    static {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "text/event-stream");
        headers.put("Cache-Control", "no-cache");
        headers.put("Connection", "keep-alive");
        headers.put("X-Accel-Buffering", "no");
        HEADERS = Collections.unmodifiableMap(headers);
    }

    /**
     * Destination of the raw event text, typically the HTTP response body.
     */
    @FunctionalInterface
    public interface Writer {
        void write(String text) throws IOException;
    }

    private final Writer writer;
    private final Runnable onClose;
    private final @Nullable Object requestId;
    private final String eventIdPrefix;

    private long eventId;
    // no further events are written
    private boolean closed;
    // onClose has run
    private boolean finished;

    /**
     * Creates a sink.
     *
     * @param writer where events are written
     * @param onClose called once when the sink is closed, e.g. to end the response
     * @param requestId the id of the request the events answer
     * @param eventIdPrefix prefix of the SSE event ids
     */
    public SseEventSink(Writer writer, Runnable onClose, @Nullable Object requestId, String eventIdPrefix) {
        this.writer = writer;
        this.onClose = onClose;
        this.requestId = requestId;
        this.eventIdPrefix = eventIdPrefix;
    }

    @Override
    public void writeStatus(String taskId, TaskStatus status, boolean isFinal) {
        write(JSONRPCResponse.success(requestId, new TaskStatusUpdateEvent(taskId, status, isFinal)));
    }

    @Override
    public void writeArtifact(String taskId, Artifact artifact) {
        write(JSONRPCResponse.success(requestId, new TaskArtifactUpdateEvent(taskId, artifact)));
    }

    @Override
    public void writeError(int code, String message, @Nullable Object data) {
        write(new JSONRPCResponse(JSONRPCRequest.JSONRPC_VERSION, requestId, null, new JSONRPCError(code, message, data)));
    }

    @Override
    public synchronized boolean isOpen() {
        return !closed;
    }

    /**
     * Marks the caller as gone without ending the response, e.g. from a connection close listener.
     */
    public synchronized void disconnected() {
        if (!closed) {
            LOGGER.debug("Client of request {} disconnected", requestId);
            closed = true;
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (finished) {
                return;
            }
            finished = true;
            closed = true;
        }
        onClose.run();
    }

    private synchronized void write(JSONRPCResponse response) {
        if (closed) {
            LOGGER.debug("Dropping event for request {}, sink is closed", requestId);
            return;
        }
        long id = ++eventId;
        String event = "id: " + eventIdPrefix + id + "\n"
                + "event: message\n"
                + "data: " + Utils.toJson(response) + "\n\n";
        try {
            writer.write(event);
        } catch (IOException e) {
            LOGGER.warn("Unable to write event {} for request {}, closing stream", id, requestId, e);
            closed = true;
        }
    }
}
