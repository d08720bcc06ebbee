package io.skillagent.transport.jsonrpc.handler;

import static io.skillagent.spec.A2AMethods.TASKS_CANCEL;
import static io.skillagent.spec.A2AMethods.TASKS_GET;
import static io.skillagent.spec.A2AMethods.TASKS_SEND;
import static io.skillagent.spec.A2AMethods.TASKS_SEND_SUBSCRIBE;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.skillagent.server.config.SkillAgentProperties;
import io.skillagent.server.events.EventSink;
import io.skillagent.server.requesthandlers.RequestHandler;
import io.skillagent.spec.A2AError;
import io.skillagent.spec.InvalidParamsError;
import io.skillagent.spec.InvalidRequestError;
import io.skillagent.spec.JSONParseError;
import io.skillagent.spec.JSONRPCRequest;
import io.skillagent.spec.JSONRPCResponse;
import io.skillagent.spec.MethodNotFoundError;
import io.skillagent.spec.TaskIdParams;
import io.skillagent.spec.TaskQueryParams;
import io.skillagent.spec.TaskSendParams;
import io.skillagent.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 dispatcher for the task methods.
 *
 * <p>Maps a request envelope to the {@link MethodHandler} registered for its method and wraps
 * the outcome in a response envelope. Errors never escape: every failure is returned as an
 * {@code error} response carrying the request id, or {@code null} when the request had none.
 * Handlers run on the configured {@link Executor}.
 *
 * <h2>Methods</h2>
 * <ul>
 *   <li>{@code tasks/send}, {@code tasks/get}, {@code tasks/cancel} are registered at
 *       construction and answered with a single response</li>
 *   <li>{@code tasks/sendSubscribe} streams its events to an {@link EventSink}, see
 *       {@link #onSendSubscribe(JSONRPCRequest, EventSink)}</li>
 * </ul>
 * More methods can be registered at runtime.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * {"jsonrpc": "2.0", "id": 1, "method": "tasks/send",
 *  "params": {"id": "task-1", "message": {"role": "user", "parts": [{"type": "text", "text": "World"}]},
 *             "metadata": {"skillId": "greet"}}}
 * }</pre>
 * answered with
 * <pre>{@code
 * {"jsonrpc": "2.0", "id": 1, "result": {"id": "task-1", "status": {"state": "completed", ...}, ...}}
 * }</pre>
 *
 * @see RequestHandler
 */
@ApplicationScoped
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    // Fields set by constructor injection cannot be final, the no-args constructor is needed
    // for CDI proxies
    private Map<String, MethodHandler> methods;
    private RequestHandler requestHandler;
    private Executor executor;
    private ObjectMapper mapper;

    @SuppressWarnings("NullAway")
    protected JSONRPCHandler() {
        // For CDI proxy creation
        this.methods = null;
        this.requestHandler = null;
        this.executor = null;
        this.mapper = null;
    }

    @Inject
    public JSONRPCHandler(RequestHandler requestHandler, SkillAgentProperties properties) {
        this(requestHandler, properties.executor());
    }

    /**
     * Creates a dispatcher with the task methods registered.
     *
     * @param requestHandler the handler of the task methods
     * @param executor the executor handlers run on
     */
    public JSONRPCHandler(RequestHandler requestHandler, Executor executor) {
        this.methods = new LinkedHashMap<>();
        this.requestHandler = requestHandler;
        this.executor = executor;
        this.mapper = Utils.OBJECT_MAPPER;

        register(TASKS_SEND, params -> requestHandler.onSend(bind(params, TaskSendParams.class)));
        register(TASKS_GET, params -> requestHandler.onGet(bind(params, TaskQueryParams.class)));
        register(TASKS_CANCEL, params -> requestHandler.onCancel(bind(params, TaskIdParams.class)));
    }

    /**
     * Registers a handler, replacing any handler already registered for the method.
     *
     * @param method the method name
     * @param handler the handler
     * @return this dispatcher
     */
    public JSONRPCHandler register(String method, MethodHandler handler) {
        synchronized (methods) {
            methods.put(method, handler);
        }
        return this;
    }

    public boolean unregister(String method) {
        synchronized (methods) {
            return methods.remove(method) != null;
        }
    }

    public boolean hasMethod(String method) {
        synchronized (methods) {
            return methods.containsKey(method);
        }
    }

    /**
     * Returns the registered method names.
     *
     * @return the names in registration order
     */
    public List<String> getMethods() {
        synchronized (methods) {
            return List.copyOf(methods.keySet());
        }
    }

    /**
     * Returns whether a request must be answered as a stream through
     * {@link #onSendSubscribe(JSONRPCRequest, EventSink)}.
     *
     * @param request the request
     * @return {@code true} for {@code tasks/sendSubscribe}
     */
    public boolean isStreamingRequest(JSONRPCRequest request) {
        return TASKS_SEND_SUBSCRIBE.equals(request.method());
    }

    /**
     * Dispatches a single request.
     *
     * @param request the request envelope
     * @return the response envelope; the future never completes exceptionally
     */
    public CompletableFuture<JSONRPCResponse> handle(JSONRPCRequest request) {
        Object id = request.id();
        A2AError invalid = validateEnvelope(request);
        if (invalid != null) {
            return CompletableFuture.completedFuture(JSONRPCResponse.error(id, invalid));
        }
        String method = (String) request.method();
        MethodHandler handler;
        synchronized (methods) {
            handler = methods.get(method);
        }
        if (handler == null) {
            LOGGER.debug("No handler for method {}", method);
            return CompletableFuture.completedFuture(JSONRPCResponse.error(id, new MethodNotFoundError(method)));
        }

        JsonNode params = paramsOf(request);
        LOGGER.debug("Dispatching {} (id={})", method, id);
        return CompletableFuture
                .supplyAsync(() -> invoke(handler, params), executor)
                .handle((result, throwable) -> {
                    if (throwable == null) {
                        return JSONRPCResponse.success(id, result);
                    }
                    A2AError error = A2AError.from(unwrap(throwable));
                    LOGGER.debug("Method {} failed (id={}): {}", method, id, error.getMessage());
                    return JSONRPCResponse.error(id, error);
                });
    }

    /**
     * Dispatches a batch of requests concurrently.
     *
     * @param requests the requests
     * @return one response per request, in request order
     */
    public CompletableFuture<List<JSONRPCResponse>> handleBatch(List<JSONRPCRequest> requests) {
        List<CompletableFuture<JSONRPCResponse>> responses = new ArrayList<>(requests.size());
        for (JSONRPCRequest request : requests) {
            responses.add(handle(request));
        }
        return CompletableFuture.allOf(responses.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> responses.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Dispatches a raw request body, a single request object or a batch array.
     * <p>
     * A body that is not JSON is answered with a parse error, an empty batch with an invalid
     * request error. Batches are answered with an array.
     *
     * @param body the HTTP request body
     * @return the serialized response
     */
    public CompletableFuture<String> handleRequestBody(String body) {
        JsonNode tree;
        try {
            tree = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Unparseable request body: {}", e.getOriginalMessage());
            return CompletableFuture.completedFuture(Utils.toJson(JSONRPCResponse.error(null, new JSONParseError())));
        }
        if (tree == null || tree.isMissingNode()) {
            return CompletableFuture.completedFuture(Utils.toJson(JSONRPCResponse.error(null, new JSONParseError())));
        }

        if (tree instanceof ArrayNode batch) {
            if (batch.isEmpty()) {
                return CompletableFuture.completedFuture(
                        Utils.toJson(JSONRPCResponse.error(null, new InvalidRequestError())));
            }
            List<CompletableFuture<JSONRPCResponse>> responses = new ArrayList<>(batch.size());
            for (JsonNode element : batch) {
                responses.add(handleNode(element));
            }
            return CompletableFuture.allOf(responses.toArray(new CompletableFuture[0]))
                    .thenApply(ignored -> Utils.toJson(responses.stream().map(CompletableFuture::join).toList()));
        }
        return handleNode(tree).thenApply(Utils::toJson);
    }

    /**
     * Runs a {@code tasks/sendSubscribe} request, writing its events to {@code sink}.
     * <p>
     * An invalid envelope or params is written to the sink as an error event and the sink is
     * closed. Otherwise the stream is produced on the executor; the sink is always closed when
     * it ends.
     *
     * @param request the request envelope
     * @param sink the sink bound to the request id
     * @return a future completing when the stream has ended
     */
    public CompletableFuture<Void> onSendSubscribe(JSONRPCRequest request, EventSink sink) {
        TaskSendParams params;
        try {
            A2AError invalid = validateEnvelope(request);
            if (invalid != null) {
                throw invalid;
            }
            if (!isStreamingRequest(request)) {
                throw new InvalidRequestError("Method " + request.method() + " does not stream");
            }
            params = bind(paramsOf(request), TaskSendParams.class);
        } catch (A2AError e) {
            sink.writeError(e);
            sink.close();
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> requestHandler.onSendSubscribe(params, sink), executor)
                .exceptionally(throwable -> {
                    LOGGER.warn("Stream for request {} ended abnormally", request.id(), unwrap(throwable));
                    sink.close();
                    return null;
                });
    }

    private CompletableFuture<JSONRPCResponse> handleNode(JsonNode node) {
        if (!node.isObject()) {
            return CompletableFuture.completedFuture(JSONRPCResponse.error(null, new InvalidRequestError()));
        }
        JSONRPCRequest request;
        try {
            request = mapper.treeToValue(node, JSONRPCRequest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.completedFuture(JSONRPCResponse.error(idOf(node), new InvalidRequestError()));
        }
        return handle(request);
    }

    private JsonNode paramsOf(JSONRPCRequest request) {
        JsonNode params = request.params();
        return params == null || params.isNull() ? mapper.createObjectNode() : params;
    }

    private static @Nullable Object idOf(JsonNode node) {
        JsonNode id = node.get("id");
        if (id == null || id.isNull()) {
            return null;
        }
        return id.isNumber() ? id.numberValue() : id.asText();
    }

    private static @Nullable A2AError validateEnvelope(JSONRPCRequest request) {
        if (!JSONRPCRequest.JSONRPC_VERSION.equals(request.jsonrpc())) {
            return new InvalidRequestError("Invalid JSON-RPC version");
        }
        if (!(request.method() instanceof String)) {
            return new InvalidRequestError("Method must be a string");
        }
        return null;
    }

    private <T> T bind(JsonNode params, Class<T> type) {
        try {
            return mapper.treeToValue(params, type);
        } catch (JsonProcessingException e) {
            throw new InvalidParamsError("Invalid params: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            throw new InvalidParamsError("Invalid params: " + e.getMessage());
        }
    }

    private static Object invoke(MethodHandler handler, JsonNode params) {
        try {
            return handler.handle(params);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
