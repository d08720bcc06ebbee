package io.skillagent.transport.jsonrpc.handler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handles one JSON-RPC method.
 * <p>
 * The returned value becomes the {@code result} of the response. Anything thrown becomes the
 * {@code error}: an {@link io.skillagent.spec.A2AError} keeps its code, anything else is
 * reported as an internal error.
 */
@FunctionalInterface
public interface MethodHandler {

    /**
     * @param params the request params, an empty object when the request had none
     * @return the result
     * @throws Exception if the method fails
     */
    Object handle(JsonNode params) throws Exception;
}
