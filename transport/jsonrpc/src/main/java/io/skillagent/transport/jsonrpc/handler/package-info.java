/**
 * JSON-RPC 2.0 dispatch of the task methods.
 *
 * <p>{@link io.skillagent.transport.jsonrpc.handler.JSONRPCHandler} accepts parsed envelopes or
 * raw request bodies, including batches, and never lets an error escape: every failure is
 * answered with an error envelope.
 *
 * @see io.skillagent.transport.jsonrpc.handler.JSONRPCHandler
 */
@NullMarked
package io.skillagent.transport.jsonrpc.handler;

import org.jspecify.annotations.NullMarked;
