/**
 * Server-Sent-Events framing of streamed task events.
 */
@NullMarked
package io.skillagent.transport.jsonrpc.sse;

import org.jspecify.annotations.NullMarked;
