/**
 * Task lifecycle: the state machine and the store that owns every task record.
 */
@NullMarked
package io.skillagent.server.tasks;

import org.jspecify.annotations.NullMarked;
