@NullMarked
package io.skillagent.server.events;

import org.jspecify.annotations.NullMarked;
