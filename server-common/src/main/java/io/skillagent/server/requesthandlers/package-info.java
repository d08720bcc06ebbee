@NullMarked
package io.skillagent.server.requesthandlers;

import org.jspecify.annotations.NullMarked;
