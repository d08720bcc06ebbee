@NullMarked
package io.skillagent.server.util;

import org.jspecify.annotations.NullMarked;
