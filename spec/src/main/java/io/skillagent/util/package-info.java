@NullMarked
package io.skillagent.util;

import org.jspecify.annotations.NullMarked;
