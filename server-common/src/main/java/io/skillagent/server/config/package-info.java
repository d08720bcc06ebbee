@NullMarked
package io.skillagent.server.config;

import org.jspecify.annotations.NullMarked;
