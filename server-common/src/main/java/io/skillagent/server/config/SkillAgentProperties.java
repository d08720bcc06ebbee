package io.skillagent.server.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server settings, read from the {@code skill-agent.properties} classpath resource. A system
 * property with the same key overrides the file.
 * <ul>
 *   <li>{@code skill-agent.executor.pool-size}: threads shared by dispatched requests, {@code 0}
 *       (the default) runs them on the common fork-join pool</li>
 *   <li>{@code skill-agent.sse.event-id-prefix}: prefix of Server-Sent-Event ids, default
 *       {@code sse-evt-}</li>
 * </ul>
 */
@ApplicationScoped
public class SkillAgentProperties {

    private static final Logger LOGGER = LoggerFactory.getLogger(SkillAgentProperties.class);

    public static final String RESOURCE = "/skill-agent.properties";
    public static final String EXECUTOR_POOL_SIZE = "skill-agent.executor.pool-size";
    public static final String SSE_EVENT_ID_PREFIX = "skill-agent.sse.event-id-prefix";

    static final String DEFAULT_SSE_EVENT_ID_PREFIX = "sse-evt-";

    private final Properties properties;
    private volatile @Nullable ExecutorService executor;

    public SkillAgentProperties() {
        this(load(RESOURCE));
    }

    public SkillAgentProperties(Properties properties) {
        this.properties = properties;
    }

    static Properties load(String resource) {
        Properties properties = new Properties();
        URL url = SkillAgentProperties.class.getResource(resource);
        if (url == null) {
            LOGGER.debug("No {} on the classpath, using defaults", resource);
            return properties;
        }
        try (InputStream in = url.openStream()) {
            properties.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + resource, e);
        }
        return properties;
    }

    public @Nullable String get(String key) {
        String value = System.getProperty(key);
        return value != null ? value : properties.getProperty(key);
    }

    public int executorPoolSize() {
        String value = get(EXECUTOR_POOL_SIZE);
        if (value == null || value.isBlank()) {
            return 0;
        }
        int size;
        try {
            size = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(EXECUTOR_POOL_SIZE + " must be an integer: " + value, e);
        }
        if (size < 0) {
            throw new IllegalStateException(EXECUTOR_POOL_SIZE + " must not be negative: " + size);
        }
        return size;
    }

    public String sseEventIdPrefix() {
        String value = get(SSE_EVENT_ID_PREFIX);
        return value != null ? value : DEFAULT_SSE_EVENT_ID_PREFIX;
    }

    /**
     * Returns the executor requests are dispatched on. A fixed pool is created on first use and
     * shared afterwards.
     *
     * @return the executor
     */
    public Executor executor() {
        int size = executorPoolSize();
        if (size == 0) {
            return ForkJoinPool.commonPool();
        }
        ExecutorService current = executor;
        if (current == null) {
            synchronized (this) {
                current = executor;
                if (current == null) {
                    LOGGER.debug("Creating dispatch pool with {} threads", size);
                    current = Executors.newFixedThreadPool(size, new DispatchThreadFactory());
                    executor = current;
                }
            }
        }
        return current;
    }

    @PreDestroy
    void shutdown() {
        ExecutorService current = executor;
        if (current != null) {
            LOGGER.debug("Shutting down dispatch pool");
            current.shutdown();
        }
    }

    private static final class DispatchThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "skill-agent-dispatch-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
