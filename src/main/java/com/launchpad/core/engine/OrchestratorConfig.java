package com.launchpad.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools and the clock shared by the launch engine.
 * <p>
 * {@code launchRunExecutor} bounds how many launches run at once. {@code agentInvocationExecutor}
 * hosts the individual LLM calls so a timed-out call can be abandoned without blocking its run.
 */
@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "launchRunExecutor", destroyMethod = "shutdown")
    public ExecutorService launchRunExecutor(OrchestratorProperties properties) {
        int threads = Math.max(1, properties.getMaxConcurrentRuns());
        log.info("Launch run pool sized for {} concurrent launches", threads);
        return Executors.newFixedThreadPool(threads, daemonThreads("launch-run-"));
    }

    @Bean(name = "agentInvocationExecutor", destroyMethod = "shutdown")
    public ExecutorService agentInvocationExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("agent-call-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
