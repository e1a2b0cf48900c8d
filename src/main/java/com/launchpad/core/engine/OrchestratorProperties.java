package com.launchpad.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tuning for launch runs, bound from {@code launchpad.orchestrator.*}.
 */
@Component
@ConfigurationProperties(prefix = "launchpad.orchestrator")
public class OrchestratorProperties {

    /** Retries after the first failed invocation; 2 means at most 3 attempts per handler. */
    private int maxRetries = 2;

    /** Fixed pause between attempts. */
    private Duration retryDelay = Duration.ofMillis(500);

    /** Upper bound for one invocation. */
    private Duration invocationTimeout = Duration.ofSeconds(60);

    /** Launches run concurrently on the run pool. */
    private int maxConcurrentRuns = 4;

    /** When true, start and resume return immediately and the run continues in the background. */
    private boolean asyncStart = true;

    /** Resume in-progress launches once the application is ready. */
    private boolean resumeOnStartup = true;

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public Duration getRetryDelay() { return retryDelay; }
    public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }
    public Duration getInvocationTimeout() { return invocationTimeout; }
    public void setInvocationTimeout(Duration invocationTimeout) { this.invocationTimeout = invocationTimeout; }
    public int getMaxConcurrentRuns() { return maxConcurrentRuns; }
    public void setMaxConcurrentRuns(int maxConcurrentRuns) { this.maxConcurrentRuns = maxConcurrentRuns; }
    public boolean isAsyncStart() { return asyncStart; }
    public void setAsyncStart(boolean asyncStart) { this.asyncStart = asyncStart; }
    public boolean isResumeOnStartup() { return resumeOnStartup; }
    public void setResumeOnStartup(boolean resumeOnStartup) { this.resumeOnStartup = resumeOnStartup; }
}
