package fr.lapetina.workerpool.domain.model;

import java.time.Duration;

/**
 * Per-job submission options. Every field is optional.
 *
 * @param priority         carried with the job; the queue itself stays FIFO
 * @param maxAttempts      overrides the configured retry budget
 * @param strategy         load-balancing strategy name for this job only
 * @param executionTimeout overrides the configured execution timeout
 */
public record SubmitOptions(
        Integer priority,
        Integer maxAttempts,
        String strategy,
        Duration executionTimeout
) {
    public static final SubmitOptions DEFAULTS = new SubmitOptions(null, null, null, null);

    public static SubmitOptions defaults() {
        return DEFAULTS;
    }

    public SubmitOptions withPriority(int priority) {
        return new SubmitOptions(priority, maxAttempts, strategy, executionTimeout);
    }

    public SubmitOptions withMaxAttempts(int maxAttempts) {
        return new SubmitOptions(priority, maxAttempts, strategy, executionTimeout);
    }

    public SubmitOptions withStrategy(String strategy) {
        return new SubmitOptions(priority, maxAttempts, strategy, executionTimeout);
    }

    public SubmitOptions withExecutionTimeout(Duration executionTimeout) {
        return new SubmitOptions(priority, maxAttempts, strategy, executionTimeout);
    }
}
