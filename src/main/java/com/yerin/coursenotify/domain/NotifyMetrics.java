package com.yerin.coursenotify.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class NotifyMetrics {

    private final MeterRegistry registry;

    private final Counter jobEnqueued;
    private final Counter jobCompleted;
    private final Counter attemptFailed;
    private final Counter jobRetried;
    private final Counter jobExhausted;
    private final Counter jobStalled;
    private final Counter jobSkipped;

    public NotifyMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobEnqueued   = Counter.builder("notify_jobs_enqueued_total")
                .description("notification jobs enqueued").register(registry);
        this.jobCompleted  = Counter.builder("notify_jobs_completed_total")
                .description("notification jobs completed (including no-op)").register(registry);
        this.attemptFailed = Counter.builder("notify_jobs_failed_total")
                .description("attempts failed (handler thrown or stalled)").register(registry);
        this.jobRetried    = Counter.builder("notify_jobs_retried_total")
                .description("jobs scheduled for retry").register(registry);
        this.jobExhausted  = Counter.builder("notify_jobs_exhausted_total")
                .description("jobs terminally failed after max attempts").register(registry);
        this.jobStalled    = Counter.builder("notify_jobs_stalled_total")
                .description("active jobs whose lease expired").register(registry);
        this.jobSkipped    = Counter.builder("notify_jobs_skipped_total")
                .description("stream records skipped (unknown type)").register(registry);
    }

    public void incEnqueued()      { jobEnqueued.increment(); }
    public void incCompleted()     { jobCompleted.increment(); }
    public void incAttemptFailed() { attemptFailed.increment(); }
    public void incRetried()       { jobRetried.increment(); }
    public void incExhausted()     { jobExhausted.increment(); }
    public void incStalled()       { jobStalled.increment(); }
    public void incSkipped()       { jobSkipped.increment(); }

    // 타입 태그가 붙은 타이머 제공
    public Timer handlerTimer(String type) {
        return Timer.builder("notify_handler_duration_seconds")
                .description("handler duration by job type")
                .tag("type", type)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
