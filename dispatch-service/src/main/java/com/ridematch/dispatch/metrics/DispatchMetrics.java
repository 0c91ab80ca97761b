package com.ridematch.dispatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Custom Micrometer metrics for the Dispatch Service.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   dispatch_offers_sent_total
 *   dispatch_offer_notifications_failed_total
 *   dispatch_offers_cancelled_total{reason="RIDE_TAKEN|RIDE_CANCELLED"}
 *   dispatch_delayed_batches_total{outcome="sent|skipped"}
 *   dispatch_no_driver_found_total
 *   dispatch_candidate_search_failures_total
 *   dispatch_latency_seconds{quantile="0.5|0.95|0.99"}   time to handle ride.requested, whatever the outcome
 */
@Component
public class DispatchMetrics {

    private final MeterRegistry registry;
    private final Counter offersSentCounter;
    private final Counter offerNotificationFailedCounter;
    private final Counter delayedBatchSentCounter;
    private final Counter delayedBatchSkippedCounter;
    private final Counter noDriverFoundCounter;
    private final Counter candidateSearchFailureCounter;
    private final Timer   dispatchLatencyTimer;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.offersSentCounter = Counter.builder("dispatch.offers.sent")
                .description("Ride offers pushed to drivers")
                .register(registry);

        this.offerNotificationFailedCounter = Counter.builder("dispatch.offer.notifications.failed")
                .description("Ride offers that could not be handed to the notification channel")
                .register(registry);

        this.delayedBatchSentCounter = Counter.builder("dispatch.delayed.batches")
                .tag("outcome", "sent")
                .description("Delayed offer batches sent after the retry delay")
                .register(registry);

        this.delayedBatchSkippedCounter = Counter.builder("dispatch.delayed.batches")
                .tag("outcome", "skipped")
                .description("Delayed offer batches dropped because the ride was no longer pending")
                .register(registry);

        this.noDriverFoundCounter = Counter.builder("dispatch.no_driver_found")
                .description("Ride requests with no available driver nearby")
                .register(registry);

        this.candidateSearchFailureCounter = Counter.builder("dispatch.candidate_search.failures")
                .description("Dispatch attempts aborted because candidate search failed")
                .register(registry);

        // p50, p95, p99 histogram published to Prometheus
        this.dispatchLatencyTimer = Timer.builder("dispatch.latency")
                .description("Time to handle a ride request: first batch sent, no drivers found or search failed")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofMillis(5))
                .maximumExpectedValue(Duration.ofSeconds(2))
                .register(registry);
    }

    public void recordOfferSent()               { offersSentCounter.increment(); }
    public void recordOfferNotificationFailed() { offerNotificationFailedCounter.increment(); }
    public void recordDelayedBatchSent()        { delayedBatchSentCounter.increment(); }
    public void recordDelayedBatchSkipped()     { delayedBatchSkippedCounter.increment(); }
    public void recordNoDriverFound()           { noDriverFoundCounter.increment(); }
    public void recordCandidateSearchFailure()  { candidateSearchFailureCounter.increment(); }
    public Timer getDispatchLatencyTimer()      { return dispatchLatencyTimer; }

    public void recordOffersCancelled(String reason, int count) {
        if (count > 0) {
            Counter.builder("dispatch.offers.cancelled")
                    .tag("reason", reason)
                    .description("Outstanding offers withdrawn after accept or cancel")
                    .register(registry)
                    .increment(count);
        }
    }
}
