package com.hcpbridge.leadwebhook.infrastructure.hcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Keeps consecutive HCP calls at least {@code minInterval} apart, process-wide.
 * Each subscription reserves the next free start slot and is delayed until it; a resubscription made by a
 * retry reserves a new slot.
 */
public class HcpCallPacer {

    private static final Logger logger = LoggerFactory.getLogger(HcpCallPacer.class);
    private final long minIntervalMillis;
    private final Scheduler scheduler;
    private long nextSlotMillis = Long.MIN_VALUE;

    public HcpCallPacer(Duration minInterval, Scheduler scheduler) {
        this.minIntervalMillis = minInterval.toMillis();
        this.scheduler = scheduler;
    }

    public <T> Mono<T> pace(Mono<T> call) {
        return Mono.defer(() -> {
            long waitMillis = reserveSlot();
            if (waitMillis <= 0) {
                return call;
            }
            logger.debug("Delaying HCP call by {} ms", waitMillis);
            return Mono.delay(Duration.ofMillis(waitMillis), scheduler).then(call);
        });
    }

    synchronized long reserveSlot() {
        long now = scheduler.now(TimeUnit.MILLISECONDS);
        long start = Math.max(now, nextSlotMillis);
        nextSlotMillis = start + minIntervalMillis;
        return start - now;
    }
}
