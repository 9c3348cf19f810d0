package com.hcpbridge.leadwebhook.infrastructure.hcp;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HcpCallPacerTest {

    private VirtualTimeScheduler scheduler;
    private HcpCallPacer pacer;
    private List<Long> starts;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        pacer = new HcpCallPacer(Duration.ofSeconds(2), scheduler);
        starts = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void shouldDelayCallMadeShortlyAfterPreviousOne() {
        scheduler.advanceTimeBy(Duration.ofMillis(1900));
        pacer.pace(recordedCall()).subscribe();
        scheduler.advanceTimeBy(Duration.ofMillis(100));
        pacer.pace(recordedCall()).subscribe();
        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertThat(starts).containsExactly(1900L, 3900L);
    }

    @Test
    void shouldQueueConcurrentCallsOneIntervalApart() {
        pacer.pace(recordedCall()).subscribe();
        pacer.pace(recordedCall()).subscribe();
        pacer.pace(recordedCall()).subscribe();
        scheduler.advanceTimeBy(Duration.ofSeconds(10));

        assertThat(starts).containsExactly(0L, 2000L, 4000L);
    }

    @Test
    void shouldNotDelayCallAfterIdlePeriod() {
        pacer.pace(recordedCall()).subscribe();
        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        pacer.pace(recordedCall()).subscribe();

        assertThat(starts).containsExactly(0L, 5000L);
    }

    @Test
    void shouldSpaceRetriedAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        Mono<String> flaky = Mono.fromCallable(() -> {
            starts.add(scheduler.now(TimeUnit.MILLISECONDS));
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt fails");
            }
            return "ok";
        });

        List<String> results = new ArrayList<>();
        pacer.pace(flaky).retry(1).subscribe(results::add);
        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertThat(starts).containsExactly(0L, 2000L);
        assertThat(results).containsExactly("ok");
    }

    private Mono<String> recordedCall() {
        return Mono.fromCallable(() -> {
            starts.add(scheduler.now(TimeUnit.MILLISECONDS));
            return "ok";
        });
    }
}
