package org.learningjava.flowc.application.usecase;

import org.learningjava.flowc.domain.model.FlowExample;
import org.learningjava.flowc.domain.service.examples.FlowExampleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Feeds the canned examples through the compile pipeline on a fixed period, in catalog order.
 * Armed by the first WebSocket connection; arming again is a no-op.
 */
@Component
public class ExampleCycleDriver {

    private static final Logger log = LoggerFactory.getLogger(ExampleCycleDriver.class);

    private final FlowExampleCatalog catalog;
    private final CompileFlowUseCase compile;
    private final TaskScheduler scheduler;
    private final long periodMs;
    private final boolean enabled;

    private final AtomicBoolean armed = new AtomicBoolean(false);
    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final AtomicLong cycle = new AtomicLong();

    public ExampleCycleDriver(FlowExampleCatalog catalog,
                              CompileFlowUseCase compile,
                              @Qualifier("driverScheduler") TaskScheduler scheduler,
                              @Value("${flowc.driver.period-ms:1618}") long periodMs,
                              @Value("${flowc.driver.enabled:true}") boolean enabled) {
        if (periodMs <= 0) {
            throw new IllegalArgumentException("Driver period must be positive: " + periodMs);
        }
        this.catalog = catalog;
        this.compile = compile;
        this.scheduler = scheduler;
        this.periodMs = periodMs;
        this.enabled = enabled;
    }

    /** @return true only for the call that actually started the loop */
    public boolean arm() {
        if (!enabled) {
            log.debug("Example driver disabled (flowc.driver.enabled=false)");
            return false;
        }
        if (!armed.compareAndSet(false, true)) {
            return false;
        }
        log.info("Example driver armed: {} examples every {} ms", catalog.size(), periodMs);
        scheduler.scheduleAtFixedRate(this::tick, Duration.ofMillis(periodMs));
        return true;
    }

    void tick() {
        if (!busy.compareAndSet(false, true)) {
            log.debug("Previous cycle {} still compiling, skipping tick", cycle.get());
            return;
        }
        long n = cycle.incrementAndGet();
        FlowExample example = catalog.at(n - 1);
        log.debug("Cycle {}: {}", n, example.getName());
        try {
            compile.submitCycle(example.getSource(), n).whenComplete((job, err) -> {
                busy.set(false);
                if (err != null) {
                    log.error("Cycle {} ({}) failed: {}", n, example.getName(), err.toString(), err);
                }
            });
        } catch (RuntimeException e) {
            busy.set(false);
            log.error("Cycle {} ({}) could not be queued: {}", n, example.getName(), e.toString(), e);
        }
    }

    public long cycle() {
        return cycle.get();
    }

    public boolean isArmed() {
        return armed.get();
    }
}
