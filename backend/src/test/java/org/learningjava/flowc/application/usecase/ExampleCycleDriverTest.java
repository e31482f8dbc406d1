package org.learningjava.flowc.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.flowc.domain.model.CompilationJob;
import org.learningjava.flowc.domain.service.examples.FlowExampleCatalog;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

class ExampleCycleDriverTest {

    private final FlowExampleCatalog catalog = new FlowExampleCatalog();
    private CompileFlowUseCase compile;
    private TaskScheduler scheduler;
    private ExampleCycleDriver driver;

    @BeforeEach
    void setUp() {
        compile = mock(CompileFlowUseCase.class);
        scheduler = mock(TaskScheduler.class);
        driver = new ExampleCycleDriver(catalog, compile, scheduler, 1618, true);
    }

    @Test
    void arm_schedulesOnlyOnce() {
        assertTrue(driver.arm());
        assertFalse(driver.arm());
        assertFalse(driver.arm());

        assertTrue(driver.isArmed());
        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofMillis(1618)));
    }

    @Test
    void disabledDriver_neverSchedules() {
        driver = new ExampleCycleDriver(catalog, compile, scheduler, 1618, false);

        assertFalse(driver.arm());
        assertFalse(driver.isArmed());
        verifyNoInteractions(scheduler);
    }

    @Test
    void tick_cyclesExamplesInCatalogOrder() {
        given(compile.submitCycle(anyString(), anyLong()))
                .willReturn(CompletableFuture.completedFuture((CompilationJob) null));

        for (int i = 0; i < catalog.size() + 1; i++) {
            driver.tick();
        }

        verify(compile).submitCycle(catalog.at(0).getSource(), 1L);
        verify(compile).submitCycle(catalog.at(1).getSource(), 2L);
        verify(compile).submitCycle(catalog.at(0).getSource(), catalog.size() + 1L);
        assertEquals(catalog.size() + 1L, driver.cycle());
    }

    @Test
    void tick_skipsWhilePreviousCycleIsCompiling() {
        CompletableFuture<CompilationJob> pending = new CompletableFuture<>();
        given(compile.submitCycle(anyString(), anyLong())).willReturn(pending);

        driver.tick();
        driver.tick();
        verify(compile, times(1)).submitCycle(anyString(), anyLong());
        assertEquals(1, driver.cycle());

        pending.complete(null);
        driver.tick();
        verify(compile, times(2)).submitCycle(anyString(), anyLong());
        assertEquals(2, driver.cycle());
    }

    @Test
    void tick_recoversWhenQueueingFails() {
        given(compile.submitCycle(anyString(), anyLong()))
                .willThrow(new IllegalStateException("executor saturated"))
                .willReturn(CompletableFuture.completedFuture((CompilationJob) null));

        driver.tick();
        driver.tick();

        verify(compile, times(2)).submitCycle(anyString(), anyLong());
    }

    @Test
    void failedCycle_releasesTheDriver() {
        given(compile.submitCycle(anyString(), anyLong()))
                .willReturn(CompletableFuture.failedFuture(new RuntimeException("boom")));

        driver.tick();
        driver.tick();

        verify(compile, times(2)).submitCycle(anyString(), anyLong());
    }

    @Test
    void nonPositivePeriod_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExampleCycleDriver(catalog, compile, scheduler, 0, true));
    }
}
