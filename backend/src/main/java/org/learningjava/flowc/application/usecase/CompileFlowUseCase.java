package org.learningjava.flowc.application.usecase;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.learningjava.flowc.application.port.BroadcastPort;
import org.learningjava.flowc.application.port.NativeToolchainPort;
import org.learningjava.flowc.application.port.NativeToolchainPort.RunResult;
import org.learningjava.flowc.domain.model.CompilationJob;
import org.learningjava.flowc.domain.service.history.CompilationLedger;
import org.learningjava.flowc.domain.service.translate.FlowTranslator;
import org.learningjava.flowc.domain.service.translate.ReconciliationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Translate, build and run one Flow program, record the attempt in the ledger and push the
 * result to every subscriber. Sandbox work runs on {@code compileExecutor}; a submission the
 * executor rejects is still recorded, as a failed job.
 */
@Service
public class CompileFlowUseCase {

    private static final Logger log = LoggerFactory.getLogger(CompileFlowUseCase.class);

    public static final String TYPE_COMPILED = "compiled";
    public static final String TYPE_PERPETUAL = "perpetual";

    static final String QUEUE_FULL = "[flow] compile queue full, try again shortly";

    private final FlowTranslator translator;
    private final NativeToolchainPort toolchain;
    private final CompilationLedger ledger;
    private final BroadcastPort broadcaster;
    private final Executor executor;

    // keys sandbox files; ledger ids are only assigned once a job finishes
    private final AtomicLong sandboxTickets = new AtomicLong();

    public CompileFlowUseCase(FlowTranslator translator,
                              NativeToolchainPort toolchain,
                              CompilationLedger ledger,
                              BroadcastPort broadcaster,
                              @Qualifier("compileExecutor") Executor executor) {
        this.translator = translator;
        this.toolchain = toolchain;
        this.ledger = ledger;
        this.broadcaster = broadcaster;
        this.executor = executor;
    }

    /** Message pushed to subscribers after each job. Driver cycles add {@code cycle} and {@code phi_pulse}. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Envelope(
            String type,
            CompilationJob idea,
            String flow,
            String cpp,
            String output,
            boolean compiled,
            Instant timestamp,
            Long cycle,
            @JsonProperty("phi_pulse") Double phiPulse
    ) {
        public static Envelope compiled(CompilationJob job) {
            return new Envelope(TYPE_COMPILED, job, job.flow(), job.cpp(), job.output(),
                    job.success(), job.timestamp(), null, null);
        }

        public static Envelope perpetual(CompilationJob job, long cycle) {
            return new Envelope(TYPE_PERPETUAL, job, job.flow(), job.cpp(), job.output(),
                    job.success(), job.timestamp(), cycle, job.phiPulse());
        }
    }

    /** Queue a user submission; completes once the job is recorded and broadcast. */
    public CompletableFuture<CompilationJob> submit(String flow) {
        return dispatch(flow, Envelope::compiled);
    }

    /** Queue one driver cycle. */
    public CompletableFuture<CompilationJob> submitCycle(String flow, long cycle) {
        return dispatch(flow, job -> Envelope.perpetual(job, cycle));
    }

    /** Full pipeline on the calling thread; still recorded and broadcast like a socket submission. */
    public CompilationJob compileNow(String flow) {
        CompilationJob job = runPipeline(flow);
        publish(Envelope.compiled(job));
        return job;
    }

    /** Translation only: no sandbox, no ledger entry. */
    public String translateOnly(String flow) {
        return translator.translate(flow);
    }

    // ---------- helpers ----------

    private CompletableFuture<CompilationJob> dispatch(String flow, Function<CompilationJob, Envelope> envelope) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                CompilationJob job = runPipeline(flow);
                publish(envelope.apply(job));
                return job;
            }, executor);
        } catch (RejectedExecutionException e) {
            log.warn("[flow] compile queue full, rejecting submission: {}", e.toString());
            CompilationJob job = ledger.record(flow, "", false, QUEUE_FULL);
            publish(envelope.apply(job));
            return CompletableFuture.completedFuture(job);
        }
    }

    CompilationJob runPipeline(String flow) {
        if (log.isDebugEnabled()) {
            log.debug("[flow] compiling:\n{}", flow);
        }

        String cpp;
        try {
            cpp = translator.translate(flow);
        } catch (ReconciliationException e) {
            log.error("[flow] block reconciliation failed (depth {}): {}", e.depth(), e.getMessage(), e);
            return ledger.record(flow, "", false, "[flow] internal error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[flow] translation failed: {}", e.toString(), e);
            return ledger.record(flow, "", false, "[flow] internal error: " + e.getMessage());
        }

        long ticket = sandboxTickets.incrementAndGet();
        RunResult result;
        try {
            result = toolchain.buildAndRun(ticket, cpp);
        } catch (RuntimeException e) {
            log.error("[flow] toolchain '{}' failed on ticket {}: {}", toolchain.toolchain(), ticket, e.toString(), e);
            result = RunResult.failed(e.getMessage() == null ? e.toString() : e.getMessage());
        }
        return ledger.record(flow, cpp, result.success(), result.output());
    }

    private void publish(Envelope envelope) {
        try {
            broadcaster.broadcast(envelope);
        } catch (RuntimeException e) {
            log.warn("[flow #{}] broadcast failed: {}", envelope.idea().id(), e.toString());
        }
    }
}
