package org.learningjava.flowc.domain.service.history;

import org.learningjava.flowc.domain.model.CompilationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, append-only history of compilation jobs. Owns the job counter.
 * All access goes through the instance monitor; once full, each append evicts the oldest job.
 */
@Component
public class CompilationLedger {

    private static final Logger log = LoggerFactory.getLogger(CompilationLedger.class);

    public static final int DEFAULT_CAPACITY = 500;

    private final int capacity;
    private final Clock clock;
    private final Deque<CompilationJob> jobs = new ArrayDeque<>();
    private long counter;

    @Autowired
    public CompilationLedger(@Value("${flowc.ledger.capacity:500}") int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public CompilationLedger(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Ledger capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public CompilationJob record(String flow, String cpp, boolean success, String output) {
        CompilationJob job;
        synchronized (this) {
            long id = ++counter;
            job = new CompilationJob(id, flow, cpp, success, output,
                    clock.instant(), CompilationJob.phiPulse(id));
            jobs.addLast(job);
            if (jobs.size() > capacity) {
                jobs.removeFirst();
            }
        }
        log.info("[flow #{}] {} {}", job.id(), success ? "ok" : "failed", headline(flow));
        return job;
    }

    /** Up to {@code limit} most recent jobs, oldest first. */
    public synchronized List<CompilationJob> recent(int limit) {
        int skip = Math.max(0, jobs.size() - Math.max(limit, 0));
        List<CompilationJob> out = new ArrayList<>(jobs.size() - skip);
        int i = 0;
        for (CompilationJob job : jobs) {
            if (i++ >= skip) out.add(job);
        }
        return out;
    }

    public synchronized int size() {
        return jobs.size();
    }

    /** Jobs recorded since startup, evicted ones included. */
    public synchronized long totalCompilations() {
        return counter;
    }

    public int capacity() {
        return capacity;
    }

    private static String headline(String flow) {
        if (flow == null) return "";
        String first = flow.lines().findFirst().orElse("");
        return first.length() > 60 ? first.substring(0, 60) : first;
    }
}
