package org.learningjava.flowc.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CompilationJob(
        long id,
        String flow,
        String cpp,
        boolean success,
        String output,
        Instant timestamp,
        @JsonProperty("phi_pulse") double phiPulse
) {

    public static final double PHI = 1.618033988749895;

    /** Cosmetic oscillation in [0, 1] driven only by the job id. */
    public static double phiPulse(long id) {
        return Math.sin(id * PHI) * 0.5 + 0.5;
    }
}
