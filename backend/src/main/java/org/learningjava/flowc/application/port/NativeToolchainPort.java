package org.learningjava.flowc.application.port;

/**
 * Native build-and-run capability: source text in, success flag and captured text out.
 * Implementations never throw; every failure is reported in the {@link RunResult}.
 */
public interface NativeToolchainPort {

    String toolchain();

    boolean available();

    RunResult buildAndRun(long jobId, String source);

    record RunResult(boolean success, String output) {

        public static RunResult ok(String output) {
            return new RunResult(true, output == null || output.isEmpty() ? "(no output)" : output);
        }

        public static RunResult failed(String output) {
            return new RunResult(false, output);
        }
    }
}
