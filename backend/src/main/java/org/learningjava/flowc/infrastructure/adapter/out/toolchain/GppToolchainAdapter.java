// src/main/java/org/learningjava/flowc/infrastructure/adapter/out/toolchain/GppToolchainAdapter.java
package org.learningjava.flowc.infrastructure.adapter.out.toolchain;

import org.learningjava.flowc.application.port.NativeToolchainPort;
import org.learningjava.flowc.config.SandboxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Compiles generated C++ with g++ (or any compiler taking {@code -std= -o <bin> <src>}) and runs
 * the binary. Every job gets its own source, binary and log files, keyed by job id.
 */
public class GppToolchainAdapter implements NativeToolchainPort {

    private static final Logger log = LoggerFactory.getLogger(GppToolchainAdapter.class);

    private static final String TRUNCATED = "\n[output truncated]";

    private final SandboxProperties props;

    public GppToolchainAdapter(SandboxProperties props) {
        this.props = props;
    }

    /** Exit status and combined stdout/stderr of one subprocess. */
    record ProcessOutcome(int exitCode, boolean timedOut, String output) {}

    @Override
    public String toolchain() {
        return props.getCompiler();
    }

    @Override
    public boolean available() {
        return resolveCompiler().isPresent();
    }

    @Override
    public RunResult buildAndRun(long jobId, String source) {
        Optional<Path> compiler = resolveCompiler();
        if (compiler.isEmpty()) {
            log.warn("[job {}] toolchain '{}' not found on PATH", jobId, props.getCompiler());
            return RunResult.failed("[runtime unavailable: " + props.getCompiler() + " not found]");
        }

        Path workDir = Path.of(props.getWorkDir());
        String stem = "flow_job_" + jobId;
        Path src = workDir.resolve(stem + ".cpp");
        Path bin = workDir.resolve(stem);
        List<Path> created = new ArrayList<>(List.of(src, bin));

        try {
            Files.createDirectories(workDir);
            Files.writeString(src, source == null ? "" : source, StandardCharsets.UTF_8);

            List<String> compileCmd = List.of(compiler.get().toString(),
                    "-std=" + props.getStd(), "-o", bin.toString(), src.toString());
            Path compileLog = workDir.resolve(stem + ".compile.log");
            created.add(compileLog);

            long t0 = System.nanoTime();
            ProcessOutcome compile = runProcess(compileCmd, workDir, compileLog, props.getCompileTimeoutMs());
            log.debug("[job {}] compile exit={} in {} ms", jobId, compile.exitCode(), elapsedMs(t0));

            if (compile.timedOut()) {
                return RunResult.failed(join("[compile timed out after " + props.getCompileTimeoutMs() + " ms]",
                        compile.output()));
            }
            if (compile.exitCode() != 0) {
                return RunResult.failed(orDefault(compile.output(),
                        "compiler exited with status " + compile.exitCode()));
            }

            Path runLog = workDir.resolve(stem + ".run.log");
            created.add(runLog);

            long t1 = System.nanoTime();
            ProcessOutcome run = runProcess(List.of(bin.toString()), workDir, runLog, props.getRunTimeoutMs());
            log.debug("[job {}] run exit={} in {} ms", jobId, run.exitCode(), elapsedMs(t1));

            if (run.timedOut()) {
                return RunResult.failed(join("[run timed out after " + props.getRunTimeoutMs() + " ms]",
                        run.output()));
            }
            if (run.exitCode() != 0) {
                return RunResult.failed(orDefault(run.output(),
                        "program exited with status " + run.exitCode()));
            }
            return RunResult.ok(run.output());

        } catch (IOException e) {
            log.warn("[job {}] sandbox I/O failure: {}", jobId, e.toString());
            return RunResult.failed(describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[job {}] interrupted while waiting for the toolchain", jobId);
            return RunResult.failed("[interrupted]");
        } finally {
            if (!props.isKeepFiles()) {
                cleanup(jobId, created);
            }
        }
    }

    // ---------- helpers ----------

    private ProcessOutcome runProcess(List<String> command, Path workDir, Path logFile, long timeoutMs)
            throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile())
                .start();
        // stdin at EOF: a program waiting for input reads an empty line instead of hanging
        process.getOutputStream().close();

        boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
        if (!finished) {
            process.destroyForcibly();
            process.waitFor(1, TimeUnit.SECONDS);
        }
        int exit = finished ? process.exitValue() : -1;
        return new ProcessOutcome(exit, !finished, readCapped(logFile));
    }

    Optional<Path> resolveCompiler() {
        String name = props.getCompiler();
        if (name == null || name.isBlank()) return Optional.empty();

        if (name.contains("/") || name.contains(File.separator)) {
            Path p = Path.of(name);
            return Files.isRegularFile(p) && Files.isExecutable(p) ? Optional.of(p) : Optional.empty();
        }
        String path = System.getenv("PATH");
        if (path == null) return Optional.empty();
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, name);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Reads at most enough bytes for {@code maxOutputChars} characters; a runaway log never lands in memory whole. */
    String readCapped(Path file) throws IOException {
        if (!Files.exists(file)) return "";
        int max = Math.max(props.getMaxOutputChars(), 0);
        // UTF-8 needs at most 4 bytes per char
        int budget = (int) Math.min((long) max * 4, Integer.MAX_VALUE - 8);
        byte[] bytes;
        try (InputStream in = Files.newInputStream(file)) {
            bytes = in.readNBytes(budget);
        }
        boolean more = Files.size(file) > bytes.length;
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (text.length() > max) return text.substring(0, max) + TRUNCATED;
        return more ? text + TRUNCATED : text;
    }

    private void cleanup(long jobId, List<Path> files) {
        for (Path p : files) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                log.warn("[job {}] cleanup failed for {}: {}", jobId, p, e.toString());
            }
        }
    }

    private static String describe(Exception e) {
        String msg = e.getMessage();
        if (msg == null) msg = e.toString();
        return msg.replaceAll("\\s+", " ").trim();
    }

    private static String orDefault(String text, String fallback) {
        return text == null || text.isBlank() ? fallback : text;
    }

    private static String join(String head, String tail) {
        return tail == null || tail.isBlank() ? head : head + "\n" + tail;
    }

    private static long elapsedMs(long t0) {
        return Math.round((System.nanoTime() - t0) / 1_000_000.0);
    }
}
