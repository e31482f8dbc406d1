package org.learningjava.flowc.infrastructure.adapter.out.toolchain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.learningjava.flowc.application.port.NativeToolchainPort.RunResult;
import org.learningjava.flowc.config.SandboxProperties;
import org.learningjava.flowc.domain.service.translate.FlowTranslator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GppToolchainAdapterTest {

    @TempDir
    Path tmp;

    private Path work;
    private SandboxProperties props;

    @BeforeEach
    void setUp() throws IOException {
        work = Files.createDirectories(tmp.resolve("work"));
        props = new SandboxProperties();
        props.setWorkDir(work.toString());
        props.setCompileTimeoutMs(5000);
        props.setRunTimeoutMs(5000);
    }

    @Test
    void missingCompiler_reportsRuntimeUnavailable() {
        props.setCompiler("flowc-no-such-compiler");
        GppToolchainAdapter adapter = new GppToolchainAdapter(props);

        assertFalse(adapter.available());
        RunResult result = adapter.buildAndRun(1, "int main() { return 0; }");

        assertFalse(result.success());
        assertEquals("[runtime unavailable: flowc-no-such-compiler not found]", result.output());
    }

    @Test
    void missingCompilerPath_reportsRuntimeUnavailable() {
        props.setCompiler(tmp.resolve("nope/g++").toString());

        RunResult result = new GppToolchainAdapter(props).buildAndRun(1, "");

        assertFalse(result.success());
        assertThat(result.output(), startsWith("[runtime unavailable:"));
    }

    // ---------- fake compilers: shell scripts that honour "-std=X -o BIN SRC" ----------

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void successfulBuild_runsBinaryAndCapturesOutput() throws IOException {
        props.setCompiler(fakeCompiler("printf 'hello from flow\\n'").toString());

        RunResult result = new GppToolchainAdapter(props).buildAndRun(7, "int main() {}");

        assertTrue(result.success(), result.output());
        assertEquals("hello from flow\n", result.output());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void silentProgram_reportsNoOutput() throws IOException {
        props.setCompiler(fakeCompiler("true").toString());

        RunResult result = new GppToolchainAdapter(props).buildAndRun(8, "int main() {}");

        assertTrue(result.success());
        assertEquals("(no output)", result.output());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void compileError_returnsDiagnostics() throws IOException {
        props.setCompiler(script("cc-fail", "echo \"$4:3:5: error: expected ';' before '}' token\" 1>&2\nexit 1").toString());

        RunResult result = new GppToolchainAdapter(props).buildAndRun(9, "int main() { return 0 }");

        assertFalse(result.success());
        assertThat(result.output(), containsString("error: expected ';'"));
        assertThat(result.output(), containsString("flow_job_9.cpp"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void silentCompileError_synthesizesDescription() throws IOException {
        props.setCompiler(script("cc-mute", "exit 4").toString());

        RunResult result = new GppToolchainAdapter(props).buildAndRun(10, "x");

        assertFalse(result.success());
        assertEquals("compiler exited with status 4", result.output());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void runtimeFailure_returnsProgramOutput() throws IOException {
        props.setCompiler(fakeCompiler("echo 'segfault-ish'\nexit 3").toString());

        RunResult result = new GppToolchainAdapter(props).buildAndRun(11, "int main() {}");

        assertFalse(result.success());
        assertThat(result.output(), containsString("segfault-ish"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void compileTimeout_isReported() throws IOException {
        props.setCompiler(script("cc-slow", "sleep 10").toString());
        props.setCompileTimeoutMs(300);

        RunResult result = new GppToolchainAdapter(props).buildAndRun(12, "int main() {}");

        assertFalse(result.success());
        assertThat(result.output(), startsWith("[compile timed out after 300 ms]"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void runTimeout_isReported() throws IOException {
        props.setCompiler(fakeCompiler("sleep 10").toString());
        props.setRunTimeoutMs(300);

        RunResult result = new GppToolchainAdapter(props).buildAndRun(13, "int main() {}");

        assertFalse(result.success());
        assertThat(result.output(), startsWith("[run timed out after 300 ms]"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void programWaitingForInput_seesEndOfStream() throws IOException {
        props.setCompiler(fakeCompiler("read line || echo 'eof'").toString());

        RunResult result = new GppToolchainAdapter(props).buildAndRun(14, "int main() {}");

        assertTrue(result.success());
        assertEquals("eof\n", result.output());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void jobFiles_areRemovedAfterwards() throws IOException {
        props.setCompiler(fakeCompiler("echo ok").toString());

        new GppToolchainAdapter(props).buildAndRun(15, "int main() {}");

        try (Stream<Path> left = Files.list(work)) {
            assertEquals(0, left.filter(p -> p.getFileName().toString().startsWith("flow_job_")).count());
        }
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void keepFiles_leavesSourceForInspection() throws IOException {
        props.setCompiler(fakeCompiler("echo ok").toString());
        props.setKeepFiles(true);

        new GppToolchainAdapter(props).buildAndRun(16, "int main() { /* kept */ }");

        assertEquals("int main() { /* kept */ }",
                Files.readString(work.resolve("flow_job_16.cpp"), StandardCharsets.UTF_8));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void longOutput_isTruncated() throws IOException {
        props.setCompiler(fakeCompiler("i=0\nwhile [ $i -lt 200 ]; do echo 0123456789; i=$((i+1)); done").toString());
        props.setMaxOutputChars(100);

        RunResult result = new GppToolchainAdapter(props).buildAndRun(17, "int main() {}");

        assertTrue(result.success());
        assertThat(result.output(), endsWith("[output truncated]"));
        assertThat(result.output().length(), lessThan(200));
    }

    @Test
    void readCapped_readsOnlyTheHeadOfAHugeLog() throws IOException {
        Path log = tmp.resolve("huge.run.log");
        byte[] chunk = "x".repeat(1 << 20).getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < 8; i++) {
            Files.write(log, chunk, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
        props.setMaxOutputChars(16);

        String out = new GppToolchainAdapter(props).readCapped(log);

        assertEquals("x".repeat(16) + "\n[output truncated]", out);
    }

    @Test
    void readCapped_countsCharactersNotBytes() throws IOException {
        Path log = tmp.resolve("phi.run.log");
        Files.writeString(log, "φφφφφ", StandardCharsets.UTF_8);
        GppToolchainAdapter adapter = new GppToolchainAdapter(props);

        props.setMaxOutputChars(5);
        assertEquals("φφφφφ", adapter.readCapped(log));

        props.setMaxOutputChars(3);
        assertEquals("φφφ\n[output truncated]", adapter.readCapped(log));
    }

    @Test
    void readCapped_missingLogIsEmpty() throws IOException {
        assertEquals("", new GppToolchainAdapter(props).readCapped(tmp.resolve("absent.log")));
    }

    // ---------- real toolchain ----------

    @Test
    void realGpp_compilesAndRunsTranslatedFlow() {
        GppToolchainAdapter adapter = new GppToolchainAdapter(props);
        assumeTrue(adapter.available(), "g++ not on PATH");

        String cpp = new FlowTranslator().translate("phi is 1.618033988749895\nsay \"The golden ratio: \"\nsay phi");
        RunResult result = adapter.buildAndRun(100, cpp);

        assertTrue(result.success(), result.output());
        assertThat(result.output(), startsWith("The golden ratio: \n1.61803"));
    }

    // ---------- helpers ----------

    /** A compiler that writes a shell "binary" with the given body to the -o path. */
    private Path fakeCompiler(String programBody) throws IOException {
        Path program = script("program-body", programBody);
        return script("cc-ok", "cp '" + program + "' \"$3\"\nchmod +x \"$3\"");
    }

    private Path script(String name, String body) throws IOException {
        Path file = tmp.resolve(name + "-" + System.nanoTime() + ".sh");
        Files.writeString(file, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        return file;
    }
}
