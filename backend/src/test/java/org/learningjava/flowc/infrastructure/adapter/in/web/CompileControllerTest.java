package org.learningjava.flowc.infrastructure.adapter.in.web;

import org.junit.jupiter.api.Test;
import org.learningjava.flowc.application.usecase.CompileFlowUseCase;
import org.learningjava.flowc.domain.model.CompilationJob;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * MVC slice tests for CompileController.
 */
@WebMvcTest(CompileController.class)
@ContextConfiguration(classes = CompileController.class)
class CompileControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private CompileFlowUseCase compile;

    private static CompilationJob job(long id, boolean success, String output) {
        return new CompilationJob(id, "say \"hi\"", "int main() {}\n", success, output,
                Instant.parse("2025-06-01T12:00:00Z"), CompilationJob.phiPulse(id));
    }

    // ---------- /api/compile ----------

    @Test
    void compile_runsPipelineAndReturnsResult() throws Exception {
        given(compile.compileNow(eq("say \"hi\""))).willReturn(job(7, true, "hi\n"));

        mvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"  say \\\"hi\\\"\\n\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.cpp", is("int main() {}\n")))
                .andExpect(jsonPath("$.output", is("hi\n")))
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.compilation_id", is(7)));

        verify(compile).compileNow("say \"hi\"");
    }

    @Test
    void compile_failedJobIsStill200() throws Exception {
        given(compile.compileNow(anyString())).willReturn(job(3, false, "[runtime unavailable: g++ not found]"));

        mvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"say 1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.output", containsString("runtime unavailable")));
    }

    @Test
    void compile_blankSource_returns400() throws Exception {
        mvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"   \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(compile);
    }

    @Test
    void compile_missingSource_returns400() throws Exception {
        mvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(compile);
    }

    // ---------- /api/translate ----------

    @Test
    void translate_returnsCppOnly() throws Exception {
        given(compile.translateOnly("x is 5")).willReturn("const int x = 5;");

        mvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"x is 5\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cpp", is("const int x = 5;")))
                .andExpect(jsonPath("$.success").doesNotExist());

        verify(compile, never()).compileNow(anyString());
    }

    @Test
    void translate_blankSource_returns400() throws Exception {
        mvc.perform(post("/api/translate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\":\"\"}"))
                .andExpect(status().isBadRequest());
    }
}
