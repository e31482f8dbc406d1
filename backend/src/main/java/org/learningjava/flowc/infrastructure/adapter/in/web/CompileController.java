package org.learningjava.flowc.infrastructure.adapter.in.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.flowc.application.usecase.CompileFlowUseCase;
import org.learningjava.flowc.domain.model.CompilationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class CompileController {

    private static final Logger log = LoggerFactory.getLogger(CompileController.class);

    private final CompileFlowUseCase compile;

    public CompileController(CompileFlowUseCase compile) {
        this.compile = compile;
    }

    public record SourceRequest(@NotBlank String source) {}

    // synchronous; the job is still recorded and broadcast to socket clients
    @PostMapping("/compile")
    public Map<String, Object> compile(@Valid @RequestBody SourceRequest req) {
        String source = req.source().trim();
        CompilationJob job = compile.compileNow(source);
        log.info("POST /api/compile -> job {} success={}", job.id(), job.success());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cpp", job.cpp());
        body.put("output", job.output());
        body.put("success", job.success());
        body.put("compilation_id", job.id());
        return body;
    }

    @PostMapping("/translate")
    public Map<String, Object> translate(@Valid @RequestBody SourceRequest req) {
        return Map.of("cpp", compile.translateOnly(req.source().trim()));
    }
}
