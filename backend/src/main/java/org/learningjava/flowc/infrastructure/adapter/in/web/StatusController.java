package org.learningjava.flowc.infrastructure.adapter.in.web;

import org.learningjava.flowc.application.usecase.ExampleCycleDriver;
import org.learningjava.flowc.domain.model.CompilationJob;
import org.learningjava.flowc.domain.service.history.CompilationLedger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StatusController {

    static final int RECENT_IDEAS = 50;

    private final CompilationLedger ledger;
    private final ExampleCycleDriver driver;
    private final String service;
    private final String version;
    private final int port;
    private final Clock clock;
    private final Instant startedAt;

    @Autowired
    public StatusController(CompilationLedger ledger,
                            ExampleCycleDriver driver,
                            @Value("${flowc.service.name:flow-chat}") String service,
                            @Value("${flowc.service.version:2.0.0}") String version,
                            @Value("${server.port:9602}") int port) {
        this(ledger, driver, service, version, port, Clock.systemUTC());
    }

    StatusController(CompilationLedger ledger, ExampleCycleDriver driver,
                     String service, String version, int port, Clock clock) {
        this.ledger = ledger;
        this.driver = driver;
        this.service = service;
        this.version = version;
        this.port = port;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping({"/health", "/status"})
    public Map<String, Object> health() {
        long uptimeMs = Duration.between(startedAt, clock.instant()).toMillis();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "alive");
        body.put("service", service);
        body.put("version", version);
        body.put("uptime_seconds", Math.round(uptimeMs / 100.0) / 10.0);
        body.put("phi", CompilationJob.PHI);
        body.put("compilations", ledger.totalCompilations());
        body.put("ideas_in_stream", ledger.size());
        body.put("perpetual_cycle", driver.cycle());
        body.put("websocket", websocketUrl());
        return body;
    }

    @GetMapping("/ideas")
    public Map<String, Object> ideas() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ideas", ledger.recent(RECENT_IDEAS));
        body.put("total", ledger.size());
        return body;
    }

    @GetMapping(value = "/compile", produces = MediaType.TEXT_HTML_VALUE + ";charset=UTF-8")
    public String compilePage() {
        String text = "Flow Compiler v" + version + " - " + ledger.totalCompilations() + " compilations\n"
                + "Perpetual cycle: " + driver.cycle() + "\n"
                + "φ = " + CompilationJob.PHI + "\n\n"
                + "Send Flow code via WebSocket to " + websocketUrl();
        return "<pre>" + HtmlUtils.htmlEscape(text, "UTF-8") + "</pre>";
    }

    private String websocketUrl() {
        return "ws://localhost:" + port + "/ws";
    }
}
