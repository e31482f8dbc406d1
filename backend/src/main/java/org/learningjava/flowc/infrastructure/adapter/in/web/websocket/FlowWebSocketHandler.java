package org.learningjava.flowc.infrastructure.adapter.in.web.websocket;

import org.learningjava.flowc.application.usecase.CompileFlowUseCase;
import org.learningjava.flowc.application.usecase.ExampleCycleDriver;
import org.learningjava.flowc.domain.model.CompilationJob;
import org.learningjava.flowc.domain.service.history.CompilationLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text frames carry raw Flow source. Results come back through the broadcaster, to every
 * open session, not only the sender.
 */
@Component
public class FlowWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(FlowWebSocketHandler.class);

    public static final String BANNER = "FLOW COMPILER v2.0 - Full Flow-to-C++17. Perpetual motion engaged.";

    private final CompileFlowUseCase compile;
    private final ExampleCycleDriver driver;
    private final CompilationLedger ledger;
    private final WebSocketBroadcaster broadcaster;

    public FlowWebSocketHandler(CompileFlowUseCase compile,
                                ExampleCycleDriver driver,
                                CompilationLedger ledger,
                                WebSocketBroadcaster broadcaster) {
        this.compile = compile;
        this.driver = driver;
        this.ledger = ledger;
        this.broadcaster = broadcaster;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("[ws {}] client connected", session.getId());
        broadcaster.register(session);

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("type", "info");
        info.put("message", BANNER);
        info.put("phi", CompilationJob.PHI);
        info.put("compilations", ledger.totalCompilations());
        broadcaster.send(session, info);

        driver.arm();
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String flow = message.getPayload().trim();
        if (flow.isEmpty()) {
            return;
        }
        log.info("[ws {}] flow submitted ({} chars)", session.getId(), flow.length());
        compile.submit(flow).whenComplete((job, err) -> {
            if (err != null) {
                log.error("[ws {}] compile pipeline failed: {}", session.getId(), err.toString(), err);
            }
        });
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[ws {}] transport error: {}", session.getId(), exception.toString());
        broadcaster.unregister(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("[ws {}] client disconnected ({})", session.getId(), status.getCode());
        broadcaster.unregister(session);
    }
}
