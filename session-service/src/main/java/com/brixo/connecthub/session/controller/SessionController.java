package com.brixo.connecthub.session.controller;

import com.brixo.connecthub.session.model.CommandResult;
import com.brixo.connecthub.session.model.SessionCommand;
import com.brixo.connecthub.session.model.SessionEvent;
import com.brixo.connecthub.session.model.SessionSnapshot;
import com.brixo.connecthub.session.service.SessionManager;
import com.brixo.connecthub.session.service.SnapshotSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * API de sesión para los consumidores (applet, ajustes, SMS).
 *
 * GET  /api/session/snapshot → último snapshot publicado
 * GET  /api/session/stream   → SSE con eventos "snapshot" y "session-event"
 * POST /api/session/commands → { "type": ..., "deviceId": ..., "plugin"?: ..., "enabled"?: ... }
 */
@RestController
@RequestMapping("/api/session")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionManager sessionManager;

    public SessionController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @GetMapping("/snapshot")
    public ResponseEntity<SessionSnapshot> getSnapshot() {
        return ResponseEntity.ok(sessionManager.snapshot());
    }

    /**
     * Abre un flujo SSE. El primer evento es el snapshot actual, que el publicador
     * reenvía al dar de alta al suscriptor; después llega uno por cada publicación.
     * El cliente descarta secuencias antiguas.
     */
    @GetMapping("/stream")
    public SseEmitter stream() {
        SseEmitter emitter = new SseEmitter(0L);
        SseSubscriber subscriber = new SseSubscriber(emitter);
        emitter.onCompletion(() -> sessionManager.unsubscribe(subscriber));
        emitter.onTimeout(() -> sessionManager.unsubscribe(subscriber));
        emitter.onError(error -> sessionManager.unsubscribe(subscriber));
        sessionManager.subscribe(subscriber);
        return emitter;
    }

    /** Ejecuta una orden y responde cuando se asienta o vence su plazo. */
    @PostMapping("/commands")
    public CompletableFuture<ResponseEntity<CommandResult>> submit(@RequestBody SessionCommand command) {
        return sessionManager.submit(command).thenApply(CommandResponses::toResponse);
    }

    private final class SseSubscriber implements SnapshotSubscriber {

        private final SseEmitter emitter;

        SseSubscriber(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void onSnapshot(SessionSnapshot snapshot) {
            send(SseEmitter.event()
                    .name("snapshot")
                    .id(Long.toString(snapshot.sequence()))
                    .data(snapshot));
        }

        @Override
        public void onEvent(SessionEvent event) {
            send(SseEmitter.event().name("session-event").data(event));
        }

        private void send(SseEmitter.SseEventBuilder event) {
            try {
                emitter.send(event);
            } catch (IOException | IllegalStateException e) {
                log.debug("Cliente SSE desconectado: {}", e.getMessage());
                sessionManager.unsubscribe(this);
                emitter.completeWithError(e);
            }
        }
    }
}
