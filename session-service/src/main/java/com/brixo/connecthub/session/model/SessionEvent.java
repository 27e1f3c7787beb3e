package com.brixo.connecthub.session.model;

import java.time.Instant;

/**
 * Evento puntual para los consumidores: errores recuperables del emparejamiento,
 * degradación de notificaciones o conectividad del bus.
 */
public record SessionEvent(
        SessionEventType type,
        String deviceId,
        String message,
        Instant occurredAt) {
}
