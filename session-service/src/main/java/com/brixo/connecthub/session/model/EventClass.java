package com.brixo.connecthub.session.model;

import java.util.List;

/**
 * Clases de notificación que el árbitro redirige al notificador nativo.
 * Cada clase agrupa los eventos de kdeconnect.notifyrc que la producen.
 */
public enum EventClass {
    PAIRING_REQUEST(List.of("pairingRequest", "pairRequest", "pairingRequestReceived")),
    TRANSFER_COMPLETE(List.of("transferReceived", "transferComplete")),
    ANDROID_NOTIFICATION(List.of("notification"));

    private final List<String> daemonEvents;

    EventClass(List<String> daemonEvents) {
        this.daemonEvents = daemonEvents;
    }

    public List<String> daemonEvents() {
        return daemonEvents;
    }

    /** Nombre del grupo en notifyrc, p.ej. "Event/pairRequest". */
    public static String groupName(String daemonEvent) {
        return "Event/" + daemonEvent;
    }
}
