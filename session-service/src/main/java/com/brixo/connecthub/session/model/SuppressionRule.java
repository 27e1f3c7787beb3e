package com.brixo.connecthub.session.model;

import java.util.Set;

/**
 * Regla de supresión de un dispositivo emparejado: si las ventanas emergentes del
 * daemon están desactivadas y qué clases de evento entrega el notificador nativo.
 */
public record SuppressionRule(
        String deviceId,
        boolean daemonSuppressed,
        Set<EventClass> redirectedClasses) {

    public SuppressionRule {
        redirectedClasses = Set.copyOf(redirectedClasses);
    }
}
