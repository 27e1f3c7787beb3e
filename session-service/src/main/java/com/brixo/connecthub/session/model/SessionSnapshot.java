package com.brixo.connecthub.session.model;

import java.time.Instant;
import java.util.List;

/**
 * Vista inmutable y coherente que se publica a los consumidores (applet, ajustes,
 * SMS) tras cada mutación asentada.
 *
 * El número de secuencia crece estrictamente por instancia del gestor; un
 * consumidor que reciba una secuencia menor que la última aplicada debe descartarla.
 */
public record SessionSnapshot(
        long sequence,
        Instant publishedAt,
        boolean busConnected,
        List<Device> devices,
        List<PairingSession> pairingSessions,
        List<PluginRecord> plugins,
        List<SuppressionRule> suppressionRules) {

    public SessionSnapshot {
        devices = List.copyOf(devices);
        pairingSessions = List.copyOf(pairingSessions);
        plugins = List.copyOf(plugins);
        suppressionRules = List.copyOf(suppressionRules);
    }

    /** Snapshot vacío previo a la primera publicación. */
    public static SessionSnapshot empty() {
        return new SessionSnapshot(0L, Instant.EPOCH, false, List.of(), List.of(), List.of(), List.of());
    }
}
