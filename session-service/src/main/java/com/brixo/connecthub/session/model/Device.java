package com.brixo.connecthub.session.model;

import java.time.Instant;

/**
 * Dispositivo anunciado por el daemon KDE Connect.
 * Es inmutable: el registro sustituye la instancia completa en cada cambio y los
 * consumidores sólo reciben copias dentro del snapshot.
 */
public record Device(
        String id,
        String name,
        DeviceType type,
        Reachability reachability,
        PairingState pairingState,
        DeviceTelemetry telemetry,
        Instant lastSeen) {

    public boolean isReachable() {
        return reachability == Reachability.REACHABLE;
    }

    public Device withReachability(Reachability newReachability) {
        return new Device(id, name, type, newReachability, pairingState, telemetry, lastSeen);
    }

    public Device withPairingState(PairingState newState) {
        return new Device(id, name, type, reachability, newState, telemetry, lastSeen);
    }

    public Device withTelemetry(DeviceTelemetry newTelemetry) {
        return new Device(id, name, type, reachability, pairingState, newTelemetry, lastSeen);
    }
}
