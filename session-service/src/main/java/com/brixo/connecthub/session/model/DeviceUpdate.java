package com.brixo.connecthub.session.model;

/**
 * Campos observados en una señal del daemon. Los campos nulos conservan el valor
 * previo del registro.
 */
public record DeviceUpdate(
        String name,
        DeviceType type,
        Reachability reachability,
        PairingState pairingState) {

    public static DeviceUpdate reachability(boolean reachable) {
        return new DeviceUpdate(null, null, Reachability.of(reachable), null);
    }

    public static DeviceUpdate name(String name) {
        return new DeviceUpdate(name, null, null, null);
    }

    public static DeviceUpdate pairingState(PairingState state) {
        return new DeviceUpdate(null, null, null, state);
    }

    public static DeviceUpdate seen() {
        return new DeviceUpdate(null, null, null, null);
    }
}
