package com.brixo.connecthub.session.bus;

import java.util.Map;

/**
 * Señal recibida del daemon: tipo, dispositivo origen (null en las pseudo-señales
 * de conectividad) y carga útil.
 */
public record BusSignal(
        BusSignalType type,
        String deviceId,
        Map<String, Object> payload) {

    public static final String REACHABLE = "reachable";
    public static final String NAME = "name";
    public static final String PAIR_STATE = "pairState";
    public static final String ERROR = "error";

    public BusSignal {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static BusSignal of(BusSignalType type, String deviceId) {
        return new BusSignal(type, deviceId, Map.of());
    }

    public static BusSignal of(BusSignalType type, String deviceId, String key, Object value) {
        return new BusSignal(type, deviceId, Map.of(key, value));
    }

    public boolean booleanValue(String key) {
        return Boolean.TRUE.equals(payload.get(key));
    }

    public int intValue(String key, int fallback) {
        Object value = payload.get(key);
        return value instanceof Number number ? number.intValue() : fallback;
    }

    public String stringValue(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}
