package com.brixo.connecthub.session.bus;

/**
 * Métodos del daemon que usa el gestor. Los argumentos de cada llamada se
 * documentan junto al valor.
 */
public enum BusMethod {
    /** Sin argumentos; devuelve {@code List<String>} con los ids conocidos. */
    LIST_DEVICES,
    /** Devuelve {@link com.brixo.connecthub.session.model.DeviceInfo}. */
    DEVICE_INFO,
    /** Devuelve {@code Map<String, Boolean>}: id de plugin soportado → activo. */
    PLUGIN_STATES,
    /**
     * Argumentos: leer batería (Boolean), leer cobertura (Boolean). Devuelve
     * {@link com.brixo.connecthub.session.model.DeviceTelemetry}.
     */
    DEVICE_TELEMETRY,
    REQUEST_PAIRING,
    ACCEPT_PAIRING,
    REJECT_PAIRING,
    CANCEL_PAIRING,
    UNPAIR,
    /** Argumentos: id de plugin (String), activo (Boolean). */
    SET_PLUGIN_ENABLED,
    PING,
    RING,
    /** Argumento: texto (String). */
    SEND_CLIPBOARD,
    /** Argumento: URL (String). */
    SHARE_URL,
    LOCK_DEVICE
}
