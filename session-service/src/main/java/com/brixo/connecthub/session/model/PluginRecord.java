package com.brixo.connecthub.session.model;

import java.time.Instant;

/**
 * Estado de un plugin para un dispositivo, clave (deviceId, kind).
 * {@code lastSync} sólo avanza cuando cambia algún campo observable.
 */
public record PluginRecord(
        String deviceId,
        PluginKind kind,
        boolean available,
        boolean enabled,
        Instant lastSync) {

    public PluginKey key() {
        return new PluginKey(deviceId, kind);
    }

    public boolean sameStateAs(boolean otherAvailable, boolean otherEnabled) {
        return available == otherAvailable && enabled == otherEnabled;
    }
}
