package com.brixo.connecthub.session.model;

import java.time.Instant;

/**
 * Sesión de emparejamiento de un dispositivo.
 * {@code expiresAt} sólo tiene valor en los estados pendientes.
 */
public record PairingSession(
        String deviceId,
        PairingState state,
        long token,
        Instant expiresAt) {

    public PairingSession withState(PairingState newState) {
        return new PairingSession(deviceId, newState, token, newState.isPending() ? expiresAt : null);
    }
}
