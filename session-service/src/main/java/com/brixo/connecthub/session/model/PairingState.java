package com.brixo.connecthub.session.model;

/**
 * Estados de la máquina de emparejamiento.
 *
 * UNPAIRED y PAIRED son estados de reposo: la máquina vuelve a ellos tantas veces
 * como haga falta. REQUEST_SENT y REQUEST_RECEIVED son los estados pendientes,
 * con token y plazo de expiración.
 */
public enum PairingState {
    UNKNOWN,
    UNPAIRED,
    REQUEST_SENT,
    REQUEST_RECEIVED,
    PAIRED,
    UNPAIRING;

    public boolean isPending() {
        return this == REQUEST_SENT || this == REQUEST_RECEIVED;
    }

    /** Los estados que llevan asociada una {@link PairingSession}. */
    public boolean hasSession() {
        return isPending() || this == PAIRED || this == UNPAIRING;
    }

    /**
     * Traduce el valor de la señal pairStateChanged del daemon
     * (0=NotPaired, 1=Requested, 2=RequestedByPeer, 3=Paired).
     */
    public static PairingState fromDaemon(int daemonState) {
        return switch (daemonState) {
            case 0 -> UNPAIRED;
            case 1 -> REQUEST_SENT;
            case 2 -> REQUEST_RECEIVED;
            case 3 -> PAIRED;
            default -> UNKNOWN;
        };
    }
}
