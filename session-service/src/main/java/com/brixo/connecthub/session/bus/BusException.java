package com.brixo.connecthub.session.bus;

/**
 * Fallo al hablar con el daemon a través del bus.
 * Los fallos transitorios (bus caído, daemon reiniciándose, timeout) se reintentan
 * en {@link DaemonClient}; el resto se propaga tal cual.
 */
public class BusException extends RuntimeException {

    private final boolean transientFailure;

    public BusException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public BusException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public static BusException unavailable(String message) {
        return new BusException(message, true);
    }
}
