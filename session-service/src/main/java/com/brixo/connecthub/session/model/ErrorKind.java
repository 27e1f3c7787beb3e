package com.brixo.connecthub.session.model;

/**
 * Tipos de error que puede recibir un consumidor.
 * STALE_TOKEN y SUPPRESSION_UNAVAILABLE existen para el registro interno: el
 * primero nunca se devuelve, el segundo sólo viaja como evento.
 */
public enum ErrorKind {
    BUS_UNAVAILABLE,
    NOT_PAIRED,
    PAIRING_REJECTED,
    PAIRING_TIMED_OUT,
    PAIRING_FAILED,
    STALE_TOKEN,
    SUPPRESSION_UNAVAILABLE,
    UNKNOWN_DEVICE,
    UNKNOWN_PLUGIN,
    INVALID_STATE,
    TIMEOUT
}
