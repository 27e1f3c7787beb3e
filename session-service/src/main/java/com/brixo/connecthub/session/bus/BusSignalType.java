package com.brixo.connecthub.session.bus;

public enum BusSignalType {
    DEVICE_ADDED,
    DEVICE_REMOVED,
    REACHABILITY_CHANGED,
    NAME_CHANGED,
    PAIR_STATE_CHANGED,
    PAIRING_FAILED,
    PLUGINS_CHANGED,
    /** Pseudo-señal: la pasarela (re)conectó con el bus y volvió a suscribirse. */
    BUS_CONNECTED,
    /** Pseudo-señal: se perdió la conexión con el bus. */
    BUS_DISCONNECTED
}
