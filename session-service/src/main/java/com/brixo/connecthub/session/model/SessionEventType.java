package com.brixo.connecthub.session.model;

public enum SessionEventType {
    PAIRING_REQUESTED,
    PAIRING_REJECTED,
    PAIRING_TIMED_OUT,
    PAIRING_FAILED,
    SUPPRESSION_UNAVAILABLE,
    BUS_DISCONNECTED,
    BUS_RECONNECTED
}
