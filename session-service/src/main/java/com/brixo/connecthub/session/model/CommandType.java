package com.brixo.connecthub.session.model;

/** Órdenes que aceptan los consumidores. */
public enum CommandType {
    REQUEST_PAIR,
    ACCEPT_PAIR,
    REJECT_PAIR,
    UNPAIR,
    SET_PLUGIN_ENABLED,
    CANCEL_PAIRING
}
