package com.brixo.connecthub.session.model;

/** Quién debe mostrar una notificación concreta. */
public enum NotificationRoute {
    DAEMON,
    NATIVE
}
