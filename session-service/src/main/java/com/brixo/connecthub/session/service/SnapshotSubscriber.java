package com.brixo.connecthub.session.service;

import com.brixo.connecthub.session.model.SessionEvent;
import com.brixo.connecthub.session.model.SessionSnapshot;

/** Consumidor de snapshots y eventos de sesión. */
public interface SnapshotSubscriber {

    void onSnapshot(SessionSnapshot snapshot);

    default void onEvent(SessionEvent event) {
    }
}
