package com.brixo.connecthub.session.service;

import com.brixo.connecthub.session.model.SessionSnapshot;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Filtro para consumidores: sólo deja pasar snapshots con secuencia mayor que la
 * última aplicada.
 */
public class SnapshotSequenceGuard {

    private final AtomicLong lastApplied = new AtomicLong(Long.MIN_VALUE);

    /** @return true si el snapshot es más nuevo y debe aplicarse */
    public boolean accept(SessionSnapshot snapshot) {
        long sequence = snapshot.sequence();
        while (true) {
            long last = lastApplied.get();
            if (sequence <= last) {
                return false;
            }
            if (lastApplied.compareAndSet(last, sequence)) {
                return true;
            }
        }
    }

    public long lastApplied() {
        return lastApplied.get();
    }
}
