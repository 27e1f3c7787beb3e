package com.brixo.connecthub.session.model;

/** Propiedades de un dispositivo leídas del daemon durante una resincronización. */
public record DeviceInfo(
        String id,
        String name,
        DeviceType type,
        boolean reachable,
        boolean paired,
        boolean pairRequestedByPeer) {

    public DeviceUpdate toUpdate() {
        return new DeviceUpdate(name, type, Reachability.of(reachable), null);
    }
}
