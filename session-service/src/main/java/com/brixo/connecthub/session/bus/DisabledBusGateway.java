package com.brixo.connecthub.session.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Pasarela inerte para entornos sin bus de sesión (connecthub.bus.enabled=false).
 * Toda llamada falla con BUS_UNAVAILABLE de forma inmediata.
 */
public class DisabledBusGateway implements BusGateway {

    private static final Logger log = LoggerFactory.getLogger(DisabledBusGateway.class);

    @Override
    public void subscribe(BusSignalListener listener) {
        // sin señales
    }

    @Override
    public void unsubscribe(BusSignalListener listener) {
        // sin señales
    }

    @Override
    public CompletableFuture<Object> call(String deviceId, BusMethod method, Object... args) {
        return CompletableFuture.failedFuture(new BusException("Bus D-Bus desactivado por configuración", false));
    }

    @Override
    public boolean isConnected() {
        return false;
    }

    @Override
    public void start() {
        log.warn("Bus D-Bus desactivado: el gestor arranca sin dispositivos");
    }

    @Override
    public void close() {
        // nada que liberar
    }
}
