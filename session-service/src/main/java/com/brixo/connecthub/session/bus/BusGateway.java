package com.brixo.connecthub.session.bus;

import java.util.concurrent.CompletableFuture;

/**
 * Envoltorio tipado del bus entre procesos.
 *
 * <p>Las suscripciones sobreviven a las reconexiones: la implementación vuelve a
 * registrarlas cuando el bus o el daemon reinician y lo anuncia con
 * {@link BusSignalType#BUS_CONNECTED}.</p>
 */
public interface BusGateway extends AutoCloseable {

    /**
     * Registra un receptor para todas las señales del daemon.
     *
     * @param listener receptor, nunca null
     */
    void subscribe(BusSignalListener listener);

    /**
     * Quita un receptor registrado.
     *
     * @param listener receptor a quitar
     */
    void unsubscribe(BusSignalListener listener);

    /**
     * Invoca un método del daemon.
     *
     * @param deviceId dispositivo destino, null para los métodos del daemon
     * @param method   método a invocar
     * @param args     argumentos según {@link BusMethod}
     * @return futuro con el resultado, o fallido con {@link BusException}
     */
    CompletableFuture<Object> call(String deviceId, BusMethod method, Object... args);

    /**
     * @return true si hay conexión activa con el bus
     */
    boolean isConnected();

    /** Arranca la conexión (y el bucle de reconexión si procede). */
    void start();

    @Override
    void close();
}
