package com.brixo.connecthub.session.service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Colas serie por dispositivo sobre un pool compartido.
 *
 * Una tarea no empieza hasta que termina la anterior del mismo dispositivo
 * (incluida la respuesta del bus que devuelva su futuro); dispositivos distintos
 * avanzan en paralelo. Esperar una respuesta no ocupa ningún hilo del pool.
 * Una tarea no debe esperar a otra encolada en su mismo dispositivo.
 */
public class DeviceWorkQueues {

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final Executor executor;

    public DeviceWorkQueues(Executor executor) {
        this.executor = executor;
    }

    /**
     * Encola {@code task} tras el trabajo pendiente del dispositivo.
     *
     * El futuro devuelto es una copia: completarlo o aplicarle un plazo no libera
     * la cola antes de que la tarea termine.
     */
    public <T> CompletableFuture<T> enqueue(String deviceId, Supplier<CompletableFuture<T>> task) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(deviceId, done);
        CompletableFuture<Void> ready = previous != null ? previous : CompletableFuture.completedFuture(null);
        CompletableFuture<T> run = ready.thenComposeAsync(ignored -> start(task), executor);
        run.whenComplete((value, error) -> {
            tails.remove(deviceId, done);
            done.complete(null);
        });
        return run.copy();
    }

    /** Número de dispositivos con trabajo pendiente. */
    public int activeQueues() {
        return tails.size();
    }

    private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> task) {
        try {
            CompletableFuture<T> future = task.get();
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
