package com.brixo.connecthub.session.service;

import com.brixo.connecthub.session.model.SessionEvent;
import com.brixo.connecthub.session.model.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.LongFunction;

/**
 * Publica snapshots con número de secuencia estrictamente creciente y reparte
 * eventos de sesión a los suscriptores.
 *
 * Bajo el monitor sólo se asigna la secuencia, se construye el snapshot y se
 * encola la entrega. Cada suscriptor tiene su propia cadena sobre
 * {@code executor}: recibe todo en orden y, si es lento, sólo se retrasa él.
 */
public class SnapshotPublisher {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPublisher.class);

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private final Executor executor;
    private long sequence;
    private volatile SessionSnapshot latest = SessionSnapshot.empty();

    /** Entrega en el mismo hilo que publica. */
    public SnapshotPublisher() {
        this(Runnable::run);
    }

    public SnapshotPublisher(Executor executor) {
        this.executor = executor;
    }

    /**
     * Alta de un suscriptor. Si ya hay algo publicado, lo primero que recibe es el
     * último snapshot.
     */
    public synchronized void subscribe(SnapshotSubscriber subscriber) {
        Delivery delivery = new Delivery(subscriber);
        deliveries.add(delivery);
        SessionSnapshot current = latest;
        if (current.sequence() > 0) {
            delivery.enqueue(s -> s.onSnapshot(current), "snapshot " + current.sequence());
        }
    }

    public void unsubscribe(SnapshotSubscriber subscriber) {
        deliveries.removeIf(delivery -> delivery.subscriber == subscriber);
    }

    public SessionSnapshot latest() {
        return latest;
    }

    /**
     * @param builder construye el snapshot a partir de la secuencia asignada
     */
    public synchronized SessionSnapshot publish(LongFunction<SessionSnapshot> builder) {
        SessionSnapshot snapshot = builder.apply(++sequence);
        latest = snapshot;
        for (Delivery delivery : deliveries) {
            delivery.enqueue(s -> s.onSnapshot(snapshot), "snapshot " + snapshot.sequence());
        }
        return snapshot;
    }

    public synchronized void publishEvent(SessionEvent event) {
        log.info("Evento de sesión {} ({}): {}", event.type(), event.deviceId(), event.message());
        for (Delivery delivery : deliveries) {
            delivery.enqueue(s -> s.onEvent(event), "evento " + event.type());
        }
    }

    // ── Entrega ───────────────────────────────────────────────────────────────

    /** Cadena de entregas de un suscriptor. Sólo se alarga bajo el monitor del publicador. */
    private final class Delivery {

        private final SnapshotSubscriber subscriber;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        Delivery(SnapshotSubscriber subscriber) {
            this.subscriber = subscriber;
        }

        void enqueue(Consumer<SnapshotSubscriber> action, String what) {
            tail = tail.thenRunAsync(() -> {
                if (!deliveries.contains(this)) {
                    return;
                }
                try {
                    action.accept(subscriber);
                } catch (RuntimeException e) {
                    log.warn("Suscriptor {} falló con {}: {}", subscriber, what, e.getMessage());
                }
            }, executor);
        }
    }
}
