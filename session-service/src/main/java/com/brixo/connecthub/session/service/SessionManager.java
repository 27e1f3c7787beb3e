package com.brixo.connecthub.session.service;

import com.brixo.connecthub.session.bus.BusGateway;
import com.brixo.connecthub.session.bus.BusSignal;
import com.brixo.connecthub.session.bus.BusSignalListener;
import com.brixo.connecthub.session.bus.BusSignalType;
import com.brixo.connecthub.session.bus.DaemonClient;
import com.brixo.connecthub.session.exception.SessionErrors;
import com.brixo.connecthub.session.exception.SessionException;
import com.brixo.connecthub.session.model.CommandResult;
import com.brixo.connecthub.session.model.Device;
import com.brixo.connecthub.session.model.DeviceInfo;
import com.brixo.connecthub.session.model.DeviceTelemetry;
import com.brixo.connecthub.session.model.DeviceUpdate;
import com.brixo.connecthub.session.model.ErrorKind;
import com.brixo.connecthub.session.model.PairingState;
import com.brixo.connecthub.session.model.PluginKind;
import com.brixo.connecthub.session.model.SessionCommand;
import com.brixo.connecthub.session.model.SessionEvent;
import com.brixo.connecthub.session.model.SessionEventType;
import com.brixo.connecthub.session.model.SessionSnapshot;
import com.brixo.connecthub.session.service.PairingStateMachine.Outcome;
import com.brixo.connecthub.session.service.PairingStateMachine.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Gestor de sesiones: punto único por el que pasan las señales del daemon y las
 * órdenes de los consumidores.
 *
 * Toda mutación de un dispositivo se ejecuta en su cola serie
 * ({@link DeviceWorkQueues}); tras cada mutación asentada se publica un snapshot
 * nuevo. Las órdenes quedan acotadas por {@code commandTimeout} y siempre
 * terminan en un {@link CommandResult}.
 */
public class SessionManager implements BusSignalListener {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    /** Cola para el trabajo que no pertenece a ningún dispositivo. */
    static final String BUS_QUEUE = "";

    private final DeviceRegistryService registry;
    private final PairingStateMachine pairing;
    private final PluginCapabilityNegotiator negotiator;
    private final NotificationArbiter arbiter;
    private final DaemonClient daemon;
    private final BusGateway gateway;
    private final DeviceWorkQueues queues;
    private final SnapshotPublisher publisher;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration commandTimeout;
    private final Duration unreachableTimeout;
    private final Duration removeAfter;
    private final Duration sweepInterval;

    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile boolean busConnected;
    private volatile ScheduledFuture<?> sweepTask;

    public SessionManager(DeviceRegistryService registry, PairingStateMachine pairing,
            PluginCapabilityNegotiator negotiator, NotificationArbiter arbiter, DaemonClient daemon,
            BusGateway gateway, DeviceWorkQueues queues, SnapshotPublisher publisher,
            ScheduledExecutorService scheduler, Clock clock, Duration commandTimeout,
            Duration unreachableTimeout, Duration removeAfter, Duration sweepInterval) {
        this.registry = registry;
        this.pairing = pairing;
        this.negotiator = negotiator;
        this.arbiter = arbiter;
        this.daemon = daemon;
        this.gateway = gateway;
        this.queues = queues;
        this.publisher = publisher;
        this.scheduler = scheduler;
        this.clock = clock;
        this.commandTimeout = commandTimeout;
        this.unreachableTimeout = unreachableTimeout;
        this.removeAfter = removeAfter;
        this.sweepInterval = sweepInterval;
    }

    // ── Ciclo de vida ─────────────────────────────────────────────────────────

    /**
     * Recupera una supresión previa, se suscribe al bus y lanza la primera
     * resincronización.
     */
    public CompletableFuture<Void> start() {
        arbiter.recover();
        gateway.subscribe(this);
        gateway.start();
        busConnected = gateway.isConnected();
        long sweepMs = sweepInterval.toMillis();
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        publish();
        return resync();
    }

    public void stop() {
        gateway.unsubscribe(this);
        ScheduledFuture<?> task = sweepTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    // ── Consultas ─────────────────────────────────────────────────────────────

    public SessionSnapshot snapshot() {
        return publisher.latest();
    }

    public void subscribe(SnapshotSubscriber subscriber) {
        publisher.subscribe(subscriber);
    }

    public void unsubscribe(SnapshotSubscriber subscriber) {
        publisher.unsubscribe(subscriber);
    }

    public boolean isBusConnected() {
        return busConnected;
    }

    // ── Órdenes ───────────────────────────────────────────────────────────────

    public CompletableFuture<CommandResult> submit(SessionCommand command) {
        if (command == null || command.type() == null || command.deviceId() == null || command.deviceId().isBlank()) {
            return CompletableFuture.completedFuture(
                    CommandResult.failure(ErrorKind.INVALID_STATE, "Orden incompleta: falta tipo o dispositivo"));
        }
        log.debug("Orden {} para {}", command.type(), command.deviceId());
        return queues.enqueue(command.deviceId(), () -> execute(command))
                .thenCompose(Function.identity())
                .orTimeout(commandTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error == null) {
                        return result;
                    }
                    CommandResult failure = SessionErrors.toResult(error);
                    log.debug("Orden {} para {} falló: {} {}", command.type(), command.deviceId(),
                            failure.error(), failure.message());
                    return failure;
                });
    }

    /**
     * Ejecuta la parte local de una orden dentro de la cola del dispositivo.
     *
     * El futuro externo marca el fin del trabajo en cola; el interno, el resultado.
     * Las peticiones y aceptaciones de emparejamiento liberan la cola en cuanto
     * lanzan la llamada al bus, de modo que una cancelación no espera su respuesta.
     */
    private CompletableFuture<CompletableFuture<CommandResult>> execute(SessionCommand command) {
        String deviceId = command.deviceId();
        if (!registry.contains(deviceId)) {
            throw new SessionException(ErrorKind.UNKNOWN_DEVICE, "Dispositivo desconocido: " + deviceId);
        }
        return switch (command.type()) {
            case REQUEST_PAIR -> requestPair(deviceId);
            case ACCEPT_PAIR -> acceptPair(deviceId);
            case REJECT_PAIR -> settled(rejectPair(deviceId));
            case CANCEL_PAIRING -> settled(cancelPairing(deviceId));
            case UNPAIR -> settled(unpair(deviceId));
            case SET_PLUGIN_ENABLED -> settled(setPluginEnabled(deviceId, command.plugin(), command.enabled()));
        };
    }

    private CompletableFuture<CompletableFuture<CommandResult>> requestPair(String deviceId) {
        Transition transition = pairing.requestOutbound(deviceId);
        if (transition.outcome() == Outcome.IGNORED) {
            return settled(CompletableFuture.completedFuture(CommandResult.ok()));
        }
        apply(transition);
        if (transition.outcome() == Outcome.ACCEPTED_BY_TIE_BREAK) {
            return settled(acceptAfterTieBreak(deviceId));
        }
        long token = transition.token();
        return awaitReply(deviceId, daemon.requestPairing(deviceId), error -> {
            if (error == null) {
                return CommandResult.ok();
            }
            SessionException cause = SessionErrors.asSessionException(error);
            Transition failed = pairing.fail(deviceId, token);
            if (failed.outcome() == Outcome.TRANSITIONED) {
                apply(failed);
                emit(SessionEventType.PAIRING_FAILED, deviceId, cause.getMessage());
            }
            return failureAfterBus(cause, ErrorKind.PAIRING_FAILED);
        });
    }

    private CompletableFuture<CompletableFuture<CommandResult>> acceptPair(String deviceId) {
        long token = pairing.pendingInboundToken(deviceId);
        return awaitReply(deviceId, daemon.acceptPairing(deviceId), error -> {
            if (error == null) {
                Transition transition = pairing.applyReply(deviceId, token, true);
                apply(transition);
                if (pairing.isPaired(deviceId)) {
                    return CommandResult.ok();
                }
                return CommandResult.failure(ErrorKind.PAIRING_FAILED,
                        "La petición de " + deviceId + " ya no estaba pendiente");
            }
            SessionException cause = SessionErrors.asSessionException(error);
            Transition transition = pairing.fail(deviceId, token);
            if (transition.outcome() == Outcome.TRANSITIONED) {
                apply(transition);
                emit(SessionEventType.PAIRING_FAILED, deviceId, cause.getMessage());
            }
            return failureAfterBus(cause, ErrorKind.PAIRING_FAILED);
        });
    }

    /**
     * La respuesta de {@code call} se procesa en una tarea nueva de la cola del
     * dispositivo, con el token capturado al emitir la petición.
     */
    private CompletableFuture<CompletableFuture<CommandResult>> awaitReply(String deviceId,
            CompletableFuture<Void> call, Function<Throwable, CommandResult> onReply) {
        CompletableFuture<CommandResult> reply = call
                .handle((ignored, error) -> error)
                .thenCompose(error -> queues.enqueue(deviceId,
                        () -> CompletableFuture.completedFuture(onReply.apply(error))));
        return CompletableFuture.completedFuture(reply);
    }

    private CompletableFuture<CommandResult> rejectPair(String deviceId) {
        apply(pairing.reject(deviceId));
        return daemon.rejectPairing(deviceId).handle((ignored, error) -> resultOf(error));
    }

    private CompletableFuture<CommandResult> cancelPairing(String deviceId) {
        Transition transition = pairing.cancel(deviceId);
        if (transition.outcome() != Outcome.TRANSITIONED) {
            return CompletableFuture.completedFuture(CommandResult.ok());
        }
        apply(transition);
        return withdraw(deviceId, transition.from()).handle((ignored, error) -> resultOf(error));
    }

    /** Retira en el daemon una petición pendiente: se cancela la propia o se rechaza la ajena. */
    private CompletableFuture<Void> withdraw(String deviceId, PairingState pendingState) {
        return pendingState == PairingState.REQUEST_RECEIVED
                ? daemon.rejectPairing(deviceId)
                : daemon.cancelPairing(deviceId);
    }

    private CompletableFuture<CommandResult> unpair(String deviceId) {
        apply(pairing.beginUnpair(deviceId));
        return daemon.unpair(deviceId).handle((ignored, error) -> {
            if (error == null) {
                apply(pairing.completeUnpair(deviceId));
                return CommandResult.ok();
            }
            apply(pairing.abortUnpair(deviceId));
            return SessionErrors.toResult(error);
        });
    }

    private CompletableFuture<CommandResult> setPluginEnabled(String deviceId, PluginKind kind, Boolean enabled) {
        if (kind == null || !kind.isKnown()) {
            throw new SessionException(ErrorKind.UNKNOWN_PLUGIN, "Plugin desconocido: " + kind);
        }
        if (enabled == null) {
            throw new SessionException(ErrorKind.INVALID_STATE, "Falta el valor de activación");
        }
        return negotiator.setEnabled(deviceId, kind, enabled).thenApply(changed -> {
            if (changed) {
                publish();
            }
            return CommandResult.ok();
        });
    }

    // ── Señales ───────────────────────────────────────────────────────────────

    @Override
    public void onSignal(BusSignal signal) {
        switch (signal.type()) {
            case BUS_CONNECTED -> {
                onBusConnected();
                return;
            }
            case BUS_DISCONNECTED -> {
                onBusDisconnected();
                return;
            }
            default -> {
            }
        }
        if (signal.deviceId() == null) {
            log.debug("Señal {} sin dispositivo descartada", signal.type());
            return;
        }
        queues.enqueue(signal.deviceId(), () -> handleDeviceSignal(signal))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.warn("Señal {} de {} no procesada: {}", signal.type(), signal.deviceId(),
                                SessionErrors.unwrap(error).getMessage());
                    }
                });
    }

    private CompletableFuture<Void> handleDeviceSignal(BusSignal signal) {
        String deviceId = signal.deviceId();
        if (signal.type() == BusSignalType.DEVICE_ADDED) {
            return discover(deviceId);
        }
        if (signal.type() == BusSignalType.DEVICE_REMOVED) {
            removeDevice(deviceId);
            return done();
        }
        if (!registry.contains(deviceId)) {
            log.debug("Señal {} de un dispositivo no registrado {}: se descubre", signal.type(), deviceId);
            return discover(deviceId);
        }
        return switch (signal.type()) {
            case REACHABILITY_CHANGED -> {
                if (registry.upsert(deviceId, DeviceUpdate.reachability(signal.booleanValue(BusSignal.REACHABLE)))) {
                    publish();
                }
                yield done();
            }
            case NAME_CHANGED -> {
                if (registry.upsert(deviceId, DeviceUpdate.name(signal.stringValue(BusSignal.NAME)))) {
                    publish();
                }
                yield done();
            }
            case PAIR_STATE_CHANGED -> {
                registry.upsert(deviceId, DeviceUpdate.seen());
                yield onDaemonPairState(deviceId,
                        PairingState.fromDaemon(signal.intValue(BusSignal.PAIR_STATE, -1)));
            }
            case PAIRING_FAILED -> {
                registry.upsert(deviceId, DeviceUpdate.seen());
                pairing.session(deviceId)
                        .filter(session -> session.state().isPending())
                        .ifPresent(session -> {
                            Transition transition = pairing.fail(deviceId, session.token());
                            if (transition.outcome() == Outcome.TRANSITIONED) {
                                apply(transition);
                                emit(SessionEventType.PAIRING_FAILED, deviceId, signal.stringValue(BusSignal.ERROR));
                            }
                        });
                yield done();
            }
            case PLUGINS_CHANGED -> {
                registry.upsert(deviceId, DeviceUpdate.seen());
                yield refreshCapabilities(deviceId);
            }
            default -> {
                log.debug("Señal {} ignorada", signal.type());
                yield done();
            }
        };
    }

    private CompletableFuture<Void> onDaemonPairState(String deviceId, PairingState daemonState) {
        if (daemonState == PairingState.UNKNOWN) {
            log.debug("Estado de emparejamiento desconocido para {}", deviceId);
            return done();
        }
        PairingState before = pairing.state(deviceId);
        Transition transition = pairing.reportDaemonState(deviceId, daemonState);
        apply(transition);
        if (transition.outcome() == Outcome.ACCEPTED_BY_TIE_BREAK) {
            return acceptAfterTieBreak(deviceId).thenApply(ignored -> null);
        }
        if (transition.outcome() != Outcome.TRANSITIONED) {
            return done();
        }
        if (transition.to() == PairingState.REQUEST_RECEIVED) {
            emit(SessionEventType.PAIRING_REQUESTED, deviceId, "Petición de emparejamiento de " + displayName(deviceId));
        } else if (before.isPending() && transition.to() == PairingState.UNPAIRED) {
            emit(SessionEventType.PAIRING_REJECTED, deviceId, "El dispositivo rechazó el emparejamiento");
        }
        return done();
    }

    /** Las peticiones cruzadas se resuelven aceptando la entrante en el daemon. */
    private CompletableFuture<CommandResult> acceptAfterTieBreak(String deviceId) {
        return daemon.acceptPairing(deviceId).handle((ignored, error) -> {
            if (error == null) {
                return CommandResult.ok();
            }
            SessionException cause = SessionErrors.asSessionException(error);
            apply(pairing.completeUnpair(deviceId));
            emit(SessionEventType.PAIRING_FAILED, deviceId, cause.getMessage());
            return failureAfterBus(cause, ErrorKind.PAIRING_FAILED);
        });
    }

    private void onBusConnected() {
        boolean wasConnected = busConnected;
        busConnected = true;
        if (!wasConnected) {
            emit(SessionEventType.BUS_RECONNECTED, null, "Conexión con el daemon restablecida");
        }
        publish();
        resync();
    }

    private void onBusDisconnected() {
        if (!busConnected) {
            return;
        }
        busConnected = false;
        emit(SessionEventType.BUS_DISCONNECTED, null, "Conexión con el daemon perdida");
        publish();
    }

    // ── Sincronización ────────────────────────────────────────────────────────

    /**
     * Resincronización completa: lista los dispositivos del daemon, lee propiedades
     * y capacidades de cada uno y retira los que ya no existen.
     */
    public CompletableFuture<Void> resync() {
        return daemon.listDevices()
                .thenCompose(ids -> {
                    Set<String> present = new HashSet<>(ids);
                    List<CompletableFuture<Void>> work = ids.stream()
                            .map(id -> queues.enqueue(id, () -> discover(id)).exceptionally(error -> {
                                log.warn("No se pudo sincronizar {}: {}", id, SessionErrors.unwrap(error).getMessage());
                                return null;
                            }))
                            .collect(Collectors.toCollection(ArrayList::new));
                    registry.snapshot().stream()
                            .map(Device::id)
                            .filter(id -> !present.contains(id))
                            .forEach(id -> work.add(queues.enqueue(id, () -> {
                                removeDevice(id);
                                return done();
                            })));
                    return CompletableFuture.allOf(work.toArray(new CompletableFuture[0]));
                })
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.warn("Resincronización con el daemon fallida: {}", SessionErrors.unwrap(error).getMessage());
                        return;
                    }
                    log.info("Resincronización completada: {} dispositivos", registry.snapshot().size());
                    if (settled.compareAndSet(false, true)
                            && !arbiter.settle(pairing.pairedDevices())) {
                        emit(SessionEventType.SUPPRESSION_UNAVAILABLE, null,
                                "No se pudo revertir la supresión de notificaciones pendiente");
                    }
                    publish();
                });
    }

    private CompletableFuture<Void> discover(String deviceId) {
        return daemon.deviceInfo(deviceId).thenCompose(info -> {
            boolean changed = registry.upsert(deviceId, info.toUpdate());
            if (changed) {
                publish();
            }
            return applyDaemonView(info).thenCompose(ignored -> refreshCapabilities(deviceId));
        });
    }

    /**
     * Ajusta la máquina de emparejamiento a lo que el daemon reporta en sus
     * propiedades. Si hay que aceptar por peticiones cruzadas, el futuro devuelto
     * incluye esa llamada.
     */
    private CompletableFuture<Void> applyDaemonView(DeviceInfo info) {
        String deviceId = info.id();
        Transition discovered = pairing.discover(deviceId, info.paired());
        if (discovered.outcome() == Outcome.TRANSITIONED) {
            apply(discovered);
        } else if (info.paired()) {
            apply(pairing.reportDaemonState(deviceId, PairingState.PAIRED));
        } else if (pairing.state(deviceId) == PairingState.PAIRED) {
            apply(pairing.reportDaemonState(deviceId, PairingState.UNPAIRED));
        }
        if (info.paired() || !info.pairRequestedByPeer()) {
            return done();
        }
        Transition inbound = pairing.receiveInbound(deviceId);
        apply(inbound);
        if (inbound.outcome() == Outcome.TRANSITIONED) {
            emit(SessionEventType.PAIRING_REQUESTED, deviceId,
                    "Petición de emparejamiento de " + displayName(deviceId));
        } else if (inbound.outcome() == Outcome.ACCEPTED_BY_TIE_BREAK) {
            return acceptAfterTieBreak(deviceId).thenApply(ignored -> null);
        }
        return done();
    }

    private CompletableFuture<Void> refreshCapabilities(String deviceId) {
        return daemon.capabilities(deviceId).thenCompose(report -> {
            if (negotiator.reconcile(deviceId, report)) {
                publish();
            }
            return refreshTelemetry(deviceId);
        });
    }

    /**
     * Relee batería y cobertura si sus plugins están activos. Una lectura fallida
     * conserva los valores anteriores y no hace fallar la sincronización.
     */
    private CompletableFuture<Void> refreshTelemetry(String deviceId) {
        boolean battery = negotiator.isActive(deviceId, PluginKind.BATTERY);
        boolean signal = negotiator.isActive(deviceId, PluginKind.SIGNAL_STRENGTH);
        if (!battery && !signal) {
            if (registry.updateTelemetry(deviceId, DeviceTelemetry.none())) {
                publish();
            }
            return done();
        }
        return daemon.telemetry(deviceId, battery, signal)
                .thenAccept(readings -> {
                    if (registry.updateTelemetry(deviceId, readings)) {
                        publish();
                    }
                })
                .exceptionally(error -> {
                    log.debug("Telemetría de {} sin actualizar: {}", deviceId, SessionErrors.unwrap(error).getMessage());
                    return null;
                });
    }

    private void removeDevice(String deviceId) {
        if (!registry.contains(deviceId)) {
            return;
        }
        if (pairing.isPaired(deviceId) || pairing.state(deviceId) == PairingState.UNPAIRING) {
            reportSuppression(arbiter.onRemoved(deviceId), deviceId);
        }
        negotiator.removeDevice(deviceId);
        pairing.forget(deviceId);
        registry.remove(deviceId);
        log.info("Dispositivo {} retirado", deviceId);
        publish();
    }

    /**
     * Barrido periódico: los dispositivos en silencio se vuelven a consultar; los
     * que no responden pasan a inalcanzables y los no emparejados que llevan
     * demasiado tiempo así se retiran.
     */
    public void sweep() {
        Instant now = clock.instant();
        for (Device device : registry.silentSince(now.minus(unreachableTimeout))) {
            String deviceId = device.id();
            boolean expired = device.lastSeen().isBefore(now.minus(removeAfter));
            queues.enqueue(deviceId, () -> {
                if (expired && !device.isReachable() && pairing.state(deviceId) == PairingState.UNPAIRED) {
                    removeDevice(deviceId);
                    return done();
                }
                return daemon.deviceInfo(deviceId)
                        .thenAccept(info -> {
                            if (registry.upsert(deviceId, info.toUpdate())) {
                                publish();
                            }
                        })
                        .exceptionally(error -> {
                            log.debug("{} no responde: {}", deviceId, SessionErrors.unwrap(error).getMessage());
                            if (registry.markUnreachable(deviceId)) {
                                publish();
                            }
                            return null;
                        });
            });
        }
    }

    // ── Transiciones y publicación ────────────────────────────────────────────

    /** Propaga una transición al registro, al árbitro y al negociador. */
    private void apply(Transition transition) {
        if (transition == null || !transition.changed()) {
            return;
        }
        String deviceId = transition.deviceId();
        registry.updatePairingState(deviceId, transition.to());
        if (transition.to().isPending() && transition.expiresAt() != null) {
            scheduleExpiry(deviceId, transition.token(), transition.expiresAt());
        }
        if (transition.becamePaired()) {
            reportSuppression(arbiter.onPaired(deviceId), deviceId);
            queues.enqueue(deviceId, () -> refreshCapabilities(deviceId))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.warn("Capacidades de {} sin actualizar: {}", deviceId,
                                    SessionErrors.unwrap(error).getMessage());
                        }
                    });
        } else if (transition.leftPaired()) {
            reportSuppression(arbiter.onUnpaired(deviceId), deviceId);
            negotiator.markAllUnavailable(deviceId);
            registry.updateTelemetry(deviceId, DeviceTelemetry.none());
        }
        publish();
    }

    /**
     * Al vencer el plazo la petición se cierra y se retira también en el daemon,
     * para que no pueda completarse a destiempo.
     */
    private void scheduleExpiry(String deviceId, long token, Instant expiresAt) {
        long delayMs = Math.max(1L, Duration.between(clock.instant(), expiresAt).toMillis());
        scheduler.schedule(() -> queues.enqueue(deviceId, () -> {
            Transition transition = pairing.expire(deviceId, token);
            if (transition.outcome() == Outcome.TRANSITIONED && transition.changed()) {
                apply(transition);
                emit(SessionEventType.PAIRING_TIMED_OUT, deviceId, "La petición de emparejamiento expiró");
                return withdraw(deviceId, transition.from()).exceptionally(error -> {
                    log.warn("No se pudo retirar en el daemon la petición expirada de {}: {}", deviceId,
                            SessionErrors.unwrap(error).getMessage());
                    return null;
                });
            }
            if (transition.outcome() == Outcome.IGNORED && transition.token() == token) {
                // el temporizador se adelantó al reloj
                scheduleExpiry(deviceId, token, expiresAt);
            }
            return done();
        }), delayMs, TimeUnit.MILLISECONDS);
    }

    private void reportSuppression(boolean ok, String deviceId) {
        if (!ok) {
            emit(SessionEventType.SUPPRESSION_UNAVAILABLE, deviceId,
                    "Las notificaciones siguen a cargo del daemon");
        }
    }

    private void publish() {
        publisher.publish(sequence -> new SessionSnapshot(
                sequence,
                clock.instant(),
                busConnected,
                registry.snapshot(),
                pairing.snapshot(),
                negotiator.snapshot(),
                arbiter.rules(pairing.pairedDevices())));
    }

    private void emit(SessionEventType type, String deviceId, String message) {
        publisher.publishEvent(new SessionEvent(type, deviceId, message, clock.instant()));
    }

    private String displayName(String deviceId) {
        return registry.find(deviceId).map(Device::name).orElse(deviceId);
    }

    private static CommandResult resultOf(Throwable error) {
        return error == null ? CommandResult.ok() : SessionErrors.toResult(error);
    }

    /** BUS_UNAVAILABLE se conserva; el resto se informa como {@code fallback}. */
    private static CommandResult failureAfterBus(SessionException cause, ErrorKind fallback) {
        ErrorKind kind = cause.getKind() == ErrorKind.BUS_UNAVAILABLE || cause.getKind() == ErrorKind.TIMEOUT
                ? cause.getKind()
                : fallback;
        return CommandResult.failure(kind, cause.getMessage());
    }

    private static <T> CompletableFuture<CompletableFuture<T>> settled(CompletableFuture<T> work) {
        return work.thenApply(CompletableFuture::completedFuture);
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }
}
