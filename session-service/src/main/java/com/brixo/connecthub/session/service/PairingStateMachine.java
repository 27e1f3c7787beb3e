package com.brixo.connecthub.session.service;

import com.brixo.connecthub.session.exception.SessionException;
import com.brixo.connecthub.session.model.ErrorKind;
import com.brixo.connecthub.session.model.PairingSession;
import com.brixo.connecthub.session.model.PairingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Máquina de emparejamiento por dispositivo.
 *
 * Cada petición (saliente o entrante) recibe un token nuevo y un plazo. Las
 * respuestas, fallos y expiraciones llevan el token con el que se emitieron: si no
 * coincide con el de la sesión vigente son obsoletas y se descartan sin tocar el
 * estado. Todo cierre de una petición (cancelación, rechazo, fallo o expiración)
 * retira su token: un "emparejado" del daemon que llegue dentro del plazo de la
 * petición cerrada también se trata como obsoleto.
 *
 * Sólo existe {@link PairingSession} en REQUEST_SENT, REQUEST_RECEIVED, PAIRED y
 * UNPAIRING. Los dispositivos conocidos sin sesión están en UNPAIRED.
 */
public class PairingStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PairingStateMachine.class);

    /** Qué hizo una operación con el estado. */
    public enum Outcome {
        TRANSITIONED,
        /** Petición entrante y saliente simultáneas resueltas como aceptación. */
        ACCEPTED_BY_TIE_BREAK,
        IGNORED,
        STALE
    }

    public record Transition(
            String deviceId,
            PairingState from,
            PairingState to,
            long token,
            Instant expiresAt,
            Outcome outcome) {

        public boolean changed() {
            return from != to;
        }

        public boolean becamePaired() {
            return to == PairingState.PAIRED && from != PairingState.PAIRED;
        }

        /** Salida de PAIRED/UNPAIRING hacia un estado no emparejado. */
        public boolean leftPaired() {
            return (from == PairingState.PAIRED || from == PairingState.UNPAIRING)
                    && to != PairingState.PAIRED && to != PairingState.UNPAIRING;
        }
    }

    private record RetiredToken(long token, Instant until) {
    }

    private final Map<String, PairingSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, RetiredToken> retired = new ConcurrentHashMap<>();
    private final Set<String> known = ConcurrentHashMap.newKeySet();
    private final AtomicLong tokens = new AtomicLong();
    private final Clock clock;
    private final Duration requestTimeout;
    private final boolean inboundWins;

    public PairingStateMachine(Clock clock, Duration requestTimeout, boolean inboundWins) {
        this.clock = clock;
        this.requestTimeout = requestTimeout;
        this.inboundWins = inboundWins;
    }

    // ── Consultas ─────────────────────────────────────────────────────────────

    public PairingState state(String deviceId) {
        PairingSession session = sessions.get(deviceId);
        if (session != null) {
            return session.state();
        }
        return known.contains(deviceId) ? PairingState.UNPAIRED : PairingState.UNKNOWN;
    }

    public Optional<PairingSession> session(String deviceId) {
        return Optional.ofNullable(sessions.get(deviceId));
    }

    public boolean isPaired(String deviceId) {
        return state(deviceId) == PairingState.PAIRED;
    }

    public Set<String> pairedDevices() {
        return sessions.values().stream()
                .filter(s -> s.state() == PairingState.PAIRED)
                .map(PairingSession::deviceId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public List<PairingSession> snapshot() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(PairingSession::deviceId))
                .collect(Collectors.toUnmodifiableList());
    }

    // ── Descubrimiento ────────────────────────────────────────────────────────

    /**
     * Primer avistamiento: UNPAIRED, o PAIRED si el daemon ya lo tenía emparejado.
     * En avistamientos posteriores no hace nada.
     */
    public Transition discover(String deviceId, boolean daemonPaired) {
        if (!known.add(deviceId)) {
            return unchanged(deviceId);
        }
        if (daemonPaired) {
            PairingSession session = new PairingSession(deviceId, PairingState.PAIRED, tokens.incrementAndGet(), null);
            sessions.put(deviceId, session);
            return transition(deviceId, PairingState.UNKNOWN, session, Outcome.TRANSITIONED);
        }
        return new Transition(deviceId, PairingState.UNKNOWN, PairingState.UNPAIRED, 0L, null, Outcome.TRANSITIONED);
    }

    // ── Peticiones ────────────────────────────────────────────────────────────

    /** Petición saliente emitida por un consumidor. */
    public Transition requestOutbound(String deviceId) {
        PairingState current = requireKnown(deviceId);
        return switch (current) {
            case UNPAIRED -> openPending(deviceId, current, PairingState.REQUEST_SENT);
            case REQUEST_SENT -> unchanged(deviceId);
            case REQUEST_RECEIVED -> inboundWins
                    ? acceptByTieBreak(deviceId, current)
                    : openPending(deviceId, current, PairingState.REQUEST_SENT);
            default -> throw new SessionException(ErrorKind.INVALID_STATE,
                    "El dispositivo " + deviceId + " ya está emparejado");
        };
    }

    /** Petición entrante anunciada por el daemon. */
    public Transition receiveInbound(String deviceId) {
        known.add(deviceId);
        PairingState current = state(deviceId);
        switch (current) {
            case UNPAIRED -> {
                return openPending(deviceId, current, PairingState.REQUEST_RECEIVED);
            }
            case REQUEST_SENT -> {
                if (inboundWins) {
                    return acceptByTieBreak(deviceId, current);
                }
                log.debug("Petición entrante de {} ignorada: gana la saliente", deviceId);
                return unchanged(deviceId);
            }
            default -> {
                return unchanged(deviceId);
            }
        }
    }

    /**
     * Token de la petición entrante pendiente, para aceptarla o rechazarla.
     *
     * @throws SessionException INVALID_STATE si no hay petición entrante
     */
    public long pendingInboundToken(String deviceId) {
        PairingSession session = sessions.get(deviceId);
        requireKnown(deviceId);
        if (session == null || session.state() != PairingState.REQUEST_RECEIVED) {
            throw new SessionException(ErrorKind.INVALID_STATE,
                    "No hay petición de emparejamiento pendiente de " + deviceId);
        }
        return session.token();
    }

    /** Rechazo local de una petición entrante. */
    public Transition reject(String deviceId) {
        long token = pendingInboundToken(deviceId);
        return close(deviceId, token, "rechazo local");
    }

    /**
     * Cancela la petición pendiente. Cualquier respuesta posterior a su token
     * será obsoleta.
     */
    public Transition cancel(String deviceId) {
        requireKnown(deviceId);
        PairingSession session = sessions.get(deviceId);
        if (session == null || !session.state().isPending()) {
            return unchanged(deviceId);
        }
        return close(deviceId, session.token(), "cancelación");
    }

    // ── Respuestas ────────────────────────────────────────────────────────────

    /** Respuesta de aceptación o rechazo para la petición con {@code token}. */
    public Transition applyReply(String deviceId, long token, boolean accepted) {
        PairingSession session = sessions.get(deviceId);
        if (isStale(deviceId, session, token)) {
            return stale(deviceId, token, accepted ? "aceptación" : "rechazo");
        }
        if (accepted) {
            PairingSession paired = new PairingSession(deviceId, PairingState.PAIRED, token, null);
            sessions.put(deviceId, paired);
            retired.remove(deviceId);
            log.info("Dispositivo {} emparejado (token {})", deviceId, token);
            return transition(deviceId, session.state(), paired, Outcome.TRANSITIONED);
        }
        return close(deviceId, token, "rechazo");
    }

    /** Fallo del bus durante la petición con {@code token}. */
    public Transition fail(String deviceId, long token) {
        PairingSession session = sessions.get(deviceId);
        if (isStale(deviceId, session, token)) {
            return stale(deviceId, token, "fallo");
        }
        return close(deviceId, token, "fallo del bus");
    }

    /** Vencimiento del plazo de la petición con {@code token}. */
    public Transition expire(String deviceId, long token) {
        PairingSession session = sessions.get(deviceId);
        if (isStale(deviceId, session, token)) {
            return stale(deviceId, token, "expiración");
        }
        if (session.expiresAt() != null && clock.instant().isBefore(session.expiresAt())) {
            return unchanged(deviceId);
        }
        return close(deviceId, token, "expiración");
    }

    /**
     * Estado de emparejamiento reportado por el daemon (señal pairStateChanged o
     * resincronización).
     */
    public Transition reportDaemonState(String deviceId, PairingState daemonState) {
        known.add(deviceId);
        PairingSession session = sessions.get(deviceId);
        PairingState current = state(deviceId);
        return switch (daemonState) {
            case PAIRED -> {
                if (current.isPending()) {
                    yield applyReply(deviceId, session.token(), true);
                }
                if (current != PairingState.UNPAIRED) {
                    yield unchanged(deviceId);
                }
                RetiredToken retiredToken = retired.get(deviceId);
                if (retiredToken != null && clock.instant().isBefore(retiredToken.until())) {
                    yield stale(deviceId, retiredToken.token(), "emparejado tras cerrar la petición");
                }
                PairingSession adopted = new PairingSession(deviceId, PairingState.PAIRED,
                        tokens.incrementAndGet(), null);
                sessions.put(deviceId, adopted);
                log.info("Dispositivo {} emparejado fuera de este gestor", deviceId);
                yield transition(deviceId, current, adopted, Outcome.TRANSITIONED);
            }
            case UNPAIRED -> {
                if (current.isPending()) {
                    yield applyReply(deviceId, session.token(), false);
                }
                if (current == PairingState.PAIRED || current == PairingState.UNPAIRING) {
                    yield completeUnpair(deviceId);
                }
                yield unchanged(deviceId);
            }
            case REQUEST_RECEIVED -> receiveInbound(deviceId);
            case REQUEST_SENT -> current == PairingState.UNPAIRED
                    ? openPending(deviceId, current, PairingState.REQUEST_SENT)
                    : unchanged(deviceId);
            default -> unchanged(deviceId);
        };
    }

    // ── Desemparejado ─────────────────────────────────────────────────────────

    public Transition beginUnpair(String deviceId) {
        PairingSession session = sessions.get(deviceId);
        if (session == null || session.state() != PairingState.PAIRED) {
            requireKnown(deviceId);
            throw new SessionException(ErrorKind.NOT_PAIRED, "El dispositivo " + deviceId + " no está emparejado");
        }
        PairingSession unpairing = session.withState(PairingState.UNPAIRING);
        sessions.put(deviceId, unpairing);
        return transition(deviceId, PairingState.PAIRED, unpairing, Outcome.TRANSITIONED);
    }

    public Transition completeUnpair(String deviceId) {
        PairingSession session = sessions.get(deviceId);
        if (session == null || (session.state() != PairingState.UNPAIRING && session.state() != PairingState.PAIRED)) {
            return unchanged(deviceId);
        }
        sessions.remove(deviceId);
        log.info("Dispositivo {} desemparejado", deviceId);
        return new Transition(deviceId, session.state(), PairingState.UNPAIRED, session.token(), null,
                Outcome.TRANSITIONED);
    }

    /** El daemon no confirmó el desemparejado: se vuelve a PAIRED. */
    public Transition abortUnpair(String deviceId) {
        PairingSession session = sessions.get(deviceId);
        if (session == null || session.state() != PairingState.UNPAIRING) {
            return unchanged(deviceId);
        }
        PairingSession paired = session.withState(PairingState.PAIRED);
        sessions.put(deviceId, paired);
        return transition(deviceId, PairingState.UNPAIRING, paired, Outcome.TRANSITIONED);
    }

    /** Olvida por completo un dispositivo retirado del registro. */
    public void forget(String deviceId) {
        sessions.remove(deviceId);
        retired.remove(deviceId);
        known.remove(deviceId);
    }

    // ── Auxiliares ────────────────────────────────────────────────────────────

    private PairingState requireKnown(String deviceId) {
        PairingState current = state(deviceId);
        if (current == PairingState.UNKNOWN) {
            throw new SessionException(ErrorKind.UNKNOWN_DEVICE, "Dispositivo desconocido: " + deviceId);
        }
        return current;
    }

    private Transition openPending(String deviceId, PairingState from, PairingState pendingState) {
        PairingSession session = new PairingSession(deviceId, pendingState, tokens.incrementAndGet(),
                clock.instant().plus(requestTimeout));
        sessions.put(deviceId, session);
        retired.remove(deviceId);
        log.info("Emparejamiento {} → {} con {} (token {})", from, pendingState, deviceId, session.token());
        return transition(deviceId, from, session, Outcome.TRANSITIONED);
    }

    private Transition acceptByTieBreak(String deviceId, PairingState from) {
        PairingSession session = sessions.get(deviceId);
        PairingSession paired = new PairingSession(deviceId, PairingState.PAIRED, session.token(), null);
        sessions.put(deviceId, paired);
        log.info("Peticiones cruzadas con {}: gana la entrante, se acepta (token {})", deviceId, session.token());
        return transition(deviceId, from, paired, Outcome.ACCEPTED_BY_TIE_BREAK);
    }

    /** Cierra la sesión pendiente y retira su token durante un plazo de petición. */
    private Transition close(String deviceId, long token, String reason) {
        PairingSession session = sessions.remove(deviceId);
        retired.put(deviceId, new RetiredToken(token, clock.instant().plus(requestTimeout)));
        PairingState from = session != null ? session.state() : PairingState.UNPAIRED;
        log.info("Emparejamiento con {} cerrado por {} (token {})", deviceId, reason, token);
        return new Transition(deviceId, from, PairingState.UNPAIRED, token, null, Outcome.TRANSITIONED);
    }

    private static boolean isStale(String deviceId, PairingSession session, long token) {
        return session == null || !session.state().isPending() || session.token() != token;
    }

    private Transition stale(String deviceId, long token, String what) {
        log.debug("Respuesta obsoleta descartada ({}) para {} con token {}", what, deviceId, token);
        PairingState current = state(deviceId);
        return new Transition(deviceId, current, current, token, null, Outcome.STALE);
    }

    private Transition unchanged(String deviceId) {
        PairingState current = state(deviceId);
        PairingSession session = sessions.get(deviceId);
        return new Transition(deviceId, current, current,
                session != null ? session.token() : 0L,
                session != null ? session.expiresAt() : null,
                Outcome.IGNORED);
    }

    private static Transition transition(String deviceId, PairingState from, PairingSession to, Outcome outcome) {
        return new Transition(deviceId, from, to.state(), to.token(), to.expiresAt(), outcome);
    }
}
