package com.brixo.connecthub.session.service;

import com.brixo.connecthub.session.bus.DaemonClient;
import com.brixo.connecthub.session.exception.SessionErrors;
import com.brixo.connecthub.session.exception.SessionException;
import com.brixo.connecthub.session.model.CapabilityReport;
import com.brixo.connecthub.session.model.ErrorKind;
import com.brixo.connecthub.session.model.PluginKey;
import com.brixo.connecthub.session.model.PluginKind;
import com.brixo.connecthub.session.model.PluginRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Negociador de capacidades: un {@link PluginRecord} por (dispositivo, tipo).
 *
 * Reconciliar el mismo informe dos veces no cambia nada, ni siquiera
 * {@code lastSync}. Ningún plugin queda activo en un dispositivo que no esté en
 * PAIRED.
 */
public class PluginCapabilityNegotiator {

    private static final Logger log = LoggerFactory.getLogger(PluginCapabilityNegotiator.class);

    private final Map<PluginKey, PluginRecord> records = new ConcurrentHashMap<>();
    private final PairingStateMachine pairing;
    private final DaemonClient daemon;
    private final Clock clock;

    public PluginCapabilityNegotiator(PairingStateMachine pairing, DaemonClient daemon, Clock clock) {
        this.pairing = pairing;
        this.daemon = daemon;
        this.clock = clock;
    }

    // ── Reconciliación ────────────────────────────────────────────────────────

    /**
     * Aplica el informe del daemon. Los tipos ausentes del informe pasan a no
     * disponibles; sus registros se conservan.
     *
     * @return true si cambió algún registro
     */
    public boolean reconcile(String deviceId, CapabilityReport report) {
        boolean paired = pairing.isPaired(deviceId);
        boolean changed = false;
        for (PluginKind kind : PluginKind.values()) {
            if (!kind.isKnown()) {
                continue;
            }
            boolean available = report.isAvailable(kind);
            boolean enabled = paired && available && report.isEnabled(kind);
            PluginKey key = new PluginKey(deviceId, kind);
            PluginRecord current = records.get(key);
            if (current == null && !available) {
                continue;
            }
            if (current != null && current.sameStateAs(available, enabled)) {
                continue;
            }
            records.put(key, new PluginRecord(deviceId, kind, available, enabled, clock.instant()));
            changed = true;
        }
        if (changed) {
            log.debug("Capacidades de {} reconciliadas", deviceId);
        }
        return changed;
    }

    /** Al salir de PAIRED: todo no disponible e inactivo, sin borrar la historia. */
    public boolean markAllUnavailable(String deviceId) {
        boolean changed = false;
        for (PluginRecord record : forDevice(deviceId)) {
            if (!record.sameStateAs(false, false)) {
                records.put(record.key(), new PluginRecord(deviceId, record.kind(), false, false, clock.instant()));
                changed = true;
            }
        }
        return changed;
    }

    public boolean removeDevice(String deviceId) {
        return records.keySet().removeIf(key -> key.deviceId().equals(deviceId));
    }

    // ── Activación ────────────────────────────────────────────────────────────

    /**
     * Activa o desactiva un plugin. Se aplica en local de forma optimista y se
     * revierte si el daemon no lo confirma.
     *
     * @throws SessionException NOT_PAIRED o UNKNOWN_PLUGIN, de forma síncrona
     */
    public CompletableFuture<Boolean> setEnabled(String deviceId, PluginKind kind, boolean enabled) {
        if (!pairing.isPaired(deviceId)) {
            throw new SessionException(ErrorKind.NOT_PAIRED, "El dispositivo " + deviceId + " no está emparejado");
        }
        PluginKey key = new PluginKey(deviceId, kind);
        PluginRecord current = kind != null ? records.get(key) : null;
        if (current == null || !current.available()) {
            throw new SessionException(ErrorKind.UNKNOWN_PLUGIN,
                    "Plugin " + kind + " no disponible en " + deviceId);
        }
        if (current.enabled() == enabled) {
            return CompletableFuture.completedFuture(false);
        }
        records.put(key, new PluginRecord(deviceId, kind, true, enabled, clock.instant()));
        return daemon.setPluginEnabled(deviceId, kind, enabled)
                .handle((ignored, error) -> {
                    if (error != null) {
                        records.put(key, current);
                        log.warn("No se pudo cambiar {} en {}: {}", kind, deviceId,
                                SessionErrors.unwrap(error).getMessage());
                        throw SessionErrors.asSessionException(error);
                    }
                    log.info("Plugin {} {} en {}", kind, enabled ? "activado" : "desactivado", deviceId);
                    return true;
                });
    }

    // ── Consultas ─────────────────────────────────────────────────────────────

    public List<PluginRecord> forDevice(String deviceId) {
        return records.values().stream()
                .filter(record -> record.deviceId().equals(deviceId))
                .sorted(Comparator.comparing(PluginRecord::kind))
                .collect(Collectors.toUnmodifiableList());
    }

    public PluginRecord find(String deviceId, PluginKind kind) {
        return records.get(new PluginKey(deviceId, kind));
    }

    /** Disponible y activo en el dispositivo. */
    public boolean isActive(String deviceId, PluginKind kind) {
        PluginRecord record = find(deviceId, kind);
        return record != null && record.available() && record.enabled();
    }

    public List<PluginRecord> snapshot() {
        return records.values().stream()
                .sorted(Comparator.comparing(PluginRecord::deviceId).thenComparing(PluginRecord::kind))
                .collect(Collectors.toUnmodifiableList());
    }
}
