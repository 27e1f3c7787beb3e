package com.brixo.connecthub.session.service;

import com.brixo.connecthub.session.model.Device;
import com.brixo.connecthub.session.model.DeviceTelemetry;
import com.brixo.connecthub.session.model.DeviceType;
import com.brixo.connecthub.session.model.DeviceUpdate;
import com.brixo.connecthub.session.model.PairingState;
import com.brixo.connecthub.session.model.Reachability;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Registro de dispositivos anunciados por el daemon.
 *
 * Sólo lo muta el gestor de sesiones desde la cola del dispositivo afectado; el
 * orden de llegada de las señales es la única secuencia válida (último en
 * escribir gana), nunca el reloj de pared. Es memoria pura: no puede fallar.
 */
public class DeviceRegistryService {

    private final Map<String, Device> devices = new ConcurrentHashMap<>();
    private final Clock clock;

    public DeviceRegistryService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Fusiona los campos observados en el registro del dispositivo, creándolo si es
     * la primera vez que se ve. {@code lastSeen} se refresca siempre.
     *
     * @return true si cambió algún campo observable (todo salvo lastSeen)
     */
    public boolean upsert(String deviceId, DeviceUpdate update) {
        Instant now = clock.instant();
        AtomicBoolean changed = new AtomicBoolean();
        devices.compute(deviceId, (id, current) -> {
            Device merged;
            if (current == null) {
                merged = new Device(id,
                        update.name() != null ? update.name() : id,
                        update.type() != null ? update.type() : DeviceType.UNKNOWN,
                        update.reachability() != null ? update.reachability() : Reachability.REACHABLE,
                        update.pairingState() != null ? update.pairingState() : PairingState.UNPAIRED,
                        DeviceTelemetry.none(),
                        now);
                changed.set(true);
            } else {
                merged = new Device(id,
                        update.name() != null ? update.name() : current.name(),
                        update.type() != null ? update.type() : current.type(),
                        update.reachability() != null ? update.reachability() : current.reachability(),
                        update.pairingState() != null ? update.pairingState() : current.pairingState(),
                        current.telemetry(),
                        now);
                changed.set(!sameObservableState(current, merged));
            }
            return merged;
        });
        return changed.get();
    }

    /** Marca el dispositivo como inalcanzable sin perder su historia. */
    public boolean markUnreachable(String deviceId) {
        AtomicBoolean changed = new AtomicBoolean();
        devices.computeIfPresent(deviceId, (id, current) -> {
            if (current.reachability() == Reachability.UNREACHABLE) {
                return current;
            }
            changed.set(true);
            return current.withReachability(Reachability.UNREACHABLE);
        });
        return changed.get();
    }

    /** Refleja en el registro el estado de emparejamiento decidido por la máquina. */
    public boolean updatePairingState(String deviceId, PairingState state) {
        AtomicBoolean changed = new AtomicBoolean();
        devices.computeIfPresent(deviceId, (id, current) -> {
            if (current.pairingState() == state) {
                return current;
            }
            changed.set(true);
            return current.withPairingState(state);
        });
        return changed.get();
    }

    /** Sustituye las lecturas de batería y cobertura; no cuenta como avistamiento. */
    public boolean updateTelemetry(String deviceId, DeviceTelemetry telemetry) {
        DeviceTelemetry value = telemetry != null ? telemetry : DeviceTelemetry.none();
        AtomicBoolean changed = new AtomicBoolean();
        devices.computeIfPresent(deviceId, (id, current) -> {
            if (value.equals(current.telemetry())) {
                return current;
            }
            changed.set(true);
            return current.withTelemetry(value);
        });
        return changed.get();
    }

    public boolean remove(String deviceId) {
        return devices.remove(deviceId) != null;
    }

    /** Busca un dispositivo por su id. */
    public Optional<Device> find(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    public boolean contains(String deviceId) {
        return devices.containsKey(deviceId);
    }

    /** Copia inmutable ordenada por id. */
    public List<Device> snapshot() {
        return devices.values().stream()
                .sorted(Comparator.comparing(Device::id))
                .collect(Collectors.toUnmodifiableList());
    }

    /** Dispositivos sin señales desde antes de {@code cutoff}. */
    public List<Device> silentSince(Instant cutoff) {
        return devices.values().stream()
                .filter(device -> device.lastSeen().isBefore(cutoff))
                .collect(Collectors.toUnmodifiableList());
    }

    private static boolean sameObservableState(Device a, Device b) {
        return Objects.equals(a.name(), b.name())
                && a.type() == b.type()
                && a.reachability() == b.reachability()
                && a.pairingState() == b.pairingState()
                && Objects.equals(a.telemetry(), b.telemetry());
    }
}
