package com.brixo.connecthub.session.bus;

import com.brixo.connecthub.session.model.DeviceInfo;
import com.brixo.connecthub.session.model.DeviceTelemetry;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Daemon en memoria para pruebas: guarda dispositivos y plugins, registra cada
 * llamada y permite inyectar fallos o dejar llamadas sin responder.
 */
public class FakeBusGateway implements BusGateway {

    public record Call(String deviceId, BusMethod method, List<Object> args) {
    }

    private final List<BusSignalListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, DeviceInfo> devices = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Boolean>> plugins = new ConcurrentHashMap<>();
    private final Map<String, DeviceTelemetry> telemetry = new ConcurrentHashMap<>();
    private final Map<BusMethod, Deque<RuntimeException>> failures = new ConcurrentHashMap<>();
    private final Map<BusMethod, CompletableFuture<Object>> held = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private volatile boolean connected = true;

    // ── Preparación ───────────────────────────────────────────────────────────

    public FakeBusGateway addDevice(DeviceInfo info, Map<String, Boolean> pluginStates) {
        devices.put(info.id(), info);
        plugins.put(info.id(), new LinkedHashMap<>(pluginStates));
        return this;
    }

    public void updateDevice(DeviceInfo info) {
        devices.put(info.id(), info);
    }

    public void setPlugins(String deviceId, Map<String, Boolean> pluginStates) {
        plugins.put(deviceId, new LinkedHashMap<>(pluginStates));
    }

    public void setTelemetry(String deviceId, DeviceTelemetry readings) {
        telemetry.put(deviceId, readings);
    }

    public void removeDevice(String deviceId) {
        devices.remove(deviceId);
        plugins.remove(deviceId);
    }

    /** Las próximas {@code times} llamadas a {@code method} fallan con {@code error}. */
    public synchronized void failNext(BusMethod method, int times, RuntimeException error) {
        Deque<RuntimeException> queue = failures.computeIfAbsent(method, m -> new ArrayDeque<>());
        for (int i = 0; i < times; i++) {
            queue.add(error);
        }
    }

    /** Las llamadas a {@code method} quedan pendientes hasta completar el futuro devuelto. */
    public CompletableFuture<Object> hold(BusMethod method) {
        return held.computeIfAbsent(method, m -> new CompletableFuture<>());
    }

    public void release(BusMethod method) {
        held.remove(method);
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    public void emit(BusSignal signal) {
        for (BusSignalListener listener : listeners) {
            listener.onSignal(signal);
        }
    }

    // ── Consultas ─────────────────────────────────────────────────────────────

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public List<Call> callsTo(BusMethod method) {
        return calls.stream().filter(call -> call.method() == method).collect(Collectors.toList());
    }

    public int listenerCount() {
        return listeners.size();
    }

    // ── BusGateway ────────────────────────────────────────────────────────────

    @Override
    public void subscribe(BusSignalListener listener) {
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(BusSignalListener listener) {
        listeners.remove(listener);
    }

    @Override
    public CompletableFuture<Object> call(String deviceId, BusMethod method, Object... args) {
        calls.add(new Call(deviceId, method, Arrays.asList(args)));
        RuntimeException failure = nextFailure(method);
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        CompletableFuture<Object> pending = held.get(method);
        if (pending != null) {
            return pending;
        }
        try {
            return CompletableFuture.completedFuture(answer(deviceId, method, args));
        } catch (BusException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void start() {
    }

    @Override
    public void close() {
        listeners.clear();
    }

    private synchronized RuntimeException nextFailure(BusMethod method) {
        Deque<RuntimeException> queue = failures.get(method);
        return queue != null ? queue.poll() : null;
    }

    private Object answer(String deviceId, BusMethod method, Object[] args) {
        return switch (method) {
            case LIST_DEVICES -> devices.keySet().stream().sorted().collect(Collectors.toList());
            case DEVICE_INFO -> requireDevice(deviceId);
            case PLUGIN_STATES -> {
                requireDevice(deviceId);
                yield Map.copyOf(plugins.getOrDefault(deviceId, Map.of()));
            }
            case DEVICE_TELEMETRY -> {
                requireDevice(deviceId);
                DeviceTelemetry stored = telemetry.getOrDefault(deviceId, DeviceTelemetry.none());
                boolean battery = (Boolean) args[0];
                boolean signal = (Boolean) args[1];
                yield new DeviceTelemetry(
                        battery ? stored.batteryCharge() : null,
                        battery ? stored.charging() : null,
                        signal ? stored.cellularStrength() : null,
                        signal ? stored.cellularNetworkType() : null);
            }
            case SET_PLUGIN_ENABLED -> {
                requireDevice(deviceId);
                plugins.computeIfAbsent(deviceId, id -> new LinkedHashMap<>())
                        .put((String) args[0], (Boolean) args[1]);
                yield null;
            }
            default -> null;
        };
    }

    private DeviceInfo requireDevice(String deviceId) {
        DeviceInfo info = devices.get(deviceId);
        if (info == null) {
            throw new BusException("No such object: " + deviceId, false);
        }
        return info;
    }
}
