package com.brixo.connecthub.session.bus;

import com.brixo.connecthub.session.model.DeviceInfo;
import com.brixo.connecthub.session.model.DeviceTelemetry;
import com.brixo.connecthub.session.model.DeviceType;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.freedesktop.dbus.interfaces.DBus;
import org.freedesktop.dbus.interfaces.DBusInterface;
import org.freedesktop.dbus.interfaces.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Pasarela sobre el bus de sesión D-Bus hacia el daemon KDE Connect.
 *
 * Una sola conexión compartida; un chequeo periódico detecta tanto la caída del
 * bus (se reconecta con espera exponencial y se vuelven a registrar los
 * manejadores de señales) como el reinicio del daemon (el nombre
 * org.kde.kdeconnect pierde y recupera dueño). En ambos casos se emite
 * BUS_DISCONNECTED / BUS_CONNECTED para que el gestor resincronice.
 */
public class DbusBusGateway implements BusGateway {

    private static final Logger log = LoggerFactory.getLogger(DbusBusGateway.class);

    static final String BUS_NAME = "org.kde.kdeconnect";
    static final String DAEMON_PATH = "/modules/kdeconnect";
    static final String DEVICE_PATH_PREFIX = "/modules/kdeconnect/devices/";
    private static final String DEVICE_INTERFACE = "org.kde.kdeconnect.device";

    private final ScheduledExecutorService scheduler;
    private final ExecutorService callExecutor;
    private final long healthCheckMs;
    private final long reconnectInitialMs;
    private final long reconnectMaxMs;

    private final CopyOnWriteArrayList<BusSignalListener> listeners = new CopyOnWriteArrayList<>();

    private volatile DBusConnection connection;
    private volatile boolean daemonPresent;
    private volatile boolean closed;
    private long reconnectDelayMs;

    public DbusBusGateway(ScheduledExecutorService scheduler, ExecutorService callExecutor,
            long healthCheckMs, long reconnectInitialMs, long reconnectMaxMs) {
        this.scheduler = scheduler;
        this.callExecutor = callExecutor;
        this.healthCheckMs = healthCheckMs;
        this.reconnectInitialMs = reconnectInitialMs;
        this.reconnectMaxMs = reconnectMaxMs;
        this.reconnectDelayMs = reconnectInitialMs;
    }

    // ── Ciclo de vida ─────────────────────────────────────────────────────────

    @Override
    public void start() {
        scheduler.execute(this::connect);
        scheduler.scheduleWithFixedDelay(this::checkHealth, healthCheckMs, healthCheckMs,
                TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        closed = true;
        dropConnection();
        listeners.clear();
    }

    @Override
    public void subscribe(BusSignalListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    @Override
    public void unsubscribe(BusSignalListener listener) {
        listeners.remove(listener);
    }

    @Override
    public boolean isConnected() {
        DBusConnection conn = connection;
        return conn != null && conn.isConnected() && daemonPresent;
    }

    private synchronized void connect() {
        if (closed || connection != null) {
            return;
        }
        try {
            DBusConnection conn = DBusConnectionBuilder.forSessionBus().build();
            registerHandlers(conn);
            connection = conn;
            reconnectDelayMs = reconnectInitialMs;
            log.info("Conectado al bus de sesión D-Bus");
            checkHealth();
        } catch (DBusException | RuntimeException e) {
            log.warn("No se pudo conectar al bus de sesión: {}; reintento en {} ms",
                    e.getMessage(), reconnectDelayMs);
            scheduler.schedule(this::connect, reconnectDelayMs, TimeUnit.MILLISECONDS);
            reconnectDelayMs = Math.min(reconnectDelayMs * 2, reconnectMaxMs);
        }
    }

    private void registerHandlers(DBusConnection conn) throws DBusException {
        conn.addSigHandler(KdeConnectDaemon.DeviceAdded.class,
                s -> emit(BusSignal.of(BusSignalType.DEVICE_ADDED, s.id())));
        conn.addSigHandler(KdeConnectDaemon.DeviceRemoved.class,
                s -> emit(BusSignal.of(BusSignalType.DEVICE_REMOVED, s.id())));
        conn.addSigHandler(KdeConnectDaemon.DeviceVisibilityChanged.class,
                s -> emit(BusSignal.of(BusSignalType.REACHABILITY_CHANGED, s.id(),
                        BusSignal.REACHABLE, s.visible())));
        conn.addSigHandler(KdeConnectDevice.PairStateChanged.class,
                s -> emit(BusSignal.of(BusSignalType.PAIR_STATE_CHANGED, deviceIdFromPath(s.getPath()),
                        BusSignal.PAIR_STATE, s.pairState())));
        conn.addSigHandler(KdeConnectDevice.PairingFailed.class,
                s -> emit(BusSignal.of(BusSignalType.PAIRING_FAILED, deviceIdFromPath(s.getPath()),
                        BusSignal.ERROR, s.error() != null ? s.error() : "")));
        conn.addSigHandler(KdeConnectDevice.ReachableChanged.class,
                s -> emit(BusSignal.of(BusSignalType.REACHABILITY_CHANGED, deviceIdFromPath(s.getPath()),
                        BusSignal.REACHABLE, s.reachable())));
        conn.addSigHandler(KdeConnectDevice.NameChanged.class,
                s -> emit(BusSignal.of(BusSignalType.NAME_CHANGED, deviceIdFromPath(s.getPath()),
                        BusSignal.NAME, s.name() != null ? s.name() : "")));
        conn.addSigHandler(KdeConnectDevice.PluginsChanged.class,
                s -> emit(BusSignal.of(BusSignalType.PLUGINS_CHANGED, deviceIdFromPath(s.getPath()))));
    }

    /**
     * Comprueba que la conexión sigue viva y que el daemon tiene dueño en el bus.
     * Cualquier transición se anuncia a los receptores.
     */
    private synchronized void checkHealth() {
        if (closed) {
            return;
        }
        DBusConnection conn = connection;
        if (conn == null) {
            return;
        }
        if (!conn.isConnected()) {
            log.warn("Conexión D-Bus perdida, reconectando");
            dropConnection();
            emit(BusSignal.of(BusSignalType.BUS_DISCONNECTED, null));
            scheduler.execute(this::connect);
            return;
        }
        boolean present;
        try {
            DBus dbus = conn.getRemoteObject("org.freedesktop.DBus", "/org/freedesktop/DBus", DBus.class);
            present = dbus.NameHasOwner(BUS_NAME);
        } catch (DBusException | DBusExecutionException e) {
            log.debug("Fallo comprobando el dueño de {}: {}", BUS_NAME, e.getMessage());
            present = false;
        }
        if (present != daemonPresent) {
            daemonPresent = present;
            if (present) {
                log.info("Daemon {} disponible en el bus", BUS_NAME);
                emit(BusSignal.of(BusSignalType.BUS_CONNECTED, null));
            } else {
                log.warn("Daemon {} no disponible en el bus", BUS_NAME);
                emit(BusSignal.of(BusSignalType.BUS_DISCONNECTED, null));
            }
        }
    }

    private void dropConnection() {
        DBusConnection conn = connection;
        connection = null;
        daemonPresent = false;
        if (conn != null) {
            try {
                conn.close();
            } catch (Exception e) {
                log.debug("Error cerrando la conexión D-Bus: {}", e.getMessage());
            }
        }
    }

    private void emit(BusSignal signal) {
        for (BusSignalListener listener : listeners) {
            try {
                listener.onSignal(signal);
            } catch (RuntimeException e) {
                log.error("Receptor de señales falló con {}: {}", signal.type(), e.getMessage());
            }
        }
    }

    static String deviceIdFromPath(String path) {
        if (path == null || !path.startsWith(DEVICE_PATH_PREFIX)) {
            return null;
        }
        String rest = path.substring(DEVICE_PATH_PREFIX.length());
        int slash = rest.indexOf('/');
        return slash >= 0 ? rest.substring(0, slash) : rest;
    }

    // ── Llamadas ──────────────────────────────────────────────────────────────

    @Override
    public CompletableFuture<Object> call(String deviceId, BusMethod method, Object... args) {
        DBusConnection conn = connection;
        if (conn == null || !conn.isConnected()) {
            return CompletableFuture.failedFuture(BusException.unavailable("Sin conexión con el bus de sesión"));
        }
        return CompletableFuture.supplyAsync(() -> invoke(conn, deviceId, method, args), callExecutor);
    }

    private Object invoke(DBusConnection conn, String deviceId, BusMethod method, Object[] args) {
        try {
            return switch (method) {
                case LIST_DEVICES -> List.copyOf(remote(conn, DAEMON_PATH, KdeConnectDaemon.class).devices(false, false));
                case DEVICE_INFO -> readDeviceInfo(conn, deviceId);
                case PLUGIN_STATES -> readPluginStates(conn, deviceId);
                case DEVICE_TELEMETRY -> readTelemetry(conn, deviceId, (Boolean) args[0], (Boolean) args[1]);
                case REQUEST_PAIRING -> {
                    device(conn, deviceId).requestPairing();
                    yield null;
                }
                case ACCEPT_PAIRING -> {
                    device(conn, deviceId).acceptPairing();
                    yield null;
                }
                case REJECT_PAIRING -> {
                    device(conn, deviceId).rejectPairing();
                    yield null;
                }
                case CANCEL_PAIRING -> {
                    device(conn, deviceId).cancelPairing();
                    yield null;
                }
                case UNPAIR -> {
                    device(conn, deviceId).unpair();
                    yield null;
                }
                case SET_PLUGIN_ENABLED -> {
                    device(conn, deviceId).setPluginEnabled((String) args[0], (Boolean) args[1]);
                    yield null;
                }
                case PING -> {
                    plugin(conn, deviceId, KdeConnectPlugins.Ping.OBJECT, KdeConnectPlugins.Ping.class).sendPing();
                    yield null;
                }
                case RING -> {
                    plugin(conn, deviceId, KdeConnectPlugins.FindMyPhone.OBJECT,
                            KdeConnectPlugins.FindMyPhone.class).ring();
                    yield null;
                }
                case SEND_CLIPBOARD -> {
                    plugin(conn, deviceId, KdeConnectPlugins.Clipboard.OBJECT,
                            KdeConnectPlugins.Clipboard.class).sendClipboard((String) args[0]);
                    yield null;
                }
                case SHARE_URL -> {
                    plugin(conn, deviceId, KdeConnectPlugins.Share.OBJECT,
                            KdeConnectPlugins.Share.class).shareUrl((String) args[0]);
                    yield null;
                }
                case LOCK_DEVICE -> {
                    plugin(conn, deviceId, KdeConnectPlugins.LockDevice.OBJECT,
                            KdeConnectPlugins.LockDevice.class).lock();
                    yield null;
                }
            };
        } catch (DBusException e) {
            throw new BusException("No se pudo obtener el objeto remoto para " + method, true, e);
        } catch (DBusExecutionException e) {
            throw new BusException("El daemon rechazó " + method + ": " + e.getMessage(),
                    isTransient(e), e);
        }
    }

    private DeviceInfo readDeviceInfo(DBusConnection conn, String deviceId) throws DBusException {
        Properties props = remote(conn, DEVICE_PATH_PREFIX + deviceId, Properties.class);
        String name = props.Get(DEVICE_INTERFACE, "name");
        String type = props.Get(DEVICE_INTERFACE, "type");
        Boolean reachable = props.Get(DEVICE_INTERFACE, "isReachable");
        Boolean paired = props.Get(DEVICE_INTERFACE, "isPaired");
        Boolean requestedByPeer = props.Get(DEVICE_INTERFACE, "isPairRequestedByPeer");
        return new DeviceInfo(deviceId,
                name != null ? name : "Unknown",
                DeviceType.fromDaemon(type),
                Boolean.TRUE.equals(reachable),
                Boolean.TRUE.equals(paired),
                Boolean.TRUE.equals(requestedByPeer));
    }

    private Map<String, Boolean> readPluginStates(DBusConnection conn, String deviceId) throws DBusException {
        Properties props = remote(conn, DEVICE_PATH_PREFIX + deviceId, Properties.class);
        Object supported = props.Get(DEVICE_INTERFACE, "supportedPlugins");
        KdeConnectDevice device = device(conn, deviceId);
        Map<String, Boolean> states = new LinkedHashMap<>();
        for (String pluginId : asStrings(supported)) {
            states.put(pluginId, device.isPluginEnabled(pluginId));
        }
        return states;
    }

    /**
     * Batería y cobertura viven en los objetos de sus plugins. Una propiedad que
     * el plugin aún no expone se deja en null sin invalidar el resto.
     */
    private DeviceTelemetry readTelemetry(DBusConnection conn, String deviceId, boolean battery, boolean signal)
            throws DBusException {
        Integer charge = null;
        Boolean charging = null;
        Integer strength = null;
        String networkType = null;
        if (battery) {
            Properties props = plugin(conn, deviceId, KdeConnectPlugins.Battery.OBJECT, Properties.class);
            charge = asInteger(optionalProperty(props, KdeConnectPlugins.Battery.INTERFACE, "charge"));
            charging = asBoolean(optionalProperty(props, KdeConnectPlugins.Battery.INTERFACE, "isCharging"));
        }
        if (signal) {
            Properties props = plugin(conn, deviceId, KdeConnectPlugins.ConnectivityReport.OBJECT, Properties.class);
            strength = asInteger(optionalProperty(props, KdeConnectPlugins.ConnectivityReport.INTERFACE,
                    "cellularNetworkStrength"));
            Object type = optionalProperty(props, KdeConnectPlugins.ConnectivityReport.INTERFACE,
                    "cellularNetworkType");
            networkType = type != null ? String.valueOf(type) : null;
        }
        return new DeviceTelemetry(charge, charging, strength, networkType);
    }

    private static Object optionalProperty(Properties props, String iface, String property) {
        try {
            return props.Get(iface, property);
        } catch (DBusExecutionException e) {
            log.debug("Propiedad {}.{} no disponible: {}", iface, property, e.getMessage());
            return null;
        }
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number number ? number.intValue() : null;
    }

    private static Boolean asBoolean(Object value) {
        return value instanceof Boolean flag ? flag : null;
    }

    private static List<String> asStrings(Object value) {
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).collect(Collectors.toList());
        }
        if (value instanceof Object[] items) {
            return Arrays.stream(items).map(String::valueOf).collect(Collectors.toList());
        }
        return List.of();
    }

    private static KdeConnectDevice device(DBusConnection conn, String deviceId) throws DBusException {
        return remote(conn, DEVICE_PATH_PREFIX + deviceId, KdeConnectDevice.class);
    }

    private static <T extends DBusInterface> T plugin(DBusConnection conn, String deviceId, String object,
            Class<T> type) throws DBusException {
        return remote(conn, DEVICE_PATH_PREFIX + deviceId + "/" + object, type);
    }

    private static <T extends DBusInterface> T remote(DBusConnection conn, String path, Class<T> type)
            throws DBusException {
        return conn.getRemoteObject(BUS_NAME, path, type);
    }

    /** Errores del bus que desaparecen solos cuando el daemon vuelve. */
    private static boolean isTransient(DBusExecutionException e) {
        String message = String.valueOf(e.getMessage());
        return message.contains("ServiceUnknown")
                || message.contains("NoReply")
                || message.contains("Disconnected")
                || message.contains("UnknownObject")
                || message.contains("Timeout");
    }
}
