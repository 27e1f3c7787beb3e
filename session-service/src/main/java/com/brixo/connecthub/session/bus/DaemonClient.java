package com.brixo.connecthub.session.bus;

import com.brixo.connecthub.session.exception.SessionErrors;
import com.brixo.connecthub.session.exception.SessionException;
import com.brixo.connecthub.session.model.CapabilityReport;
import com.brixo.connecthub.session.model.DeviceAction;
import com.brixo.connecthub.session.model.DeviceInfo;
import com.brixo.connecthub.session.model.DeviceTelemetry;
import com.brixo.connecthub.session.model.ErrorKind;
import com.brixo.connecthub.session.model.PluginKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cliente tipado del daemon KDE Connect.
 *
 * Cada llamada queda acotada por {@code callTimeoutMs}. Los fallos transitorios
 * (bus caído, daemon reiniciando, timeout) se reintentan con espera exponencial
 * hasta {@code maxAttempts} intentos; agotados, la operación falla con
 * {@link ErrorKind#BUS_UNAVAILABLE}. Con {@code failFast} activo no se intenta
 * nada mientras la pasarela esté desconectada.
 */
public class DaemonClient {

    private static final Logger log = LoggerFactory.getLogger(DaemonClient.class);

    private final BusGateway gateway;
    private final ScheduledExecutorService scheduler;
    private final long callTimeoutMs;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final boolean failFast;

    public DaemonClient(BusGateway gateway, ScheduledExecutorService scheduler, long callTimeoutMs,
            int maxAttempts, long initialBackoffMs, long maxBackoffMs, boolean failFast) {
        this.gateway = gateway;
        this.scheduler = scheduler;
        this.callTimeoutMs = callTimeoutMs;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
        this.failFast = failFast;
    }

    public boolean isConnected() {
        return gateway.isConnected();
    }

    /**
     * Tiempo máximo que puede tardar una llamada agotando todos sus intentos:
     * cada intento con su plazo más las esperas entre ellos.
     */
    public long retryBudgetMs() {
        long budget = callTimeoutMs * maxAttempts;
        long backoff = initialBackoffMs;
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            budget += backoff;
            backoff = Math.min(backoff * 2, maxBackoffMs);
        }
        return budget;
    }

    // ── Consultas ─────────────────────────────────────────────────────────────

    public CompletableFuture<List<String>> listDevices() {
        return this.<List<String>>callWithRetry(null, BusMethod.LIST_DEVICES)
                .thenApply(ids -> ids != null ? ids : List.of());
    }

    public CompletableFuture<DeviceInfo> deviceInfo(String deviceId) {
        return callWithRetry(deviceId, BusMethod.DEVICE_INFO);
    }

    public CompletableFuture<CapabilityReport> capabilities(String deviceId) {
        return this.<Map<String, Boolean>>callWithRetry(deviceId, BusMethod.PLUGIN_STATES)
                .thenApply(states -> CapabilityReport.fromPluginIds(states != null ? states : Map.of()));
    }

    /** Lee batería y cobertura; sólo se consulta lo que se pide. */
    public CompletableFuture<DeviceTelemetry> telemetry(String deviceId, boolean battery, boolean signal) {
        if (!battery && !signal) {
            return CompletableFuture.completedFuture(DeviceTelemetry.none());
        }
        return this.<DeviceTelemetry>callWithRetry(deviceId, BusMethod.DEVICE_TELEMETRY, battery, signal)
                .thenApply(telemetry -> telemetry != null ? telemetry : DeviceTelemetry.none());
    }

    // ── Emparejamiento ────────────────────────────────────────────────────────

    public CompletableFuture<Void> requestPairing(String deviceId) {
        return invoke(deviceId, BusMethod.REQUEST_PAIRING);
    }

    public CompletableFuture<Void> acceptPairing(String deviceId) {
        return invoke(deviceId, BusMethod.ACCEPT_PAIRING);
    }

    public CompletableFuture<Void> rejectPairing(String deviceId) {
        return invoke(deviceId, BusMethod.REJECT_PAIRING);
    }

    public CompletableFuture<Void> cancelPairing(String deviceId) {
        return invoke(deviceId, BusMethod.CANCEL_PAIRING);
    }

    public CompletableFuture<Void> unpair(String deviceId) {
        return invoke(deviceId, BusMethod.UNPAIR);
    }

    // ── Plugins y acciones ────────────────────────────────────────────────────

    public CompletableFuture<Void> setPluginEnabled(String deviceId, PluginKind kind, boolean enabled) {
        return invoke(deviceId, BusMethod.SET_PLUGIN_ENABLED, kind.pluginId(), enabled);
    }

    public CompletableFuture<Void> perform(String deviceId, DeviceAction action, String argument) {
        return switch (action) {
            case PING -> invoke(deviceId, BusMethod.PING);
            case RING -> invoke(deviceId, BusMethod.RING);
            case SEND_CLIPBOARD -> invoke(deviceId, BusMethod.SEND_CLIPBOARD, argument != null ? argument : "");
            case SHARE_URL -> invoke(deviceId, BusMethod.SHARE_URL, toUrl(argument));
            case LOCK -> invoke(deviceId, BusMethod.LOCK_DEVICE);
        };
    }

    /** Las rutas locales se comparten como file://, igual que hace el applet. */
    static String toUrl(String argument) {
        if (argument == null || argument.isBlank()) {
            throw new SessionException(ErrorKind.INVALID_STATE, "Falta la URL o ruta a compartir");
        }
        return argument.contains("://") ? argument : "file://" + argument;
    }

    // ── Reintentos ────────────────────────────────────────────────────────────

    private CompletableFuture<Void> invoke(String deviceId, BusMethod method, Object... args) {
        return this.<Object>callWithRetry(deviceId, method, args).thenApply(ignored -> null);
    }

    private <T> CompletableFuture<T> callWithRetry(String deviceId, BusMethod method, Object... args) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(result, deviceId, method, args, 1, initialBackoffMs);
        return result;
    }

    @SuppressWarnings("unchecked")
    private <T> void attempt(CompletableFuture<T> result, String deviceId, BusMethod method, Object[] args,
            int attemptNumber, long backoffMs) {
        if (failFast && !gateway.isConnected()) {
            result.completeExceptionally(new SessionException(ErrorKind.BUS_UNAVAILABLE,
                    "Daemon no disponible: " + method));
            return;
        }
        CompletableFuture<Object> call;
        try {
            call = gateway.call(deviceId, method, args);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.orTimeout(callTimeoutMs, TimeUnit.MILLISECONDS).whenComplete((value, error) -> {
            if (error == null) {
                result.complete((T) value);
                return;
            }
            Throwable cause = SessionErrors.unwrap(error);
            if (isRetryable(cause) && attemptNumber < maxAttempts) {
                log.debug("{} sobre {} falló (intento {}/{}): {}; reintento en {} ms",
                        method, deviceId, attemptNumber, maxAttempts, cause.getMessage(), backoffMs);
                scheduler.schedule(
                        () -> attempt(result, deviceId, method, args, attemptNumber + 1,
                                Math.min(backoffMs * 2, maxBackoffMs)),
                        backoffMs, TimeUnit.MILLISECONDS);
                return;
            }
            result.completeExceptionally(translate(method, cause, attemptNumber));
        });
    }

    private static boolean isRetryable(Throwable cause) {
        return cause instanceof TimeoutException
                || (cause instanceof BusException busError && busError.isTransient());
    }

    private RuntimeException translate(BusMethod method, Throwable cause, int attempts) {
        if (cause instanceof SessionException sessionError) {
            return sessionError;
        }
        if (isRetryable(cause) || !gateway.isConnected()) {
            log.warn("{} sin respuesta del daemon tras {} intentos: {}", method, attempts, cause.getMessage());
            return new SessionException(ErrorKind.BUS_UNAVAILABLE,
                    "Daemon no disponible para " + method, cause);
        }
        log.warn("{} rechazado por el daemon: {}", method, cause.getMessage());
        return new SessionException(ErrorKind.INVALID_STATE,
                "El daemon rechazó " + method + ": " + cause.getMessage(), cause);
    }
}
