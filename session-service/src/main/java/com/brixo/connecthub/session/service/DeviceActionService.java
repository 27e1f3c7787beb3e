package com.brixo.connecthub.session.service;

import com.brixo.connecthub.session.bus.DaemonClient;
import com.brixo.connecthub.session.exception.SessionErrors;
import com.brixo.connecthub.session.exception.SessionException;
import com.brixo.connecthub.session.model.CommandResult;
import com.brixo.connecthub.session.model.DeviceAction;
import com.brixo.connecthub.session.model.ErrorKind;
import com.brixo.connecthub.session.model.PluginKind;
import com.brixo.connecthub.session.model.PluginRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Acciones directas sobre un dispositivo emparejado (ping, hacer sonar, enviar el
 * portapapeles, compartir una URL). Pasan por la misma cola que las órdenes de
 * sesión del dispositivo.
 */
public class DeviceActionService {

    private static final Logger log = LoggerFactory.getLogger(DeviceActionService.class);

    private final DeviceRegistryService registry;
    private final PairingStateMachine pairing;
    private final PluginCapabilityNegotiator negotiator;
    private final DaemonClient daemon;
    private final DeviceWorkQueues queues;
    private final Duration timeout;

    public DeviceActionService(DeviceRegistryService registry, PairingStateMachine pairing,
            PluginCapabilityNegotiator negotiator, DaemonClient daemon, DeviceWorkQueues queues,
            Duration timeout) {
        this.registry = registry;
        this.pairing = pairing;
        this.negotiator = negotiator;
        this.daemon = daemon;
        this.queues = queues;
        this.timeout = timeout;
    }

    public CompletableFuture<CommandResult> perform(String deviceId, DeviceAction action, String argument) {
        if (action == null) {
            return CompletableFuture.completedFuture(
                    CommandResult.failure(ErrorKind.INVALID_STATE, "Falta la acción"));
        }
        return queues.enqueue(deviceId, () -> {
                    requireReady(deviceId, action);
                    log.info("Acción {} sobre {}", action, deviceId);
                    return daemon.perform(deviceId, action, argument);
                })
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> error == null ? CommandResult.ok() : SessionErrors.toResult(error));
    }

    private void requireReady(String deviceId, DeviceAction action) {
        if (!registry.contains(deviceId)) {
            throw new SessionException(ErrorKind.UNKNOWN_DEVICE, "Dispositivo desconocido: " + deviceId);
        }
        if (!pairing.isPaired(deviceId)) {
            throw new SessionException(ErrorKind.NOT_PAIRED, "El dispositivo " + deviceId + " no está emparejado");
        }
        PluginKind required = action.requiredPlugin();
        if (required == null) {
            return;
        }
        PluginRecord record = negotiator.find(deviceId, required);
        if (record == null || !record.available()) {
            throw new SessionException(ErrorKind.UNKNOWN_PLUGIN,
                    "El dispositivo " + deviceId + " no ofrece " + required);
        }
        if (!record.enabled()) {
            throw new SessionException(ErrorKind.INVALID_STATE, "El plugin " + required + " está desactivado");
        }
    }
}
