package com.brixo.connecthub.session.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.brixo.connecthub.session.bus.BusMethod;
import com.brixo.connecthub.session.bus.DaemonClient;
import com.brixo.connecthub.session.bus.FakeBusGateway;
import com.brixo.connecthub.session.model.CapabilityReport;
import com.brixo.connecthub.session.model.CommandResult;
import com.brixo.connecthub.session.model.DeviceAction;
import com.brixo.connecthub.session.model.DeviceInfo;
import com.brixo.connecthub.session.model.DeviceType;
import com.brixo.connecthub.session.model.ErrorKind;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeviceActionServiceTest {

    private static final String PHONE = "phone-123";

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private final FakeBusGateway gateway = new FakeBusGateway();
    private ScheduledExecutorService scheduler;
    private DeviceRegistryService registry;
    private PairingStateMachine pairing;
    private PluginCapabilityNegotiator negotiator;
    private DeviceActionService actions;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        DeviceInfo info = new DeviceInfo(PHONE, "Pixel 8", DeviceType.PHONE, true, true, false);
        gateway.addDevice(info, Map.of());
        registry = new DeviceRegistryService(clock);
        registry.upsert(PHONE, info.toUpdate());
        pairing = new PairingStateMachine(clock, Duration.ofSeconds(30), true);
        DaemonClient daemon = new DaemonClient(gateway, scheduler, 1000, 1, 5, 10, false);
        negotiator = new PluginCapabilityNegotiator(pairing, daemon, clock);
        actions = new DeviceActionService(registry, pairing, negotiator, daemon,
                new DeviceWorkQueues(Runnable::run), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void pingNeedsOnlyPairing() {
        pairing.discover(PHONE, true);

        CommandResult result = actions.perform(PHONE, DeviceAction.PING, null).join();

        assertTrue(result.success());
        assertEquals(1, gateway.callsTo(BusMethod.PING).size());
    }

    @Test
    void unpairedDevicesCannotBePinged() {
        pairing.discover(PHONE, false);

        CommandResult result = actions.perform(PHONE, DeviceAction.PING, null).join();

        assertEquals(ErrorKind.NOT_PAIRED, result.error());
        assertTrue(gateway.callsTo(BusMethod.PING).isEmpty());
    }

    @Test
    void unknownDevicesAreReported() {
        CommandResult result = actions.perform("ghost", DeviceAction.PING, null).join();

        assertEquals(ErrorKind.UNKNOWN_DEVICE, result.error());
    }

    @Test
    void actionsRequireTheirPlugin() {
        pairing.discover(PHONE, true);
        negotiator.reconcile(PHONE, CapabilityReport.fromPluginIds(Map.of(
                "kdeconnect_clipboard", true,
                "kdeconnect_findmyphone", false)));

        assertEquals(ErrorKind.UNKNOWN_PLUGIN, actions.perform(PHONE, DeviceAction.SHARE_URL, "https://kde.org").join().error());
        assertEquals(ErrorKind.INVALID_STATE, actions.perform(PHONE, DeviceAction.RING, null).join().error());
        assertTrue(actions.perform(PHONE, DeviceAction.SEND_CLIPBOARD, "hola").join().success());

        List<FakeBusGateway.Call> sent = gateway.callsTo(BusMethod.SEND_CLIPBOARD);
        assertEquals(1, sent.size());
        assertEquals(List.of("hola"), sent.get(0).args());
    }

    @Test
    void lockGoesThroughTheLockDevicePlugin() {
        pairing.discover(PHONE, true);
        assertEquals(ErrorKind.UNKNOWN_PLUGIN, actions.perform(PHONE, DeviceAction.LOCK, null).join().error());

        negotiator.reconcile(PHONE, CapabilityReport.fromPluginIds(Map.of("kdeconnect_lockdevice", true)));
        CommandResult result = actions.perform(PHONE, DeviceAction.LOCK, null).join();

        assertTrue(result.success());
        assertEquals(1, gateway.callsTo(BusMethod.LOCK_DEVICE).size());
    }

    @Test
    void missingActionIsInvalid() {
        assertEquals(ErrorKind.INVALID_STATE, actions.perform(PHONE, null, null).join().error());
    }
}
