package com.brixo.connecthub.session.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.brixo.connecthub.session.bus.BusException;
import com.brixo.connecthub.session.bus.BusMethod;
import com.brixo.connecthub.session.bus.BusSignal;
import com.brixo.connecthub.session.bus.BusSignalType;
import com.brixo.connecthub.session.bus.DaemonClient;
import com.brixo.connecthub.session.bus.FakeBusGateway;
import com.brixo.connecthub.session.model.CommandResult;
import com.brixo.connecthub.session.model.CommandType;
import com.brixo.connecthub.session.model.Device;
import com.brixo.connecthub.session.model.DeviceInfo;
import com.brixo.connecthub.session.model.DeviceTelemetry;
import com.brixo.connecthub.session.model.DeviceType;
import com.brixo.connecthub.session.model.ErrorKind;
import com.brixo.connecthub.session.model.EventClass;
import com.brixo.connecthub.session.model.NotificationRoute;
import com.brixo.connecthub.session.model.PairingState;
import com.brixo.connecthub.session.model.PluginKind;
import com.brixo.connecthub.session.model.PluginRecord;
import com.brixo.connecthub.session.model.Reachability;
import com.brixo.connecthub.session.model.SessionCommand;
import com.brixo.connecthub.session.model.SessionEvent;
import com.brixo.connecthub.session.model.SessionEventType;
import com.brixo.connecthub.session.model.SessionSnapshot;
import com.brixo.connecthub.session.notifyrc.KdeConfigFile;
import com.brixo.connecthub.session.notifyrc.NotificationBackupStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.json.JsonMapper;

class SessionManagerTest {

    private static final String PHONE = "phone-123";
    private static final String NOTIFYRC = "[Event/notification]\nAction=Popup\n";

    @TempDir
    Path dir;

    private ScheduledExecutorService scheduler;
    private FakeBusGateway gateway;
    private Path notifyrc;
    private Recorder recorder;
    private DeviceRegistryService registry;
    private PairingStateMachine pairing;
    private PluginCapabilityNegotiator negotiator;
    private NotificationArbiter arbiter;
    private SessionManager manager;

    @BeforeEach
    void setUp() throws IOException {
        scheduler = Executors.newScheduledThreadPool(2);
        gateway = new FakeBusGateway();
        gateway.addDevice(new DeviceInfo(PHONE, "Pixel 8", DeviceType.PHONE, true, false, false),
                Map.of("kdeconnect_sms", false, "kdeconnect_clipboard", true));
        notifyrc = dir.resolve("kdeconnect.notifyrc");
        Files.writeString(notifyrc, NOTIFYRC);
        recorder = new Recorder();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.stop();
        }
        scheduler.shutdownNow();
    }

    @Test
    void startupSyncDiscoversDaemonDevices() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));

        Device device = registry.find(PHONE).orElseThrow();
        assertEquals("Pixel 8", device.name());
        assertEquals(DeviceType.PHONE, device.type());
        assertEquals(PairingState.UNPAIRED, device.pairingState());
        assertEquals(2, negotiator.forDevice(PHONE).size());
        assertTrue(manager.snapshot().sequence() > 0);
        assertEquals(1, gateway.listenerCount());
    }

    @Test
    void inboundPairingLifecycleForPhone123() throws IOException {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));

        gateway.emit(pairState(2));
        assertEquals(PairingState.REQUEST_RECEIVED, pairing.state(PHONE));
        assertTrue(recorder.hasEvent(SessionEventType.PAIRING_REQUESTED));

        assertTrue(submit(SessionCommand.of(CommandType.ACCEPT_PAIR, PHONE)).success());
        assertEquals(PairingState.PAIRED, pairing.state(PHONE));
        assertEquals(1, gateway.callsTo(BusMethod.ACCEPT_PAIRING).size());
        assertTrue(negotiator.find(PHONE, PluginKind.CLIPBOARD).enabled());
        assertFalse(negotiator.find(PHONE, PluginKind.SMS).enabled());

        assertTrue(submit(SessionCommand.setPluginEnabled(PHONE, PluginKind.SMS, true)).success());
        assertTrue(negotiator.find(PHONE, PluginKind.SMS).enabled());

        assertEquals(NotificationRoute.NATIVE, arbiter.route(PHONE, EventClass.ANDROID_NOTIFICATION));
        assertTrue(Files.readString(notifyrc).contains("Popup=false"));
        assertTrue(manager.snapshot().suppressionRules().get(0).daemonSuppressed());

        assertTrue(submit(SessionCommand.of(CommandType.UNPAIR, PHONE)).success());
        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
        assertEquals(NOTIFYRC, Files.readString(notifyrc));
        assertEquals(NotificationRoute.DAEMON, arbiter.route(PHONE, EventClass.ANDROID_NOTIFICATION));
        List<PluginRecord> records = negotiator.forDevice(PHONE);
        assertEquals(2, records.size());
        assertTrue(records.stream().noneMatch(PluginRecord::available));
        assertTrue(records.stream().noneMatch(PluginRecord::enabled));

        assertStrictlyIncreasing(recorder.sequences());
    }

    @Test
    void lateAcceptanceAfterCancelKeepsDeviceUnpaired() throws IOException {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));

        assertTrue(submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE)).success());
        assertEquals(PairingState.REQUEST_SENT, pairing.state(PHONE));
        assertTrue(submit(SessionCommand.of(CommandType.CANCEL_PAIRING, PHONE)).success());

        gateway.emit(pairState(3));

        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
        assertEquals(1, gateway.callsTo(BusMethod.CANCEL_PAIRING).size());
        assertEquals(NOTIFYRC, Files.readString(notifyrc));
    }

    @Test
    void peerRejectionIsReportedAndAllowsRetry() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));
        submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE));

        gateway.emit(pairState(0));

        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
        assertTrue(recorder.hasEvent(SessionEventType.PAIRING_REJECTED));
        assertTrue(submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE)).success());
    }

    @Test
    void unansweredRequestTimesOut() {
        start(Duration.ofMillis(100), Duration.ofSeconds(2));

        submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE));

        waitFor(() -> recorder.hasEvent(SessionEventType.PAIRING_TIMED_OUT));
        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
    }

    @Test
    void crossedRequestsPairTheDevice() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));
        submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE));

        gateway.emit(pairState(2));

        assertEquals(PairingState.PAIRED, pairing.state(PHONE));
        assertEquals(1, gateway.callsTo(BusMethod.ACCEPT_PAIRING).size());
    }

    @Test
    void crossedRequestFoundDuringResyncFinishesInsideTheSync() throws Exception {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));
        CompletableFuture<Object> acceptReply = gateway.hold(BusMethod.ACCEPT_PAIRING);
        assertTrue(submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE)).success());
        gateway.updateDevice(new DeviceInfo(PHONE, "Pixel 8", DeviceType.PHONE, true, false, true));

        CompletableFuture<Void> sync = manager.resync();
        assertEquals(1, gateway.callsTo(BusMethod.ACCEPT_PAIRING).size());
        assertFalse(sync.isDone());

        acceptReply.completeExceptionally(BusException.unavailable("daemon gone"));
        sync.get(1, TimeUnit.SECONDS);

        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
        assertEquals(PairingState.UNPAIRED, registry.find(PHONE).orElseThrow().pairingState());
        assertTrue(recorder.hasEvent(SessionEventType.PAIRING_FAILED));
    }

    @Test
    void busFailureDuringRequestLeavesDeviceUnpaired() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));
        gateway.failNext(BusMethod.REQUEST_PAIRING, 5, BusException.unavailable("daemon gone"));

        CommandResult result = submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE));

        assertEquals(ErrorKind.BUS_UNAVAILABLE, result.error());
        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
        assertTrue(recorder.hasEvent(SessionEventType.PAIRING_FAILED));
    }

    @Test
    void commandsAreBoundedByTimeout() {
        start(Duration.ofSeconds(30), Duration.ofMillis(200));
        gateway.hold(BusMethod.REQUEST_PAIRING);

        CommandResult result = submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE));

        assertEquals(ErrorKind.TIMEOUT, result.error());
    }

    @Test
    void commandsOnUnknownDevicesFail() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));

        CommandResult result = submit(SessionCommand.of(CommandType.REQUEST_PAIR, "ghost"));

        assertEquals(ErrorKind.UNKNOWN_DEVICE, result.error());
    }

    @Test
    void pluginToggleRequiresPairing() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));

        CommandResult result = submit(SessionCommand.setPluginEnabled(PHONE, PluginKind.SMS, true));

        assertEquals(ErrorKind.NOT_PAIRED, result.error());
        assertTrue(gateway.callsTo(BusMethod.SET_PLUGIN_ENABLED).isEmpty());
    }

    @Test
    void unpairingAnUnpairedDeviceFails() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));

        CommandResult result = submit(SessionCommand.of(CommandType.UNPAIR, PHONE));

        assertEquals(ErrorKind.NOT_PAIRED, result.error());
    }

    @Test
    void signalsUpdateTheRegistry() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));

        gateway.emit(BusSignal.of(BusSignalType.REACHABILITY_CHANGED, PHONE, BusSignal.REACHABLE, false));
        gateway.emit(BusSignal.of(BusSignalType.NAME_CHANGED, PHONE, BusSignal.NAME, "Ana's Pixel"));

        Device device = registry.find(PHONE).orElseThrow();
        assertEquals(Reachability.UNREACHABLE, device.reachability());
        assertEquals("Ana's Pixel", device.name());
    }

    @Test
    void addedAndRemovedDevicesFollowTheDaemon() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));
        gateway.addDevice(new DeviceInfo("tablet-9", "Tab S9", DeviceType.TABLET, true, true, false), Map.of());

        gateway.emit(BusSignal.of(BusSignalType.DEVICE_ADDED, "tablet-9"));
        assertEquals(PairingState.PAIRED, pairing.state("tablet-9"));
        assertTrue(arbiter.isSuppressed());

        gateway.emit(BusSignal.of(BusSignalType.DEVICE_REMOVED, "tablet-9"));
        assertTrue(registry.find("tablet-9").isEmpty());
        assertEquals(PairingState.UNKNOWN, pairing.state("tablet-9"));
        assertFalse(arbiter.isSuppressed());
    }

    @Test
    void busLossAndRecoveryAreAnnouncedAndResynced() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));
        gateway.updateDevice(new DeviceInfo(PHONE, "Pixel 8", DeviceType.PHONE, true, true, false));

        gateway.emit(BusSignal.of(BusSignalType.BUS_DISCONNECTED, null));
        assertFalse(manager.snapshot().busConnected());
        assertTrue(recorder.hasEvent(SessionEventType.BUS_DISCONNECTED));

        gateway.emit(BusSignal.of(BusSignalType.BUS_CONNECTED, null));
        assertTrue(recorder.hasEvent(SessionEventType.BUS_RECONNECTED));
        waitFor(() -> pairing.isPaired(PHONE));
        waitFor(() -> manager.snapshot().busConnected());
    }

    @Test
    void subscribersSeeStrictlyIncreasingSequences() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));
        SnapshotSequenceGuard guard = new SnapshotSequenceGuard();

        gateway.emit(pairState(2));
        submit(SessionCommand.of(CommandType.ACCEPT_PAIR, PHONE));
        submit(SessionCommand.of(CommandType.UNPAIR, PHONE));

        List<Long> sequences = recorder.sequences();
        assertStrictlyIncreasing(sequences);
        for (SessionSnapshot snapshot : recorder.snapshots) {
            assertTrue(guard.accept(snapshot));
        }
        assertFalse(guard.accept(recorder.snapshots.get(0)));
    }

    @Test
    void cancelDoesNotWaitForTheOutstandingPairRequest() throws Exception {
        start(Duration.ofSeconds(30), Duration.ofSeconds(5));
        CompletableFuture<Object> daemonReply = gateway.hold(BusMethod.REQUEST_PAIRING);

        CompletableFuture<CommandResult> request = manager.submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE));
        assertEquals(PairingState.REQUEST_SENT, pairing.state(PHONE));

        CommandResult cancel = manager.submit(SessionCommand.of(CommandType.CANCEL_PAIRING, PHONE))
                .get(300, TimeUnit.MILLISECONDS);
        assertTrue(cancel.success());
        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
        assertEquals(1, gateway.callsTo(BusMethod.CANCEL_PAIRING).size());

        daemonReply.complete(null);
        assertTrue(request.get(1, TimeUnit.SECONDS).success());
        gateway.emit(pairState(3));

        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
        assertFalse(recorder.hasEvent(SessionEventType.PAIRING_FAILED));
        assertFalse(arbiter.isSuppressed());
    }

    @Test
    void expiredRequestIsWithdrawnFromTheDaemonAndLateAcceptanceIgnored() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        start(clock, Duration.ofMillis(100), Duration.ofSeconds(2), new SnapshotPublisher());

        assertTrue(submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE)).success());
        clock.advance(Duration.ofMillis(150));

        waitFor(() -> recorder.hasEvent(SessionEventType.PAIRING_TIMED_OUT));
        waitFor(() -> gateway.callsTo(BusMethod.CANCEL_PAIRING).size() == 1);
        gateway.emit(pairState(3));

        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
        assertEquals(PairingState.UNPAIRED, registry.find(PHONE).orElseThrow().pairingState());
        assertFalse(arbiter.isSuppressed());
    }

    @Test
    void blockedSubscriberDoesNotStallOtherDevices() throws Exception {
        gateway.addDevice(new DeviceInfo("tablet-9", "Tab S9", DeviceType.TABLET, true, false, false), Map.of());
        ExecutorService delivery = Executors.newCachedThreadPool();
        CountDownLatch release = new CountDownLatch(1);
        SnapshotPublisher publisher = new SnapshotPublisher(delivery);
        publisher.subscribe(snapshot -> awaitQuietly(release));
        try {
            start(Clock.systemUTC(), Duration.ofSeconds(30), Duration.ofSeconds(2), publisher);

            CommandResult result = manager.submit(SessionCommand.of(CommandType.REQUEST_PAIR, "tablet-9"))
                    .get(1, TimeUnit.SECONDS);

            assertTrue(result.success());
            assertEquals(PairingState.REQUEST_SENT, pairing.state("tablet-9"));
            assertTrue(manager.snapshot().sequence() > 1);
        } finally {
            release.countDown();
            delivery.shutdownNow();
        }
    }

    @Test
    void pairedPhoneReportsBatteryAndSignal() {
        gateway.addDevice(new DeviceInfo(PHONE, "Pixel 8", DeviceType.PHONE, true, true, false), Map.of(
                "kdeconnect_battery", true,
                "kdeconnect_connectivity_report", true));
        gateway.setTelemetry(PHONE, new DeviceTelemetry(87, true, 3, "LTE"));
        start(Duration.ofSeconds(30), Duration.ofSeconds(2));

        assertEquals(new DeviceTelemetry(87, true, 3, "LTE"), registry.find(PHONE).orElseThrow().telemetry());

        gateway.setTelemetry(PHONE, new DeviceTelemetry(86, false, 2, "5G"));
        gateway.emit(BusSignal.of(BusSignalType.PLUGINS_CHANGED, PHONE));
        assertEquals(new DeviceTelemetry(86, false, 2, "5G"), manager.snapshot().devices().get(0).telemetry());

        assertTrue(submit(SessionCommand.of(CommandType.UNPAIR, PHONE)).success());
        assertTrue(registry.find(PHONE).orElseThrow().telemetry().isEmpty());
    }

    @Test
    void unpairedPhoneHasNoTelemetry() {
        gateway.setPlugins(PHONE, Map.of("kdeconnect_battery", true));
        gateway.setTelemetry(PHONE, new DeviceTelemetry(50, false, null, null));

        start(Duration.ofSeconds(30), Duration.ofSeconds(2));

        assertTrue(registry.find(PHONE).orElseThrow().telemetry().isEmpty());
        assertTrue(gateway.callsTo(BusMethod.DEVICE_TELEMETRY).isEmpty());
    }

    @Test
    void sweepMarksSilentDevicesUnreachableAndDropsStaleUnpairedOnes() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        gateway.addDevice(new DeviceInfo("tablet-9", "Tab S9", DeviceType.TABLET, true, true, false), Map.of());
        start(clock, Duration.ofSeconds(30), Duration.ofSeconds(2), new SnapshotPublisher());
        gateway.removeDevice(PHONE);
        gateway.removeDevice("tablet-9");

        clock.advance(Duration.ofMinutes(2));
        manager.sweep();

        assertEquals(Reachability.UNREACHABLE, registry.find(PHONE).orElseThrow().reachability());
        assertEquals(Reachability.UNREACHABLE, registry.find("tablet-9").orElseThrow().reachability());

        clock.advance(Duration.ofMinutes(11));
        manager.sweep();

        assertTrue(registry.find(PHONE).isEmpty());
        assertEquals(PairingState.UNKNOWN, pairing.state(PHONE));
        assertTrue(registry.find("tablet-9").isPresent());
        assertTrue(pairing.isPaired("tablet-9"));
    }

    @Test
    void sweepKeepsDevicesThatStillAnswer() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        start(clock, Duration.ofSeconds(30), Duration.ofSeconds(2), new SnapshotPublisher());

        clock.advance(Duration.ofMinutes(2));
        manager.sweep();

        Device device = registry.find(PHONE).orElseThrow();
        assertEquals(Reachability.REACHABLE, device.reachability());
        assertEquals(clock.instant(), device.lastSeen());
    }

    @Test
    void hungDaemonIsReportedAsBusUnavailable() {
        start(Duration.ofSeconds(30), Duration.ofSeconds(4));
        gateway.hold(BusMethod.REQUEST_PAIRING);

        CommandResult result = submit(SessionCommand.of(CommandType.REQUEST_PAIR, PHONE));

        assertEquals(ErrorKind.BUS_UNAVAILABLE, result.error());
        assertEquals(PairingState.UNPAIRED, pairing.state(PHONE));
    }

    // ── Auxiliares ────────────────────────────────────────────────────────────

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void start(Duration pairingTimeout, Duration commandTimeout) {
        start(Clock.systemUTC(), pairingTimeout, commandTimeout, new SnapshotPublisher());
    }

    private void start(Clock clock, Duration pairingTimeout, Duration commandTimeout, SnapshotPublisher publisher) {
        registry = new DeviceRegistryService(clock);
        pairing = new PairingStateMachine(clock, pairingTimeout, true);
        DaemonClient daemon = new DaemonClient(gateway, scheduler, 1000, 2, 5, 10, false);
        negotiator = new PluginCapabilityNegotiator(pairing, daemon, clock);
        arbiter = new NotificationArbiter(new KdeConfigFile(notifyrc),
                new NotificationBackupStore(dir.resolve("backup.json"), JsonMapper.builder().build()), clock);
        publisher.subscribe(recorder);
        manager = new SessionManager(registry, pairing, negotiator, arbiter, daemon, gateway,
                new DeviceWorkQueues(Runnable::run), publisher, scheduler, clock, commandTimeout,
                Duration.ofMinutes(1), Duration.ofMinutes(10), Duration.ofHours(1));
        manager.start().join();
    }

    private CommandResult submit(SessionCommand command) {
        return manager.submit(command).join();
    }

    private static BusSignal pairState(int daemonState) {
        return BusSignal.of(BusSignalType.PAIR_STATE_CHANGED, PHONE, BusSignal.PAIR_STATE, daemonState);
    }

    private static void assertStrictlyIncreasing(List<Long> sequences) {
        for (int i = 1; i < sequences.size(); i++) {
            assertTrue(sequences.get(i) > sequences.get(i - 1), "secuencias: " + sequences);
        }
    }

    private static void waitFor(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("La condición no se cumplió a tiempo");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrumpido", e);
            }
        }
    }

    private static final class Recorder implements SnapshotSubscriber {

        final List<SessionSnapshot> snapshots = new CopyOnWriteArrayList<>();
        final List<SessionEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void onSnapshot(SessionSnapshot snapshot) {
            snapshots.add(snapshot);
        }

        @Override
        public void onEvent(SessionEvent event) {
            events.add(event);
        }

        boolean hasEvent(SessionEventType type) {
            return events.stream().anyMatch(event -> event.type() == type);
        }

        List<Long> sequences() {
            return snapshots.stream().map(SessionSnapshot::sequence).toList();
        }
    }
}
