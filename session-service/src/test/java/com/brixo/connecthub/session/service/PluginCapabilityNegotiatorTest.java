package com.brixo.connecthub.session.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.brixo.connecthub.session.bus.BusException;
import com.brixo.connecthub.session.bus.BusMethod;
import com.brixo.connecthub.session.bus.DaemonClient;
import com.brixo.connecthub.session.bus.FakeBusGateway;
import com.brixo.connecthub.session.exception.SessionException;
import com.brixo.connecthub.session.model.CapabilityReport;
import com.brixo.connecthub.session.model.DeviceInfo;
import com.brixo.connecthub.session.model.DeviceType;
import com.brixo.connecthub.session.model.ErrorKind;
import com.brixo.connecthub.session.model.PluginKind;
import com.brixo.connecthub.session.model.PluginRecord;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PluginCapabilityNegotiatorTest {

    private static final CapabilityReport SMS_AND_CLIPBOARD = new CapabilityReport(Map.of(
            PluginKind.SMS, false,
            PluginKind.CLIPBOARD, true));

    private MutableClock clock;
    private ScheduledExecutorService scheduler;
    private FakeBusGateway gateway;
    private PairingStateMachine pairing;
    private PluginCapabilityNegotiator negotiator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        scheduler = Executors.newSingleThreadScheduledExecutor();
        gateway = new FakeBusGateway();
        gateway.addDevice(new DeviceInfo("phone-123", "Pixel", DeviceType.PHONE, true, true, false),
                Map.of("kdeconnect_sms", false, "kdeconnect_clipboard", true));
        pairing = new PairingStateMachine(clock, Duration.ofSeconds(30), true);
        DaemonClient daemon = new DaemonClient(gateway, scheduler, 1000, 1, 10, 10, false);
        negotiator = new PluginCapabilityNegotiator(pairing, daemon, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void reconcilingTheSameReportTwiceIsIdempotent() {
        pairing.discover("phone-123", true);
        assertTrue(negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD));
        List<PluginRecord> first = negotiator.forDevice("phone-123");
        clock.advance(Duration.ofMinutes(1));

        assertFalse(negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD));

        assertEquals(first, negotiator.forDevice("phone-123"));
    }

    @Test
    void reconcileCreatesOneRecordPerReportedKind() {
        pairing.discover("phone-123", true);

        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);

        assertEquals(2, negotiator.forDevice("phone-123").size());
        assertTrue(negotiator.find("phone-123", PluginKind.CLIPBOARD).enabled());
        assertFalse(negotiator.find("phone-123", PluginKind.SMS).enabled());
        assertNull(negotiator.find("phone-123", PluginKind.BATTERY));
    }

    @Test
    void pluginsStayDisabledWhileNotPaired() {
        pairing.discover("phone-123", false);

        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);

        PluginRecord clipboard = negotiator.find("phone-123", PluginKind.CLIPBOARD);
        assertTrue(clipboard.available());
        assertFalse(clipboard.enabled());
    }

    @Test
    void missingKindsBecomeUnavailableButAreKept() {
        pairing.discover("phone-123", true);
        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);

        negotiator.reconcile("phone-123", new CapabilityReport(Map.of(PluginKind.SMS, false)));

        PluginRecord clipboard = negotiator.find("phone-123", PluginKind.CLIPBOARD);
        assertFalse(clipboard.available());
        assertFalse(clipboard.enabled());
        assertEquals(2, negotiator.forDevice("phone-123").size());
    }

    @Test
    void unknownDaemonPluginsAreNotStored() {
        CapabilityReport report = CapabilityReport.fromPluginIds(Map.of(
                "kdeconnect_sms", true,
                "kdeconnect_virtualmonitor", true));

        pairing.discover("phone-123", true);
        negotiator.reconcile("phone-123", report);

        assertEquals(1, negotiator.forDevice("phone-123").size());
    }

    @Test
    void setEnabledRequiresPairedDevice() {
        pairing.discover("phone-123", false);
        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);

        SessionException unpaired = assertThrows(SessionException.class,
                () -> negotiator.setEnabled("phone-123", PluginKind.SMS, true));
        pairing.requestOutbound("phone-123");
        SessionException pending = assertThrows(SessionException.class,
                () -> negotiator.setEnabled("phone-123", PluginKind.SMS, true));

        assertEquals(ErrorKind.NOT_PAIRED, unpaired.getKind());
        assertEquals(ErrorKind.NOT_PAIRED, pending.getKind());
        assertTrue(gateway.callsTo(BusMethod.SET_PLUGIN_ENABLED).isEmpty());
    }

    @Test
    void setEnabledOnNeverReportedKindIsUnknownPlugin() {
        pairing.discover("phone-123", true);
        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);

        SessionException error = assertThrows(SessionException.class,
                () -> negotiator.setEnabled("phone-123", PluginKind.BATTERY, true));

        assertEquals(ErrorKind.UNKNOWN_PLUGIN, error.getKind());
    }

    @Test
    void setEnabledUpdatesRecordAndDaemon() {
        pairing.discover("phone-123", true);
        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);

        assertTrue(negotiator.setEnabled("phone-123", PluginKind.SMS, true).join());

        assertTrue(negotiator.find("phone-123", PluginKind.SMS).enabled());
        FakeBusGateway.Call call = gateway.callsTo(BusMethod.SET_PLUGIN_ENABLED).get(0);
        assertEquals(List.of("kdeconnect_sms", true), call.args());
    }

    @Test
    void setEnabledToCurrentValueIsNoOp() {
        pairing.discover("phone-123", true);
        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);

        assertFalse(negotiator.setEnabled("phone-123", PluginKind.CLIPBOARD, true).join());

        assertTrue(gateway.callsTo(BusMethod.SET_PLUGIN_ENABLED).isEmpty());
    }

    @Test
    void failedDaemonCallRollsBackOptimisticState() {
        pairing.discover("phone-123", true);
        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);
        PluginRecord before = negotiator.find("phone-123", PluginKind.SMS);
        gateway.failNext(BusMethod.SET_PLUGIN_ENABLED, 1, new BusException("denied", false));

        CompletionException error = assertThrows(CompletionException.class,
                () -> negotiator.setEnabled("phone-123", PluginKind.SMS, true).join());

        assertTrue(error.getCause() instanceof SessionException);
        assertEquals(before, negotiator.find("phone-123", PluginKind.SMS));
    }

    @Test
    void markAllUnavailableKeepsRecords() {
        pairing.discover("phone-123", true);
        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);

        assertTrue(negotiator.markAllUnavailable("phone-123"));

        List<PluginRecord> records = negotiator.forDevice("phone-123");
        assertEquals(2, records.size());
        assertTrue(records.stream().noneMatch(PluginRecord::available));
        assertTrue(records.stream().noneMatch(PluginRecord::enabled));
    }

    @Test
    void removeDeviceDropsItsRecords() {
        pairing.discover("phone-123", true);
        negotiator.reconcile("phone-123", SMS_AND_CLIPBOARD);

        assertTrue(negotiator.removeDevice("phone-123"));

        assertTrue(negotiator.forDevice("phone-123").isEmpty());
    }
}
