package com.brixo.connecthub.session.config;

import com.brixo.connecthub.session.bus.BusGateway;
import com.brixo.connecthub.session.bus.DaemonClient;
import com.brixo.connecthub.session.bus.DbusBusGateway;
import com.brixo.connecthub.session.bus.DisabledBusGateway;
import com.brixo.connecthub.session.notifyrc.KdeConfigFile;
import com.brixo.connecthub.session.notifyrc.NotificationBackupStore;
import com.brixo.connecthub.session.service.DeviceActionService;
import com.brixo.connecthub.session.service.DeviceRegistryService;
import com.brixo.connecthub.session.service.DeviceWorkQueues;
import com.brixo.connecthub.session.service.NotificationArbiter;
import com.brixo.connecthub.session.service.PairingStateMachine;
import com.brixo.connecthub.session.service.PluginCapabilityNegotiator;
import com.brixo.connecthub.session.service.SessionManager;
import com.brixo.connecthub.session.service.SnapshotPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ensambla el gestor de sesiones y sus componentes.
 *
 * Con {@code connecthub.bus.enabled=false} no se abre ninguna conexión D-Bus y
 * todas las llamadas al daemon fallan con BUS_UNAVAILABLE.
 */
@Configuration
public class SessionConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ── Hilos ─────────────────────────────────────────────────────────────────

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService sessionScheduler(
            @Value("${connecthub.session.scheduler-threads:2}") int threads) {
        return Executors.newScheduledThreadPool(threads, named("connecthub-timer"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sessionWorkers(
            @Value("${connecthub.session.worker-threads:4}") int threads) {
        return Executors.newFixedThreadPool(threads, named("connecthub-worker"));
    }

    /** Entrega de snapshots y eventos; cada suscriptor avanza por su cuenta. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService snapshotDelivery() {
        return Executors.newCachedThreadPool(named("connecthub-sse"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService busCallExecutor(
            @Value("${connecthub.bus.call-threads:4}") int threads) {
        return Executors.newFixedThreadPool(threads, named("connecthub-dbus"));
    }

    // ── Bus ───────────────────────────────────────────────────────────────────

    @Bean(destroyMethod = "close")
    public BusGateway busGateway(
            ScheduledExecutorService sessionScheduler,
            @Qualifier("busCallExecutor") ExecutorService busCallExecutor,
            @Value("${connecthub.bus.enabled:true}") boolean enabled,
            @Value("${connecthub.bus.health-check-ms:2000}") long healthCheckMs,
            @Value("${connecthub.bus.initial-backoff-ms:200}") long initialBackoffMs,
            @Value("${connecthub.bus.max-backoff-ms:5000}") long maxBackoffMs) {
        if (!enabled) {
            log.info("Bus D-Bus desactivado por configuración");
            return new DisabledBusGateway();
        }
        return new DbusBusGateway(sessionScheduler, busCallExecutor, healthCheckMs, initialBackoffMs, maxBackoffMs);
    }

    @Bean
    public DaemonClient daemonClient(
            BusGateway busGateway,
            ScheduledExecutorService sessionScheduler,
            @Value("${connecthub.bus.call-timeout-ms:5000}") long callTimeoutMs,
            @Value("${connecthub.bus.max-attempts:3}") int maxAttempts,
            @Value("${connecthub.bus.initial-backoff-ms:200}") long initialBackoffMs,
            @Value("${connecthub.bus.max-backoff-ms:5000}") long maxBackoffMs,
            @Value("${connecthub.bus.fail-fast:false}") boolean failFast) {
        return new DaemonClient(busGateway, sessionScheduler, callTimeoutMs, maxAttempts,
                initialBackoffMs, maxBackoffMs, failFast);
    }

    // ── Componentes de sesión ─────────────────────────────────────────────────

    @Bean
    public DeviceRegistryService deviceRegistryService(Clock clock) {
        return new DeviceRegistryService(clock);
    }

    @Bean
    public PairingStateMachine pairingStateMachine(
            Clock clock,
            @Value("${connecthub.pairing.timeout-ms:30000}") long timeoutMs,
            @Value("${connecthub.pairing.inbound-wins:true}") boolean inboundWins) {
        return new PairingStateMachine(clock, Duration.ofMillis(timeoutMs), inboundWins);
    }

    @Bean
    public PluginCapabilityNegotiator pluginCapabilityNegotiator(
            PairingStateMachine pairingStateMachine, DaemonClient daemonClient, Clock clock) {
        return new PluginCapabilityNegotiator(pairingStateMachine, daemonClient, clock);
    }

    @Bean
    public NotificationArbiter notificationArbiter(
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${connecthub.notifications.notifyrc-file:${user.home}/.config/kdeconnect.notifyrc}") String notifyrc,
            @Value("${connecthub.notifications.backup-file:${user.home}/.local/state/connecthub/notifyrc-backup.json}") String backupFile) {
        return new NotificationArbiter(
                new KdeConfigFile(Path.of(notifyrc)),
                new NotificationBackupStore(Path.of(backupFile), objectMapper),
                clock);
    }

    @Bean
    public DeviceWorkQueues deviceWorkQueues(@Qualifier("sessionWorkers") ExecutorService sessionWorkers) {
        return new DeviceWorkQueues(sessionWorkers);
    }

    @Bean
    public SnapshotPublisher snapshotPublisher(@Qualifier("snapshotDelivery") ExecutorService snapshotDelivery) {
        return new SnapshotPublisher(snapshotDelivery);
    }

    @Bean(destroyMethod = "stop")
    public SessionManager sessionManager(
            DeviceRegistryService deviceRegistryService,
            PairingStateMachine pairingStateMachine,
            PluginCapabilityNegotiator pluginCapabilityNegotiator,
            NotificationArbiter notificationArbiter,
            DaemonClient daemonClient,
            BusGateway busGateway,
            DeviceWorkQueues deviceWorkQueues,
            SnapshotPublisher snapshotPublisher,
            ScheduledExecutorService sessionScheduler,
            Clock clock,
            @Value("${connecthub.session.command-timeout-ms:20000}") long commandTimeoutMs,
            @Value("${connecthub.devices.unreachable-timeout-ms:60000}") long unreachableTimeoutMs,
            @Value("${connecthub.devices.remove-after-ms:600000}") long removeAfterMs,
            @Value("${connecthub.devices.sweep-interval-ms:15000}") long sweepIntervalMs) {
        return new SessionManager(deviceRegistryService, pairingStateMachine, pluginCapabilityNegotiator,
                notificationArbiter, daemonClient, busGateway, deviceWorkQueues, snapshotPublisher,
                sessionScheduler, clock, commandTimeout(commandTimeoutMs, daemonClient.retryBudgetMs()),
                Duration.ofMillis(unreachableTimeoutMs), Duration.ofMillis(removeAfterMs),
                Duration.ofMillis(sweepIntervalMs));
    }

    @Bean
    public DeviceActionService deviceActionService(
            DeviceRegistryService deviceRegistryService,
            PairingStateMachine pairingStateMachine,
            PluginCapabilityNegotiator pluginCapabilityNegotiator,
            DaemonClient daemonClient,
            DeviceWorkQueues deviceWorkQueues,
            @Value("${connecthub.session.command-timeout-ms:20000}") long commandTimeoutMs) {
        return new DeviceActionService(deviceRegistryService, pairingStateMachine, pluginCapabilityNegotiator,
                daemonClient, deviceWorkQueues, commandTimeout(commandTimeoutMs, daemonClient.retryBudgetMs()));
    }

    /** Arranca el gestor cuando el contexto está listo. */
    @Bean
    public ApplicationRunner sessionStarter(SessionManager sessionManager) {
        return args -> {
            log.info("Arrancando el gestor de sesiones");
            sessionManager.start();
        };
    }

    /**
     * Plazo de las órdenes. Nunca por debajo de lo que el cliente del daemon puede
     * tardar en agotar sus reintentos, más un segundo de margen: un daemon colgado
     * tiene que llegar al consumidor como BUS_UNAVAILABLE y no como TIMEOUT.
     */
    static Duration commandTimeout(long configuredMs, long retryBudgetMs) {
        long minimumMs = retryBudgetMs + 1000;
        if (configuredMs < minimumMs) {
            log.warn("connecthub.session.command-timeout-ms={} no cubre los reintentos del bus ({} ms); se usa {} ms",
                    configuredMs, retryBudgetMs, minimumMs);
            return Duration.ofMillis(minimumMs);
        }
        return Duration.ofMillis(configuredMs);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
