package com.brixo.connecthub.session.service;

import com.brixo.connecthub.session.model.EventClass;
import com.brixo.connecthub.session.model.NotificationRoute;
import com.brixo.connecthub.session.model.SuppressionRule;
import com.brixo.connecthub.session.notifyrc.KdeConfigDocument;
import com.brixo.connecthub.session.notifyrc.KdeConfigFile;
import com.brixo.connecthub.session.notifyrc.NotificationBackup;
import com.brixo.connecthub.session.notifyrc.NotificationBackupStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Árbitro de notificaciones: decide si un evento lo muestra el daemon o el
 * notificador nativo, nunca ambos.
 *
 * Mientras haya al menos un dispositivo emparejado, los grupos de eventos del
 * daemon en kdeconnect.notifyrc quedan con {@code Action=} y {@code Popup=false}
 * (en Event/pairRequest también {@code Execute=} y {@code Sound=}) y el
 * notificador nativo se encarga. La primera mutación guarda una copia de
 * seguridad; al desemparejar el último dispositivo se revierte. Si el fichero no
 * se puede tocar, las notificaciones siguen en el daemon y el método devuelve
 * false para que el gestor publique SUPPRESSION_UNAVAILABLE.
 */
public class NotificationArbiter {

    private static final Logger log = LoggerFactory.getLogger(NotificationArbiter.class);

    static final String ACTION_KEY = "Action";
    static final String POPUP_KEY = "Popup";
    static final String EXECUTE_KEY = "Execute";
    static final String SOUND_KEY = "Sound";
    /** Evento de petición de emparejamiento: además del aviso se anulan sonido y comando. */
    static final String PAIR_REQUEST_EVENT = "pairRequest";

    private final KdeConfigFile config;
    private final NotificationBackupStore backupStore;
    private final Clock clock;
    private final Set<EventClass> classes;
    private final Set<String> suppressing = new HashSet<>();
    private NotificationBackup applied;

    public NotificationArbiter(KdeConfigFile config, NotificationBackupStore backupStore, Clock clock) {
        this(config, backupStore, clock, EnumSet.allOf(EventClass.class));
    }

    public NotificationArbiter(KdeConfigFile config, NotificationBackupStore backupStore, Clock clock,
            Set<EventClass> classes) {
        this.config = config;
        this.backupStore = backupStore;
        this.clock = clock;
        this.classes = EnumSet.copyOf(classes);
    }

    // ── Ciclo de vida ─────────────────────────────────────────────────────────

    /** Carga una copia de seguridad que haya sobrevivido a una caída. */
    public synchronized void recover() {
        try {
            Optional<NotificationBackup> backup = backupStore.load();
            if (backup.isPresent()) {
                applied = backup.get();
                log.info("Supresión de notificaciones previa recuperada (copia del {})", applied.takenAt());
            }
        } catch (IOException e) {
            log.warn("No se pudo leer la copia de seguridad de notificaciones: {}", e.getMessage());
        }
    }

    /**
     * Tras la primera sincronización: los dispositivos que ya no están emparejados
     * dejan de contar y, si no queda ninguno, se revierte una supresión huérfana.
     */
    public synchronized boolean settle(Collection<String> pairedDeviceIds) {
        suppressing.retainAll(pairedDeviceIds);
        if (applied == null) {
            return true;
        }
        if (suppressing.isEmpty()) {
            log.info("Ningún dispositivo emparejado: se revierte la supresión pendiente");
            return revert();
        }
        return true;
    }

    // ── Emparejamiento ────────────────────────────────────────────────────────

    /**
     * El dispositivo entra en PAIRED. El primero aplica la supresión; los demás la
     * comparten.
     *
     * @return false si la supresión no está disponible
     */
    public synchronized boolean onPaired(String deviceId) {
        if (applied != null) {
            suppressing.add(deviceId);
            return true;
        }
        try {
            applied = config.withLock(file -> suppress());
            suppressing.add(deviceId);
            log.info("Notificaciones del daemon suprimidas ({} emparejado)", deviceId);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Supresión de notificaciones no disponible en {}: {}", config.path(), e.getMessage());
            return false;
        }
    }

    /**
     * El dispositivo sale de PAIRED. El último en salir revierte la configuración.
     *
     * @return false si la reversión falló
     */
    public synchronized boolean onUnpaired(String deviceId) {
        if (!suppressing.remove(deviceId)) {
            return true;
        }
        if (suppressing.isEmpty() && applied != null) {
            return revert();
        }
        return true;
    }

    public boolean onRemoved(String deviceId) {
        return onUnpaired(deviceId);
    }

    // ── Consultas ─────────────────────────────────────────────────────────────

    /** NATIVE si la clase está suprimida en el daemon, DAEMON en otro caso. */
    public synchronized NotificationRoute route(String deviceId, EventClass eventClass) {
        if (applied != null && applied.classes().contains(eventClass)) {
            return NotificationRoute.NATIVE;
        }
        return NotificationRoute.DAEMON;
    }

    public synchronized boolean isSuppressed() {
        return applied != null;
    }

    /** Una regla por dispositivo emparejado. */
    public synchronized List<SuppressionRule> rules(Collection<String> pairedDeviceIds) {
        Set<EventClass> redirected = applied != null ? applied.classes() : Set.of();
        return pairedDeviceIds.stream()
                .sorted()
                .map(id -> new SuppressionRule(id, applied != null, redirected))
                .collect(Collectors.toUnmodifiableList());
    }

    // ── Mutación ──────────────────────────────────────────────────────────────

    private NotificationBackup suppress() throws IOException {
        Optional<byte[]> before = config.readBytes();
        KdeConfigDocument document = KdeConfigDocument.parse(
                before.map(bytes -> new String(bytes, StandardCharsets.UTF_8)).orElse(""));

        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (EventClass eventClass : classes) {
            for (String event : eventClass.daemonEvents()) {
                String group = EventClass.groupName(event);
                groups.put(group, document.rawGroup(group));
                document.set(group, ACTION_KEY, "");
                document.set(group, POPUP_KEY, "false");
                if (PAIR_REQUEST_EVENT.equals(event)) {
                    document.set(group, EXECUTE_KEY, "");
                    document.set(group, SOUND_KEY, "");
                }
            }
        }
        byte[] written = document.render().getBytes(StandardCharsets.UTF_8);
        NotificationBackup backup = new NotificationBackup(before.isPresent(), before.orElse(new byte[0]),
                NotificationBackup.digest(written), groups, classes, clock.instant());

        backupStore.save(backup);
        try {
            config.write(written);
        } catch (IOException e) {
            discardBackup();
            throw e;
        }
        return backup;
    }

    private boolean revert() {
        NotificationBackup backup = applied;
        try {
            config.withLock(file -> {
                restore(file, backup);
                return null;
            });
            backupStore.delete();
            applied = null;
            log.info("Configuración de notificaciones del daemon restaurada");
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("No se pudo restaurar {}: {}", config.path(), e.getMessage());
            return false;
        }
    }

    private static void restore(KdeConfigFile file, NotificationBackup backup) throws IOException {
        Optional<byte[]> current = file.readBytes();
        if (current.isEmpty()) {
            log.info("{} ya no existe: nada que restaurar", file.path());
            return;
        }
        if (backup.matchesWritten(current.get())) {
            if (backup.fileExisted()) {
                file.write(backup.original());
            } else {
                file.delete();
            }
            return;
        }
        log.info("{} cambió desde la supresión: se restauran sólo los grupos afectados", file.path());
        KdeConfigDocument document = file.read();
        backup.groups().forEach(document::replaceGroup);
        file.write(document);
    }

    private void discardBackup() {
        try {
            backupStore.delete();
        } catch (IOException e) {
            log.error("No se pudo borrar la copia de seguridad {}: {}", backupStore.path(), e.getMessage());
        }
    }
}
