package com.brixo.connecthub.session.notifyrc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persistencia JSON de {@link NotificationBackup}. Es el único estado que
 * sobrevive a un reinicio y permite revertir una supresión huérfana.
 */
public class NotificationBackupStore {

    private static final Logger log = LoggerFactory.getLogger(NotificationBackupStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public NotificationBackupStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public Path path() {
        return path;
    }

    public Optional<NotificationBackup> load() throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(Files.readAllBytes(path), NotificationBackup.class));
        } catch (JacksonException e) {
            throw new IOException("Copia de seguridad ilegible en " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    public void save(NotificationBackup backup) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(backup);
        } catch (JacksonException e) {
            throw new IOException("No se pudo serializar la copia de seguridad: " + e.getOriginalMessage(), e);
        }
        KdeConfigFile.writeAtomically(path, json);
        log.debug("Copia de seguridad de notificaciones guardada en {}", path);
    }

    public void delete() throws IOException {
        Files.deleteIfExists(path);
    }
}
