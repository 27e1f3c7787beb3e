package com.brixo.connecthub.session.notifyrc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Fichero de configuración compartido con el daemon.
 *
 * Toda mutación ocurre dentro de {@link #withLock}: se toma un bloqueo sobre
 * {@code <fichero>.lock}, se relee el contenido actual y se escribe con un
 * reemplazo atómico. No se crean directorios: si falta el de configuración la
 * operación falla con {@link IOException}.
 */
public class KdeConfigFile {

    private static final Logger log = LoggerFactory.getLogger(KdeConfigFile.class);

    @FunctionalInterface
    public interface LockedAction<T> {
        T run(KdeConfigFile file) throws IOException;
    }

    private final Path path;
    private final Path lockPath;

    public KdeConfigFile(Path path) {
        this.path = path;
        this.lockPath = path.resolveSibling(path.getFileName() + ".lock");
    }

    public Path path() {
        return path;
    }

    /** Ejecuta {@code action} con el bloqueo del fichero tomado. */
    public synchronized <T> T withLock(LockedAction<T> action) throws IOException {
        try (FileChannel channel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            return action.run(this);
        }
    }

    // ── Lectura ───────────────────────────────────────────────────────────────

    public boolean exists() {
        return Files.exists(path);
    }

    /** Bytes actuales, o vacío si el fichero no existe. */
    public Optional<byte[]> readBytes() throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(path));
    }

    public KdeConfigDocument read() throws IOException {
        return KdeConfigDocument.parse(readBytes()
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .orElse(""));
    }

    // ── Escritura ─────────────────────────────────────────────────────────────

    public void write(KdeConfigDocument document) throws IOException {
        write(document.render().getBytes(StandardCharsets.UTF_8));
    }

    /** Reemplazo atómico: fichero temporal en el mismo directorio y move. */
    public void write(byte[] content) throws IOException {
        writeAtomically(path, content);
    }

    public void delete() throws IOException {
        Files.deleteIfExists(path);
    }

    static void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Move atómico no soportado en {}, se reemplaza sin él", dir);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
