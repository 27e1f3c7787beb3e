package com.brixo.connecthub.session.notifyrc;

import com.brixo.connecthub.session.model.EventClass;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Copia de seguridad tomada antes de suprimir las notificaciones del daemon.
 *
 * @param fileExisted   si notifyrc existía antes de la primera escritura
 * @param original      bytes originales del fichero (vacío si no existía)
 * @param writtenDigest SHA-256 de lo que escribimos; si el fichero sigue igual se
 *                      restauran los bytes originales tal cual
 * @param groups        líneas previas de cada grupo tocado; lista vacía si no existía
 * @param classes       clases de evento suprimidas
 * @param takenAt       momento de la copia
 */
public record NotificationBackup(
        boolean fileExisted,
        byte[] original,
        String writtenDigest,
        Map<String, List<String>> groups,
        Set<EventClass> classes,
        Instant takenAt) {

    public NotificationBackup {
        original = original != null ? original : new byte[0];
        groups = groups != null ? Map.copyOf(groups) : Map.of();
        classes = classes != null ? Set.copyOf(classes) : Set.of();
    }

    public boolean matchesWritten(byte[] current) {
        return writtenDigest != null && writtenDigest.equals(digest(current));
    }

    public String originalText() {
        return new String(original, StandardCharsets.UTF_8);
    }

    public static String digest(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 no disponible", e);
        }
    }
}
