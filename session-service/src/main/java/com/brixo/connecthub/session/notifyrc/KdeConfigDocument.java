package com.brixo.connecthub.session.notifyrc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Documento INI al estilo KConfig que conserva cada línea tal cual.
 *
 * Sólo se reescriben las líneas que se tocan: comentarios, orden de grupos,
 * claves traducidas ({@code Name[es]=...}) y líneas en blanco sobreviven a una
 * lectura y escritura sin cambios.
 */
public class KdeConfigDocument {

    private final List<String> lines;
    private boolean trailingNewline;

    private KdeConfigDocument(List<String> lines, boolean trailingNewline) {
        this.lines = lines;
        this.trailingNewline = trailingNewline;
    }

    public static KdeConfigDocument parse(String text) {
        if (text == null || text.isEmpty()) {
            return new KdeConfigDocument(new ArrayList<>(), true);
        }
        List<String> lines = new ArrayList<>(List.of(text.split("\n", -1)));
        boolean trailing = text.endsWith("\n");
        if (trailing) {
            lines.remove(lines.size() - 1);
        }
        return new KdeConfigDocument(lines, trailing);
    }

    public static KdeConfigDocument empty() {
        return parse("");
    }

    public String render() {
        if (lines.isEmpty()) {
            return "";
        }
        String body = String.join("\n", lines);
        return trailingNewline ? body + "\n" : body;
    }

    // ── Lectura ───────────────────────────────────────────────────────────────

    public boolean hasGroup(String group) {
        return headerIndex(group) >= 0;
    }

    public Optional<String> get(String group, String key) {
        int header = headerIndex(group);
        if (header < 0) {
            return Optional.empty();
        }
        int end = groupEnd(header);
        for (int i = header + 1; i < end; i++) {
            String value = valueOf(lines.get(i), key);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Líneas del grupo, cabecera incluida y sin las líneas en blanco finales.
     * Lista vacía si el grupo no existe.
     */
    public List<String> rawGroup(String group) {
        int header = headerIndex(group);
        if (header < 0) {
            return List.of();
        }
        return List.copyOf(lines.subList(header, contentEnd(header)));
    }

    // ── Escritura ─────────────────────────────────────────────────────────────

    /** Fija una clave, creando el grupo al final del documento si no existe. */
    public void set(String group, String key, String value) {
        String entry = key + "=" + value;
        int header = headerIndex(group);
        if (header < 0) {
            appendGroup(List.of("[" + group + "]", entry));
            return;
        }
        int end = groupEnd(header);
        for (int i = header + 1; i < end; i++) {
            if (valueOf(lines.get(i), key) != null) {
                lines.set(i, entry);
                return;
            }
        }
        lines.add(contentEnd(header), entry);
    }

    /**
     * Sustituye el grupo por las líneas dadas (cabecera incluida). Con una lista
     * vacía el grupo se elimina.
     */
    public void replaceGroup(String group, List<String> rawLines) {
        int header = headerIndex(group);
        if (header < 0) {
            if (!rawLines.isEmpty()) {
                appendGroup(rawLines);
            }
            return;
        }
        int end = contentEnd(header);
        lines.subList(header, end).clear();
        if (rawLines.isEmpty()) {
            while (header < lines.size() && lines.get(header).isBlank()) {
                lines.remove(header);
            }
            if (header == lines.size()) {
                while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
                    lines.remove(lines.size() - 1);
                }
            }
        } else {
            lines.addAll(header, rawLines);
        }
    }

    public void removeGroup(String group) {
        replaceGroup(group, List.of());
    }

    // ── Auxiliares ────────────────────────────────────────────────────────────

    private void appendGroup(List<String> rawLines) {
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isBlank()) {
            lines.add("");
        }
        lines.addAll(rawLines);
        trailingNewline = true;
    }

    private int headerIndex(String group) {
        String header = "[" + group + "]";
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).trim().equals(header)) {
                return i;
            }
        }
        return -1;
    }

    /** Índice de la siguiente cabecera (o fin del documento). */
    private int groupEnd(int header) {
        for (int i = header + 1; i < lines.size(); i++) {
            if (isHeader(lines.get(i))) {
                return i;
            }
        }
        return lines.size();
    }

    /** Como {@link #groupEnd} pero sin las líneas en blanco finales. */
    private int contentEnd(int header) {
        int end = groupEnd(header);
        while (end > header + 1 && lines.get(end - 1).isBlank()) {
            end--;
        }
        return end;
    }

    private static boolean isHeader(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith("[") && trimmed.endsWith("]");
    }

    private static String valueOf(String line, String key) {
        String trimmed = line.trim();
        if (trimmed.startsWith("#")) {
            return null;
        }
        int eq = trimmed.indexOf('=');
        if (eq < 0 || !trimmed.substring(0, eq).trim().equals(key)) {
            return null;
        }
        return trimmed.substring(eq + 1).trim();
    }
}
