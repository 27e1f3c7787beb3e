package com.brixo.connecthub.session.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Plugins que el daemon declara para un dispositivo, con su estado de activación.
 * Sólo contiene tipos conocidos.
 */
public record CapabilityReport(Map<PluginKind, Boolean> plugins) {

    public CapabilityReport {
        plugins = Map.copyOf(plugins);
    }

    /** Construye el informe desde los identificadores del daemon, ignorando los desconocidos. */
    public static CapabilityReport fromPluginIds(Map<String, Boolean> byPluginId) {
        Map<PluginKind, Boolean> plugins = new EnumMap<>(PluginKind.class);
        byPluginId.forEach((pluginId, enabled) -> {
            PluginKind kind = PluginKind.fromPluginId(pluginId);
            if (kind.isKnown()) {
                plugins.put(kind, Boolean.TRUE.equals(enabled));
            }
        });
        return new CapabilityReport(plugins);
    }

    public boolean isAvailable(PluginKind kind) {
        return plugins.containsKey(kind);
    }

    public boolean isEnabled(PluginKind kind) {
        return Boolean.TRUE.equals(plugins.get(kind));
    }
}
