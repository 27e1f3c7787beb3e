package com.brixo.connecthub.session.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Conjunto cerrado de plugins que sigue el negociador.
 * Cualquier identificador del daemon fuera de esta lista se resuelve a
 * {@link #UNKNOWN} y no genera registro.
 */
public enum PluginKind {
    CLIPBOARD("kdeconnect_clipboard"),
    SMS("kdeconnect_sms"),
    NOTIFICATIONS("kdeconnect_notifications"),
    MEDIA_CONTROL("kdeconnect_mprisremote"),
    FILE_TRANSFER("kdeconnect_share"),
    BATTERY("kdeconnect_battery"),
    FIND_PHONE("kdeconnect_findmyphone"),
    REMOTE_COMMANDS("kdeconnect_runcommand"),
    SIGNAL_STRENGTH("kdeconnect_connectivity_report"),
    BROWSE_DEVICE("kdeconnect_sftp"),
    LOCK_DEVICE("kdeconnect_lockdevice"),
    UNKNOWN(null);

    private static final Map<String, PluginKind> BY_PLUGIN_ID = Arrays.stream(values())
            .filter(kind -> kind.pluginId != null)
            .collect(Collectors.toUnmodifiableMap(kind -> kind.pluginId, Function.identity()));

    private final String pluginId;

    PluginKind(String pluginId) {
        this.pluginId = pluginId;
    }

    /** Identificador del plugin en el daemon, null para UNKNOWN. */
    public String pluginId() {
        return pluginId;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public static PluginKind fromPluginId(String pluginId) {
        if (pluginId == null) {
            return UNKNOWN;
        }
        return BY_PLUGIN_ID.getOrDefault(pluginId, UNKNOWN);
    }
}
