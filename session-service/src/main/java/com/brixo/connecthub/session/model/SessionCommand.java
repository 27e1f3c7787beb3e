package com.brixo.connecthub.session.model;

/**
 * Orden de un consumidor. {@code plugin} y {@code enabled} sólo se usan con
 * SET_PLUGIN_ENABLED.
 */
public record SessionCommand(
        CommandType type,
        String deviceId,
        PluginKind plugin,
        Boolean enabled) {

    public static SessionCommand of(CommandType type, String deviceId) {
        return new SessionCommand(type, deviceId, null, null);
    }

    public static SessionCommand setPluginEnabled(String deviceId, PluginKind plugin, boolean enabled) {
        return new SessionCommand(CommandType.SET_PLUGIN_ENABLED, deviceId, plugin, enabled);
    }
}
