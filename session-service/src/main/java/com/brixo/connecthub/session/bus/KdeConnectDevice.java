package com.brixo.connecthub.session.bus;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.annotations.DBusMemberName;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBusInterface;
import org.freedesktop.dbus.messages.DBusSignal;

/**
 * Interfaz org.kde.kdeconnect.device expuesta en /modules/kdeconnect/devices/{id}.
 * Las propiedades (name, type, isReachable, isPaired, supportedPlugins...) se leen
 * con org.freedesktop.DBus.Properties.
 */
@DBusInterfaceName("org.kde.kdeconnect.device")
public interface KdeConnectDevice extends DBusInterface {

    void requestPairing();

    void acceptPairing();

    void rejectPairing();

    void cancelPairing();

    void unpair();

    boolean isPluginEnabled(String pluginName);

    void setPluginEnabled(String pluginName, boolean enabled);

    /** Firma: pairStateChanged(int) con 0=NotPaired, 1=Requested, 2=RequestedByPeer, 3=Paired. */
    @DBusMemberName("pairStateChanged")
    final class PairStateChanged extends DBusSignal {
        private final int pairState;

        public PairStateChanged(String path, int pairState) throws DBusException {
            super(path, pairState);
            this.pairState = pairState;
        }

        public int pairState() {
            return pairState;
        }
    }

    @DBusMemberName("pairingFailed")
    final class PairingFailed extends DBusSignal {
        private final String error;

        public PairingFailed(String path, String error) throws DBusException {
            super(path, error);
            this.error = error;
        }

        public String error() {
            return error;
        }
    }

    @DBusMemberName("reachableChanged")
    final class ReachableChanged extends DBusSignal {
        private final boolean reachable;

        public ReachableChanged(String path, boolean reachable) throws DBusException {
            super(path, reachable);
            this.reachable = reachable;
        }

        public boolean reachable() {
            return reachable;
        }
    }

    @DBusMemberName("nameChanged")
    final class NameChanged extends DBusSignal {
        private final String name;

        public NameChanged(String path, String name) throws DBusException {
            super(path, name);
            this.name = name;
        }

        public String name() {
            return name;
        }
    }

    @DBusMemberName("pluginsChanged")
    final class PluginsChanged extends DBusSignal {

        public PluginsChanged(String path) throws DBusException {
            super(path);
        }
    }
}
