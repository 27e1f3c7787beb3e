package com.brixo.connecthub.session.bus;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;

/**
 * Interfaces de los plugins del daemon usados por las acciones directas.
 * Cada una vive en /modules/kdeconnect/devices/{id}/{objeto}.
 */
public final class KdeConnectPlugins {

    private KdeConnectPlugins() {
    }

    @DBusInterfaceName("org.kde.kdeconnect.device.ping")
    public interface Ping extends DBusInterface {
        String OBJECT = "ping";

        void sendPing();
    }

    @DBusInterfaceName("org.kde.kdeconnect.device.findmyphone")
    public interface FindMyPhone extends DBusInterface {
        String OBJECT = "findmyphone";

        void ring();
    }

    @DBusInterfaceName("org.kde.kdeconnect.device.clipboard")
    public interface Clipboard extends DBusInterface {
        String OBJECT = "clipboard";

        void sendClipboard(String content);
    }

    @DBusInterfaceName("org.kde.kdeconnect.device.share")
    public interface Share extends DBusInterface {
        String OBJECT = "share";

        void shareUrl(String url);
    }

    @DBusInterfaceName("org.kde.kdeconnect.device.lockdevice")
    public interface LockDevice extends DBusInterface {
        String OBJECT = "lockdevice";

        void lock();
    }

    /** Sólo se leen propiedades: charge e isCharging. */
    public static final class Battery {
        public static final String OBJECT = "battery";
        public static final String INTERFACE = "org.kde.kdeconnect.device.battery";

        private Battery() {
        }
    }

    /** Sólo se leen propiedades: cellularNetworkStrength y cellularNetworkType. */
    public static final class ConnectivityReport {
        public static final String OBJECT = "connectivity_report";
        public static final String INTERFACE = "org.kde.kdeconnect.device.connectivity_report";

        private ConnectivityReport() {
        }
    }
}
