package com.brixo.connecthub.session.bus;

import java.util.List;
import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.annotations.DBusMemberName;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBusInterface;
import org.freedesktop.dbus.messages.DBusSignal;

/**
 * Interfaz org.kde.kdeconnect.daemon expuesta en /modules/kdeconnect.
 *
 * <p>Sólo se declara lo que usa el gestor de sesiones.</p>
 */
@DBusInterfaceName("org.kde.kdeconnect.daemon")
public interface KdeConnectDaemon extends DBusInterface {

    /** Ids de dispositivos conocidos. Firma: devices(bool onlyReachable, bool onlyPaired) → as. */
    List<String> devices(boolean onlyReachable, boolean onlyPaired);

    @DBusMemberName("deviceAdded")
    final class DeviceAdded extends DBusSignal {
        private final String id;

        public DeviceAdded(String path, String id) throws DBusException {
            super(path, id);
            this.id = id;
        }

        public String id() {
            return id;
        }
    }

    @DBusMemberName("deviceRemoved")
    final class DeviceRemoved extends DBusSignal {
        private final String id;

        public DeviceRemoved(String path, String id) throws DBusException {
            super(path, id);
            this.id = id;
        }

        public String id() {
            return id;
        }
    }

    /** Firma: deviceVisibilityChanged(string id, bool isVisible). */
    @DBusMemberName("deviceVisibilityChanged")
    final class DeviceVisibilityChanged extends DBusSignal {
        private final String id;
        private final boolean visible;

        public DeviceVisibilityChanged(String path, String id, boolean visible) throws DBusException {
            super(path, id, visible);
            this.id = id;
            this.visible = visible;
        }

        public String id() {
            return id;
        }

        public boolean visible() {
            return visible;
        }
    }
}
