package org.endlesssource.mediarelay.linux;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;
import org.freedesktop.dbus.types.UInt32;
import org.freedesktop.dbus.types.Variant;

import java.util.Map;

@DBusInterfaceName("org.freedesktop.Notifications")
interface Notifications extends DBusInterface {
    UInt32 Notify(String appName, UInt32 replacesId, String appIcon, String summary, String body,
                  String[] actions, Map<String, Variant<?>> hints, int expireTimeout);
}
