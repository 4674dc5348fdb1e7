package org.endlesssource.mediarelay.linux;

import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.types.UInt32;
import org.freedesktop.dbus.types.UInt64;
import org.freedesktop.dbus.types.Variant;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strips D-Bus wrapper types so the core only sees plain Java values: strings, numbers,
 * booleans, lists and string-keyed maps.
 */
final class DBusValues {
    private DBusValues() {
    }

    /**
     * Entries with non-string keys or null values are dropped.
     */
    static Map<String, Object> toPlainMap(Map<?, ?> raw) {
        Map<String, Object> plain = new LinkedHashMap<>();
        if (raw == null) {
            return plain;
        }
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            Object value = toPlain(entry.getValue());
            if (entry.getKey() instanceof String key && value != null) {
                plain.put(key, value);
            }
        }
        return plain;
    }

    static Object toPlain(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Variant<?> variant) {
            return toPlain(variant.getValue());
        }
        // mpris:trackid is an object path; the core treats it as an opaque string
        if (value instanceof DBusPath path) {
            return path.getPath();
        }
        if (value instanceof UInt64 unsigned) {
            return unsigned.longValue();
        }
        if (value instanceof UInt32 unsigned) {
            return unsigned.longValue();
        }
        if (value instanceof Map<?, ?> map) {
            return toPlainMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> list = new ArrayList<>(collection.size());
            collection.forEach(element -> list.add(toPlain(element)));
            return list;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(toPlain(Array.get(value, i)));
            }
            return list;
        }
        return value;
    }
}
