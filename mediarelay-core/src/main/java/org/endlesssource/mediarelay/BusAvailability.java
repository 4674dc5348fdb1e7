package org.endlesssource.mediarelay;

import java.util.Objects;

/**
 * Whether a media bus can be used on this machine, and why not.
 *
 * @param provider id of the provider that was probed, or the OS name when no provider applies
 * @param reason   empty when available
 */
public record BusAvailability(String provider, boolean available, String reason) {

    public BusAvailability {
        Objects.requireNonNull(provider, "provider must not be null");
        reason = reason == null ? "" : reason;
    }

    public static BusAvailability available(String provider) {
        return new BusAvailability(provider, true, "");
    }

    public static BusAvailability unavailable(String provider, String reason) {
        return new BusAvailability(provider, false, reason);
    }
}
