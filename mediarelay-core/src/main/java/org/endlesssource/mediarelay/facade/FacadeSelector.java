package org.endlesssource.mediarelay.facade;

import java.util.Locale;

/**
 * Picks the façade variant for a newly discovered player.
 * Implementations must be pure: the same bus name and identity always give the same kind.
 */
@FunctionalInterface
public interface FacadeSelector {

    FacadeKind select(String busName, String identity);

    /**
     * Known quirky players by bus name, with identity as a fallback for browsers
     * that publish under generic names.
     */
    static FacadeSelector byName() {
        return FacadeSelector::selectByName;
    }

    private static FacadeKind selectByName(String busName, String identity) {
        String name = MprisNames.shortName(busName).toLowerCase(Locale.ROOT);
        String display = identity == null ? "" : identity.toLowerCase(Locale.ROOT);

        if (name.startsWith("vlc")) {
            return FacadeKind.VLC;
        }
        if (name.startsWith("firefox")) {
            return FacadeKind.FIREFOX;
        }
        if (name.startsWith("chromium") || name.startsWith("chrome") || name.startsWith("brave")
                || display.startsWith("chrom") || display.startsWith("brave")) {
            return FacadeKind.CHROMIUM;
        }
        return FacadeKind.COMPLIANT;
    }
}
