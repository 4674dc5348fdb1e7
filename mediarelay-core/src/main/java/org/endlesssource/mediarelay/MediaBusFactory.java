package org.endlesssource.mediarelay;

import org.endlesssource.mediarelay.spi.MediaBusProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Finds the {@link MediaBusProvider} to use on this machine through {@link ServiceLoader}.
 */
public final class MediaBusFactory {
    private static final Logger logger = LoggerFactory.getLogger(MediaBusFactory.class);

    private MediaBusFactory() {}

    /**
     * First provider that applies to this OS and whose probe succeeds, by provider id.
     *
     * @throws UnsupportedOperationException if there is none, listing each provider's reason
     */
    public static MediaBusProvider selectProvider() {
        List<MediaBusProvider> candidates = candidates();
        if (candidates.isEmpty()) {
            throw new UnsupportedOperationException("No media bus provider for " + osName());
        }
        List<String> reasons = new ArrayList<>();
        for (MediaBusProvider provider : candidates) {
            BusAvailability availability = provider.probe();
            if (availability.available()) {
                logger.info("Using media bus provider {}", provider.id());
                return provider;
            }
            logger.debug("Provider {} unavailable: {}", provider.id(), availability.reason());
            reasons.add(provider.id() + ": " + availability.reason());
        }
        throw new UnsupportedOperationException("No usable media bus: " + String.join("; ", reasons));
    }

    /**
     * Probe result of the provider {@link #selectProvider()} would pick, or of the first one when
     * none is usable.
     */
    public static BusAvailability availability() {
        List<MediaBusProvider> candidates = candidates();
        if (candidates.isEmpty()) {
            return BusAvailability.unavailable(osName(), "No media bus provider on the classpath");
        }
        List<BusAvailability> probes = candidates.stream()
                .map(MediaBusProvider::probe)
                .collect(Collectors.toList());
        return probes.stream()
                .filter(BusAvailability::available)
                .findFirst()
                .orElse(probes.get(0));
    }

    static String osName() {
        return System.getProperty("os.name", "unknown").toLowerCase(Locale.ROOT);
    }

    private static List<MediaBusProvider> candidates() {
        List<MediaBusProvider> providers = new ArrayList<>();
        ServiceLoader.load(MediaBusProvider.class).forEach(providers::add);
        List<MediaBusProvider> applicable = providers.stream()
                .filter(MediaBusProvider::appliesToCurrentOs)
                .sorted(Comparator.comparing(MediaBusProvider::id))
                .collect(Collectors.toList());
        logger.debug("Media bus providers: found {}, applicable {}",
                providers.stream().map(MediaBusProvider::id).collect(Collectors.toList()),
                applicable.stream().map(MediaBusProvider::id).collect(Collectors.toList()));
        return applicable;
    }
}
