package org.endlesssource.mediarelay.agent.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-persistent {@link CredentialStore}. Pairings are lost when the agent stops.
 */
public class InMemoryCredentialStore implements CredentialStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryCredentialStore.class);

    private final ConcurrentHashMap<String, TrustRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCredentialStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCredentialStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        logger.warn("Using InMemoryCredentialStore, pairings will NOT survive restarts");
    }

    @Override
    public TrustRecord put(String identity, TrustMaterial material) {
        TrustRecord record = new TrustRecord(identity, material.identityKey(), material.clientName(),
                material.trustToken(), clock.instant());
        records.put(identity, record);
        logger.debug("Stored trust record for {}", identity);
        return record;
    }

    @Override
    public Optional<TrustRecord> get(String identity) {
        return identity == null ? Optional.empty() : Optional.ofNullable(records.get(identity));
    }

    @Override
    public List<TrustRecord> list() {
        List<TrustRecord> result = new ArrayList<>(records.values());
        result.sort(Comparator.comparing(TrustRecord::createdAt));
        return result;
    }

    @Override
    public boolean revoke(String identity) {
        return identity != null && records.remove(identity) != null;
    }

    @Override
    public int revokeAll() {
        int count = records.size();
        records.clear();
        return count;
    }

    @Override
    public void close() {
        // Nothing to release.
    }
}
