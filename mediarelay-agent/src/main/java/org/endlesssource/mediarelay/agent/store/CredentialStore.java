package org.endlesssource.mediarelay.agent.store;

import java.util.List;
import java.util.Optional;

/**
 * Storage for the trust records of paired clients.
 * <p>
 * Implementations must be thread-safe: the pairing authenticator writes while relay sessions read.
 * A reader never observes a partially written record.
 */
public interface CredentialStore extends AutoCloseable {

    /**
     * Stores a new trust record for the identity, replacing any previous one.
     *
     * @param identity client identity
     * @param material key material produced by pairing
     * @return the stored record
     */
    TrustRecord put(String identity, TrustMaterial material);

    /**
     * @return the record for the identity, or empty if it is not paired
     */
    Optional<TrustRecord> get(String identity);

    /**
     * @return every record, oldest first
     */
    List<TrustRecord> list();

    /**
     * Removes the record for the identity.
     *
     * @return whether a record was removed
     */
    boolean revoke(String identity);

    /**
     * Removes every record.
     *
     * @return the number of records removed
     */
    int revokeAll();

    /**
     * Release the underlying storage.
     */
    @Override
    void close();
}
