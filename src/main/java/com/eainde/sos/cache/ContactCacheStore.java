package com.eainde.sos.cache;

import com.eainde.sos.model.ContactSet;

import java.util.Optional;

/**
 * Key-value store of the last valid {@link ContactSet} per country.
 *
 * <p>Keys are normalized with {@link CountryKeys#normalize(String)}. Reads are pure
 * lookups and never trigger external calls. Entries are never purged; staleness
 * is decided by the reader.</p>
 */
public interface ContactCacheStore {

    /**
     * @return the entry for the country, empty on a miss
     * @throws CacheUnavailableException if the store itself cannot be read
     */
    Optional<CacheEntry> get(String country);

    /**
     * Creates or overwrites the entry for the country.
     *
     * @throws CacheUnavailableException if the store cannot be written
     */
    void put(String country, ContactSet contactSet);
}
