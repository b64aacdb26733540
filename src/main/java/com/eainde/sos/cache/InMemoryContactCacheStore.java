package com.eainde.sos.cache;

import com.eainde.sos.model.ContactOrigin;
import com.eainde.sos.model.ContactSet;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ContactCacheStore}. Entries do not survive a restart.
 */
public class InMemoryContactCacheStore implements ContactCacheStore {

    private final Map<String, CacheEntry> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryContactCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(String country) {
        CacheEntry entry = storage.get(CountryKeys.normalize(country));
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new CacheEntry(entry.contactSet().withOrigin(ContactOrigin.CACHED), entry.writtenAt()));
    }

    @Override
    public void put(String country, ContactSet contactSet) {
        storage.put(CountryKeys.normalize(country), new CacheEntry(contactSet, clock.instant()));
    }
}
