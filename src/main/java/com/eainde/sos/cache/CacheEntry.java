package com.eainde.sos.cache;

import com.eainde.sos.model.ContactSet;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * What the cache store holds for one country: the last valid set and when it was written.
 * Freshness is measured from the set's {@code fetchedAt}, not from the write time.
 *
 * @param contactSet the stored set, tagged {@code CACHED} when read back
 * @param writtenAt  when the store last wrote this entry
 */
public record CacheEntry(ContactSet contactSet, Instant writtenAt) {

    public Duration age(Clock clock) {
        return contactSet.age(clock);
    }

    public boolean isFresh(Duration ttl, Clock clock) {
        return age(clock).compareTo(ttl) < 0;
    }
}
