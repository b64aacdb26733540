package com.eainde.sos.cache;

import com.eainde.sos.model.ContactFixtures;
import com.eainde.sos.model.ContactOrigin;
import com.eainde.sos.model.ContactSet;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryContactCacheStoreTest {

    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final InMemoryContactCacheStore store = new InMemoryContactCacheStore(clock);

    @Test
    void missingCountryReturnsEmpty() {
        assertThat(store.get("Atlantis")).isEmpty();
    }

    @Test
    void readsBackAsCachedUnderNormalizedKey() {
        ContactSet fresh = ContactFixtures.validSet("India", ContactOrigin.FRESH, NOW.minus(Duration.ofDays(2)));
        store.put("India", fresh);

        Optional<CacheEntry> entry = store.get("  INDIA ");

        assertThat(entry).isPresent();
        assertThat(entry.get().contactSet().origin()).isEqualTo(ContactOrigin.CACHED);
        assertThat(entry.get().contactSet().contacts()).isEqualTo(fresh.contacts());
        assertThat(entry.get().writtenAt()).isEqualTo(NOW);
        assertThat(entry.get().age(clock)).isEqualTo(Duration.ofDays(2));
    }

    @Test
    void putOverwritesPreviousEntry() {
        store.put("India", ContactFixtures.validSet("India", ContactOrigin.FRESH, NOW.minus(Duration.ofDays(40))));
        store.put("India", ContactFixtures.validSet("India", ContactOrigin.FRESH, NOW));

        assertThat(store.get("india").orElseThrow().isFresh(Duration.ofDays(30), clock)).isTrue();
    }

    @Test
    void countriesDoNotInterfere() {
        store.put("India", ContactFixtures.validSet("India", ContactOrigin.FRESH, NOW));

        assertThat(store.get("Indiana")).isEmpty();
    }
}
