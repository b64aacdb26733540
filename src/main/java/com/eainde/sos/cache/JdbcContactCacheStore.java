package com.eainde.sos.cache;

import com.eainde.sos.model.ContactOrigin;
import com.eainde.sos.model.ContactRecord;
import com.eainde.sos.model.ContactSet;
import com.eainde.sos.pipeline.PipelineStage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * {@link ContactCacheStore} backed by the {@code sos_contact_cache} table.
 * Contacts are stored as a JSON array; timestamps and origin get their own columns.
 */
public class JdbcContactCacheStore implements ContactCacheStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcContactCacheStore.class);

    private static final TypeReference<List<ContactRecord>> CONTACT_LIST = new TypeReference<>() {};

    // H2 upsert syntax. PostgreSQL: INSERT ... ON CONFLICT (country_key) DO UPDATE
    private static final String UPSERT_SQL = """
            MERGE INTO sos_contact_cache (country_key, country, contacts_json, origin, fetched_at, written_at)
            KEY (country_key)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_SQL = """
            SELECT country, contacts_json, origin, fetched_at, written_at
            FROM sos_contact_cache
            WHERE country_key = ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcContactCacheStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<CacheEntry> get(String country) {
        String key = CountryKeys.normalize(country);
        StoredRow row;
        try {
            row = jdbcTemplate.queryForObject(SELECT_SQL, (rs, rowNum) -> new StoredRow(
                    rs.getString("country"),
                    rs.getString("contacts_json"),
                    rs.getString("origin"),
                    rs.getObject("fetched_at", OffsetDateTime.class).toInstant(),
                    rs.getObject("written_at", OffsetDateTime.class).toInstant()
            ), key);
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new CacheUnavailableException(PipelineStage.CHECK_CACHE,
                    "Failed to read cache entry for " + key, e);
        }

        try {
            List<ContactRecord> contacts = objectMapper.readValue(row.contactsJson(), CONTACT_LIST);
            log.debug("Read cache entry for {} (stored origin {}, fetched {})",
                    key, row.origin(), row.fetchedAt());
            ContactSet set = new ContactSet(row.country(), contacts, row.fetchedAt(), ContactOrigin.CACHED);
            return Optional.of(new CacheEntry(set, row.writtenAt()));
        } catch (JsonProcessingException e) {
            throw new CacheUnavailableException(PipelineStage.CHECK_CACHE,
                    "Corrupt cache entry for " + key, e);
        }
    }

    @Override
    public void put(String country, ContactSet contactSet) {
        String key = CountryKeys.normalize(country);
        String json;
        try {
            json = objectMapper.writeValueAsString(contactSet.contacts());
        } catch (JsonProcessingException e) {
            throw new CacheUnavailableException(PipelineStage.CACHE_WRITE,
                    "Failed to serialize contacts for " + key, e);
        }

        try {
            jdbcTemplate.update(UPSERT_SQL,
                    key,
                    contactSet.country(),
                    json,
                    contactSet.origin().name(),
                    OffsetDateTime.ofInstant(contactSet.fetchedAt(), ZoneOffset.UTC),
                    OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException(PipelineStage.CACHE_WRITE,
                    "Failed to write cache entry for " + key, e);
        }
    }

    private record StoredRow(String country, String contactsJson, String origin,
                             Instant fetchedAt, Instant writtenAt) {}
}
