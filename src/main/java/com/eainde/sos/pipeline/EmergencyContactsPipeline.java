package com.eainde.sos.pipeline;

import com.eainde.sos.cache.CacheEntry;
import com.eainde.sos.cache.CacheUnavailableException;
import com.eainde.sos.cache.ContactCacheStore;
import com.eainde.sos.cache.CountryKeys;
import com.eainde.sos.config.SosProperties;
import com.eainde.sos.extraction.ExtractionStage;
import com.eainde.sos.model.ContactOrigin;
import com.eainde.sos.model.ContactSet;
import com.eainde.sos.search.SearchResults;
import com.eainde.sos.search.SearchStage;
import com.eainde.sos.validation.ContactSetValidator;
import com.eainde.sos.validation.ValidationResult;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Year;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the emergency contacts core: cache first, then a live
 * search, extract and validate run, then the stale cache, then the static default.
 *
 * <h3>Flow</h3>
 * <pre>
 * CHECK_CACHE ──fresh──▶ RETURN (CACHED)
 *      │ stale / missing / forced
 *      ▼
 * SEARCH ▶ EXTRACT ▶ VALIDATE ▶ CACHE_WRITE ▶ RETURN (FRESH)
 *      │ any stage failure or deadline
 *      ▼
 * FALLBACK ──cached──▶ RETURN_CACHED_STALE (CACHED)
 *          └─nothing─▶ RETURN_STATIC_DEFAULT (DEFAULT)
 * </pre>
 *
 * <h3>Concurrency</h3>
 * Live fetches go through a per-country {@link SingleFlight}, so concurrent
 * callers for one country share a single fetch. The caller waits at most
 * search timeout + extraction timeout + slack; a fetch that outlives the wait
 * keeps running and still writes the cache when it succeeds.
 *
 * <p>Never throws for a usable country name. Stage failures are logged with
 * their stage and absorbed into the fallback.</p>
 */
@Log4j2
@Service
public class EmergencyContactsPipeline {

    static final String MDC_COUNTRY = "country";

    private final ContactCacheStore cacheStore;
    private final SearchStage searchStage;
    private final ExtractionStage extractionStage;
    private final ContactSetValidator validator;
    private final SingleFlight<ContactSet> singleFlight;
    private final Clock clock;
    private final Duration ttl;
    private final Duration deadline;
    private final String defaultCountry;

    public EmergencyContactsPipeline(ContactCacheStore cacheStore,
                                     SearchStage searchStage,
                                     ExtractionStage extractionStage,
                                     ContactSetValidator validator,
                                     SingleFlight<ContactSet> singleFlight,
                                     Clock clock,
                                     SosProperties properties) {
        this.cacheStore = cacheStore;
        this.searchStage = searchStage;
        this.extractionStage = extractionStage;
        this.validator = validator;
        this.singleFlight = singleFlight;
        this.clock = clock;
        this.ttl = properties.getCache().getTtl();
        this.deadline = properties.getSearch().getTimeout()
                .plus(properties.getExtraction().getTimeout())
                .plus(properties.getPipeline().getDeadlineSlack());
        this.defaultCountry = properties.getPipeline().getDefaultCountry();
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param country country name in any casing; blank means the configured default country
     * @return exactly 5 contacts, national emergency first, tagged with their origin
     */
    public ContactSet getEmergencyContacts(String country) {
        return getEmergencyContacts(country, false);
    }

    /**
     * @param forceRefresh skip the fresh-cache fast path and fetch live; the cache
     *                     is still used as fallback when the live fetch fails
     */
    public ContactSet getEmergencyContacts(String country, boolean forceRefresh) {
        String display = country == null || country.isBlank()
                ? defaultCountry
                : CountryKeys.displayName(country);
        String key = CountryKeys.normalize(display);

        MDC.put(MDC_COUNTRY, key);
        try {
            return run(key, display, forceRefresh);
        } finally {
            MDC.remove(MDC_COUNTRY);
        }
    }

    public Duration getDeadline() {
        return deadline;
    }

    // =========================================================================
    //  State machine
    // =========================================================================

    private ContactSet run(String key, String display, boolean forceRefresh) {
        log.info("[{}] {}{}", PipelineStage.CHECK_CACHE, display, forceRefresh ? " (forced refresh)" : "");
        Optional<ContactSet> cached = readCache(display);

        if (cached.isPresent() && !forceRefresh) {
            Duration age = cached.get().age(clock);
            if (age.compareTo(ttl) < 0) {
                log.info("[{}] cache hit, age {}", PipelineStage.RETURN, age);
                return cached.get();
            }
            log.info("Cached entry is stale (age {}, ttl {})", age, ttl);
        }

        CompletableFuture<ContactSet> fetch = singleFlight.run(key, () -> fetchFresh(display));
        try {
            ContactSet fresh = fetch.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[{}] fresh contacts", PipelineStage.RETURN);
            return fresh;
        } catch (TimeoutException e) {
            log.warn("Live fetch missed the {} deadline, it continues in the background", deadline);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StageFailureException failure) {
                log.warn("Stage {} failed: {}", failure.getStage(), failure.getMessage());
            } else {
                log.error("Live fetch failed unexpectedly", cause);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the live fetch");
        }

        return fallback(display, cached);
    }

    /**
     * SEARCH ▶ EXTRACT ▶ VALIDATE ▶ CACHE_WRITE, on the fetch executor.
     * Stage failures propagate to the waiting callers.
     */
    ContactSet fetchFresh(String display) {
        int year = Year.now(clock).getValue();

        log.info("[{}] {} ({})", PipelineStage.SEARCH, display, year);
        SearchResults results = searchStage.search(display, year);

        log.info("[{}] {} snippets", PipelineStage.EXTRACT, results.snippets().size());
        ContactSet candidate = extractionStage.extract(results, searchStage.getMaxEvidenceSnippets(), year);

        log.info("[{}] {} candidates", PipelineStage.VALIDATE, candidate.contacts().size());
        ContactSet accepted = validator.validate(candidate).orThrow();

        log.info("[{}] {}", PipelineStage.CACHE_WRITE, display);
        try {
            cacheStore.put(display, accepted);
        } catch (CacheUnavailableException e) {
            log.warn("Could not cache fresh contacts for {}: {}", display, e.getMessage());
        }
        return accepted;
    }

    private ContactSet fallback(String display, Optional<ContactSet> cached) {
        log.info("[{}] {}", PipelineStage.FALLBACK, display);
        if (cached.isPresent()) {
            log.info("[{}] age {}", PipelineStage.RETURN_CACHED_STALE, cached.get().age(clock));
            return cached.get();
        }

        ContactSet defaults = DefaultContactSets.forCountry(display, clock.instant().truncatedTo(ChronoUnit.MICROS));
        ValidationResult result = validator.validate(defaults);
        if (!result.isValid()) {
            throw new DefaultExhaustedException("Static default contacts are invalid: "
                    + result.error() + " - " + result.detail());
        }
        log.info("[{}] {}", PipelineStage.RETURN_STATIC_DEFAULT, display);
        return result.contactSet();
    }

    // =========================================================================
    //  Cache access
    // =========================================================================

    /**
     * @return the cached set tagged CACHED, empty if missing, unreadable or structurally invalid
     */
    private Optional<ContactSet> readCache(String display) {
        Optional<CacheEntry> entry;
        try {
            entry = cacheStore.get(display);
        } catch (CacheUnavailableException e) {
            log.warn("Cache unavailable, treating as miss: {}", e.getMessage());
            return Optional.empty();
        }
        if (entry.isEmpty()) {
            log.info("No cached entry for {}", display);
            return Optional.empty();
        }

        ValidationResult result = validator.validate(entry.get().contactSet().withOrigin(ContactOrigin.CACHED));
        if (!result.isValid()) {
            log.warn("Ignoring invalid cached entry for {}: {} - {}", display, result.error(), result.detail());
            return Optional.empty();
        }
        return Optional.of(result.contactSet());
    }
}
