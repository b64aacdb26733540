package com.eainde.sos.search;

import com.eainde.sos.config.SosProperties;
import com.eainde.sos.model.SearchSnippet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the three pre-templated queries for a country and gathers their results.
 *
 * <p>Queries are rendered from fixed templates, so a country always produces the
 * same queries for a given year. They run concurrently on the stage executor
 * under one shared wall-clock budget. A query that fails, times out or comes back
 * empty is tolerated as long as another one returns usable content.</p>
 */
@Component
public class SearchStage {

    private static final Logger log = LoggerFactory.getLogger(SearchStage.class);

    public static final int QUERY_COUNT = 3;

    private final SearchProvider searchProvider;
    private final Executor executor;
    private final List<String> queryTemplates;
    private final Duration timeout;
    private final int maxEvidenceSnippets;

    public SearchStage(SearchProvider searchProvider,
                       @Qualifier("sosStageExecutor") Executor executor,
                       SosProperties properties) {
        this.searchProvider = searchProvider;
        this.executor = executor;
        this.queryTemplates = List.copyOf(properties.getSearch().getQueryTemplates());
        this.timeout = properties.getSearch().getTimeout();
        this.maxEvidenceSnippets = properties.getSearch().getMaxEvidenceSnippets();

        if (queryTemplates.size() != QUERY_COUNT) {
            throw new IllegalStateException("sos.search.query-templates must hold exactly "
                    + QUERY_COUNT + " templates, found " + queryTemplates.size());
        }
    }

    /**
     * @return the usable snippets of all queries
     * @throws SearchFailedException if no query produced usable content in time
     */
    public SearchResults search(String country, int year) {
        List<String> queries = queriesFor(country, year);

        List<CompletableFuture<List<SearchSnippet>>> futures = queries.stream()
                .map(query -> CompletableFuture.supplyAsync(() -> searchProvider.search(query), executor))
                .toList();

        long deadline = System.nanoTime() + timeout.toNanos();
        List<SearchSnippet> snippets = new ArrayList<>();

        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<List<SearchSnippet>> future = futures.get(i);
            String query = queries.get(i);
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                List<SearchSnippet> results = future.get(remaining, TimeUnit.NANOSECONDS);
                int before = snippets.size();
                if (results != null) {
                    results.stream().filter(SearchSnippet::isUsable).forEach(snippets::add);
                }
                log.debug("Query {}/{} returned {} usable results: {}",
                        i + 1, queries.size(), snippets.size() - before, query);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Query {}/{} timed out after {}: {}", i + 1, queries.size(), timeout, query);
            } catch (ExecutionException e) {
                log.warn("Query {}/{} failed: {} ({})", i + 1, queries.size(), query, e.getCause().toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new SearchFailedException("Search interrupted for " + country, e);
            }
        }

        if (snippets.isEmpty()) {
            throw new SearchFailedException("No usable search results for " + country
                    + " across " + queries.size() + " queries");
        }

        log.info("Retrieved {} search results for {}", snippets.size(), country);
        return new SearchResults(country, queries, snippets);
    }

    public List<String> queriesFor(String country, int year) {
        return queryTemplates.stream()
                .map(template -> template
                        .replace("{country}", country)
                        .replace("{year}", String.valueOf(year)))
                .toList();
    }

    public int getMaxEvidenceSnippets() {
        return maxEvidenceSnippets;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
