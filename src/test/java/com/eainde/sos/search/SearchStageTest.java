package com.eainde.sos.search;

import com.eainde.sos.config.SosProperties;
import com.eainde.sos.model.SearchSnippet;
import com.eainde.sos.pipeline.PipelineStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchStageTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final Queue<String> seenQueries = new ConcurrentLinkedQueue<>();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private SearchStage stage(SearchProvider provider, Duration timeout) {
        SosProperties properties = new SosProperties();
        properties.getSearch().setTimeout(timeout);
        return new SearchStage(query -> {
            seenQueries.add(query);
            return provider.search(query);
        }, executor, properties);
    }

    private static List<SearchSnippet> hit(String query) {
        return List.of(new SearchSnippet("Result for " + query, "Call 112 for emergencies", "https://112.gov.in/"));
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        void rendersThreeQueriesWithCountryAndYear() {
            SearchStage stage = stage(SearchStageTest::hit, Duration.ofSeconds(1));

            List<String> queries = stage.queriesFor("Testland", 2025);

            assertThat(queries).hasSize(SearchStage.QUERY_COUNT)
                    .allSatisfy(q -> assertThat(q).contains("Testland").contains("2025"));
        }

        @Test
        void sameCountryAndYearGiveSameQueries() {
            SearchStage stage = stage(SearchStageTest::hit, Duration.ofSeconds(1));

            assertThat(stage.queriesFor("India", 2025)).isEqualTo(stage.queriesFor("India", 2025));
        }

        @Test
        void rejectsWrongTemplateCount() {
            SosProperties properties = new SosProperties();
            properties.getSearch().setQueryTemplates(List.of("{country} emergency"));

            assertThatThrownBy(() -> new SearchStage(SearchStageTest::hit, executor, properties))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("exactly 3");
        }
    }

    @Nested
    @DisplayName("search()")
    class Search {

        @Test
        void concatenatesResultsOfAllQueries() {
            SearchResults results = stage(SearchStageTest::hit, Duration.ofSeconds(2)).search("India", 2025);

            assertThat(seenQueries).hasSize(3);
            assertThat(results.snippets()).hasSize(3);
            assertThat(results.queries()).hasSize(3);
            assertThat(results.country()).isEqualTo("India");
        }

        @Test
        void toleratesPartialFailure() {
            SearchProvider provider = query -> {
                if (query.contains("helpline")) {
                    throw new IllegalStateException("quota exceeded");
                }
                return hit(query);
            };

            SearchResults results = stage(provider, Duration.ofSeconds(2)).search("India", 2025);

            assertThat(results.snippets()).hasSize(2);
        }

        @Test
        void dropsUnusableSnippets() {
            SearchProvider provider = query -> List.of(
                    new SearchSnippet("", " ", "https://example.org/"),
                    new SearchSnippet("Samaritans", "", "https://www.samaritans.org/"));

            SearchResults results = stage(provider, Duration.ofSeconds(2)).search("United Kingdom", 2025);

            assertThat(results.snippets()).hasSize(3)
                    .allSatisfy(s -> assertThat(s.title()).isEqualTo("Samaritans"));
        }

        @Test
        void failsWhenEveryQueryFails() {
            SearchProvider provider = query -> {
                throw new IllegalStateException("provider down");
            };

            assertThatThrownBy(() -> stage(provider, Duration.ofSeconds(2)).search("India", 2025))
                    .isInstanceOf(SearchFailedException.class)
                    .hasMessageContaining("No usable search results");
        }

        @Test
        void failsWhenEveryQueryIsEmpty() {
            assertThatThrownBy(() -> stage(query -> List.of(), Duration.ofSeconds(2)).search("India", 2025))
                    .isInstanceOf(SearchFailedException.class);
        }

        @Test
        void slowQueryIsDroppedAtTheDeadline() {
            SearchProvider provider = query -> {
                if (query.contains("helpline")) {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return hit(query);
            };

            long start = System.nanoTime();
            SearchResults results = stage(provider, Duration.ofMillis(300)).search("India", 2025);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(results.snippets()).hasSize(2);
            assertThat(elapsed).isLessThan(Duration.ofSeconds(3));
        }

        @Test
        void allQueriesTimingOutIsAFailure() {
            SearchProvider provider = query -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return hit(query);
            };

            assertThatThrownBy(() -> stage(provider, Duration.ofMillis(200)).search("India", 2025))
                    .isInstanceOf(SearchFailedException.class)
                    .satisfies(e -> assertThat(((SearchFailedException) e).getStage()).isEqualTo(PipelineStage.SEARCH));
        }
    }

    @Test
    void evidenceTextIsNumberedAndCapped() {
        SearchResults results = new SearchResults("India", List.of("q"), List.of(
                new SearchSnippet("A", "first", "https://a.gov.in/"),
                new SearchSnippet("B", "second", "https://b.gov.in/"),
                new SearchSnippet("C", "third", "https://c.gov.in/")));

        String evidence = results.toEvidenceText(2);

        assertThat(evidence).contains("1. A", "2. B", "https://b.gov.in/").doesNotContain("3. C");
    }
}
