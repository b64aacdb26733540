package com.eainde.sos.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Policy data for the emergency contacts pipeline, bound from {@code sos.*}.
 *
 * <pre>
 * sos:
 *   cache:
 *     ttl: 30d
 *     store: jdbc            # jdbc | memory
 *   search:
 *     endpoint: https://serpapi.com/search.json
 *     api-key: ${SERPAPI_API_KEY:}
 *     timeout: 10s
 *     query-templates:       # exactly 3, {country} and {year} are substituted
 *       - "{country} national emergency number police ambulance {year}"
 *       - ...
 *   extraction:
 *     model-name: gemini-2.0-flash-lite
 *     temperature: 0.1
 *     timeout: 30s
 *   validation:
 *     trusted-domain-suffixes: [gov, org, int, ...]
 *   pipeline:
 *     fetch-threads: 4       # concurrent fresh fetches (one per country at most)
 *     stage-threads: 16      # search queries and model calls
 *     deadline-slack: 5s
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "sos")
public class SosProperties {

    private Cache cache = new Cache();
    private Search search = new Search();
    private Extraction extraction = new Extraction();
    private Validation validation = new Validation();
    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofDays(30);
        private String store = "jdbc";
    }

    @Data
    public static class Search {
        private String endpoint = "https://serpapi.com/search.json";
        private String apiKey;
        private int resultsPerQuery = 10;
        private String language = "en";
        private Duration timeout = Duration.ofSeconds(10);
        private int maxEvidenceSnippets = 15;
        private List<String> queryTemplates = new ArrayList<>(List.of(
                "{country} emergency number national emergency police ambulance {year}",
                "{country} mental health crisis hotline suicide prevention {year} official",
                "{country} crisis helpline phone number website {year}"
        ));
    }

    @Data
    public static class Extraction {
        private String modelName = "gemini-2.0-flash-lite";
        private String apiKey;
        private double temperature = 0.1;
        private int maxOutputTokens = 2048;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Validation {
        private List<String> trustedDomainSuffixes = new ArrayList<>(List.of(
                "gov", "gov.in", "nic.in", "gov.uk", "nhs.uk", "gov.au", "gc.ca",
                "org", "org.in", "org.uk", "org.au", "int", "edu"
        ));
    }

    @Data
    public static class Pipeline {
        private int fetchThreads = 4;
        private int stageThreads = 16;
        private Duration deadlineSlack = Duration.ofSeconds(5);
        private String defaultCountry = "India";
    }
}
