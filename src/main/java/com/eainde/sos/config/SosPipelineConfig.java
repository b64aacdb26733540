package com.eainde.sos.config;

import com.eainde.sos.cache.ContactCacheStore;
import com.eainde.sos.cache.InMemoryContactCacheStore;
import com.eainde.sos.cache.JdbcContactCacheStore;
import com.eainde.sos.extraction.ExtractionModelListener;
import com.eainde.sos.model.ContactSet;
import com.eainde.sos.pipeline.SingleFlight;
import com.eainde.sos.search.SearchProvider;
import com.eainde.sos.search.SerpApiSearchProvider;
import com.eainde.sos.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the pipeline's outbound clients, executors and cache store from {@link SosProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SosProperties.class)
public class SosPipelineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs whole live fetches, at most one per country. */
    @Bean(name = "sosFetchExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor sosFetchExecutor(SosProperties properties) {
        return new MdcAwareExecutor(properties.getPipeline().getFetchThreads(), "sos-fetch");
    }

    /** Runs search queries and model calls on behalf of a fetch. */
    @Bean(name = "sosStageExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor sosStageExecutor(SosProperties properties) {
        return new MdcAwareExecutor(properties.getPipeline().getStageThreads(), "sos-stage");
    }

    @Bean
    public SingleFlight<ContactSet> contactFetchSingleFlight(@Qualifier("sosFetchExecutor") Executor executor) {
        return new SingleFlight<>(executor);
    }

    // -------------------------------------------------------------------------
    //  Search
    // -------------------------------------------------------------------------

    @Bean
    public RestTemplate searchRestTemplate(RestTemplateBuilder builder, SosProperties properties) {
        return builder
                .setConnectTimeout(properties.getSearch().getTimeout())
                .setReadTimeout(properties.getSearch().getTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchProvider searchProvider(@Qualifier("searchRestTemplate") RestTemplate restTemplate,
                                         SosProperties properties) {
        return new SerpApiSearchProvider(restTemplate, properties.getSearch());
    }

    // -------------------------------------------------------------------------
    //  Extraction
    // -------------------------------------------------------------------------

    @Bean
    @ConditionalOnMissingBean
    public ChatModel extractionChatModel(SosProperties properties) {
        SosProperties.Extraction extraction = properties.getExtraction();
        if (extraction.getApiKey() == null || extraction.getApiKey().isBlank()) {
            log.warn("Gemini API key not configured (sos.extraction.api-key), live fetches will fall back");
            return new ChatModel() {
                @Override
                public ChatResponse doChat(ChatRequest chatRequest) {
                    throw new IllegalStateException("sos.extraction.api-key is not configured");
                }
            };
        }
        return GoogleAiGeminiChatModel.builder()
                .apiKey(extraction.getApiKey())
                .modelName(extraction.getModelName())
                .temperature(extraction.getTemperature())
                .maxOutputTokens(extraction.getMaxOutputTokens())
                .timeout(extraction.getTimeout())
                .listeners(List.of(new ExtractionModelListener()))
                .build();
    }

    // -------------------------------------------------------------------------
    //  Cache
    // -------------------------------------------------------------------------

    @Bean
    @ConditionalOnProperty(prefix = "sos.cache", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public ContactCacheStore jdbcContactCacheStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        log.info("Using JDBC contact cache store");
        return new JdbcContactCacheStore(jdbcTemplate, objectMapper, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "sos.cache", name = "store", havingValue = "memory")
    public ContactCacheStore inMemoryContactCacheStore(Clock clock) {
        log.info("Using in-memory contact cache store");
        return new InMemoryContactCacheStore(clock);
    }
}
