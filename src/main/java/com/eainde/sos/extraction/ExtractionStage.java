package com.eainde.sos.extraction;

import com.eainde.sos.config.SosProperties;
import com.eainde.sos.model.ContactCategory;
import com.eainde.sos.model.ContactOrigin;
import com.eainde.sos.model.ContactRecord;
import com.eainde.sos.model.ContactSet;
import com.eainde.sos.search.SearchResults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns raw search evidence into a candidate {@link ContactSet} with one
 * structured-output model call.
 *
 * <h3>Call shape</h3>
 * <ul>
 *   <li>System prompt with the extraction rules and the preferred domain suffixes</li>
 *   <li>User prompt with the country, the current year and the numbered evidence</li>
 *   <li>JSON schema response format ({@link ContactExtractionSchema}), low temperature</li>
 * </ul>
 *
 * <h3>Failures ({@link ExtractionFailedException})</h3>
 * Model error or timeout, empty or unparsable output, missing {@code contacts},
 * a {@code null} required field, or an unknown category. A wrong count and blank
 * values are passed through so validation can name them.
 *
 * <p>The output is a candidate only. It is tagged {@code FRESH} and must still
 * pass {@link com.eainde.sos.validation.ContactSetValidator}.</p>
 */
@Log4j2
@Component
public class ExtractionStage {

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Clock clock;
    private final double temperature;
    private final Duration timeout;
    private final List<String> trustedDomainSuffixes;

    public ExtractionStage(ChatModel chatModel,
                           ObjectMapper objectMapper,
                           @Qualifier("sosStageExecutor") Executor executor,
                           Clock clock,
                           SosProperties properties) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
        this.temperature = properties.getExtraction().getTemperature();
        this.timeout = properties.getExtraction().getTimeout();
        this.trustedDomainSuffixes = List.copyOf(properties.getValidation().getTrustedDomainSuffixes());
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param evidence    numbered evidence text from {@link SearchResults#toEvidenceText(int)}
     * @param country     country display name, copied into every record
     * @param currentYear year the information must be current for
     * @return candidate set tagged {@code FRESH}
     */
    public ContactSet extract(String evidence, String country, int currentYear) {
        ChatRequest request = buildRequest(evidence, country, currentYear);

        log.info("Extracting contacts for {} ({} chars of evidence)", country, evidence.length());
        String responseText = callModel(request, country);
        ExtractionOutput output = parse(responseText, country);
        List<ContactRecord> contacts = toRecords(output, country);

        log.info("Extracted {} candidate contacts for {}", contacts.size(), country);
        // Microsecond precision survives every supported cache column type
        Instant fetchedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
        return new ContactSet(country, contacts, fetchedAt, ContactOrigin.FRESH);
    }

    public ContactSet extract(SearchResults results, int maxEvidenceSnippets, int currentYear) {
        return extract(results.toEvidenceText(maxEvidenceSnippets), results.country(), currentYear);
    }

    // =========================================================================
    //  Model call
    // =========================================================================

    ChatRequest buildRequest(String evidence, String country, int currentYear) {
        return ChatRequest.builder()
                .messages(
                        SystemMessage.from(ExtractionPrompts.systemPrompt(trustedDomainSuffixes)),
                        UserMessage.from(ExtractionPrompts.userPrompt(country, currentYear, evidence)))
                .parameters(ChatRequestParameters.builder()
                        .temperature(temperature)
                        .responseFormat(ContactExtractionSchema.responseFormat())
                        .build())
                .build();
    }

    private String callModel(ChatRequest request, String country) {
        CompletableFuture<ChatResponse> future =
                CompletableFuture.supplyAsync(() -> chatModel.chat(request), executor);
        ChatResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExtractionFailedException("Model call timed out after " + timeout + " for " + country, e);
        } catch (ExecutionException e) {
            throw new ExtractionFailedException("Model call failed for " + country, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExtractionFailedException("Model call interrupted for " + country, e);
        }

        if (response == null || response.aiMessage() == null
                || response.aiMessage().text() == null || response.aiMessage().text().isBlank()) {
            throw new ExtractionFailedException("Model returned no text for " + country);
        }
        return response.aiMessage().text();
    }

    // =========================================================================
    //  Parsing
    // =========================================================================

    private ExtractionOutput parse(String responseText, String country) {
        String json = stripCodeFences(responseText);
        try {
            return objectMapper.readValue(json, ExtractionOutput.class);
        } catch (JsonProcessingException e) {
            log.error("Unparsable extraction output for {}: {}", country, abbreviate(responseText));
            throw new ExtractionFailedException("Unparsable model output for " + country, e);
        }
    }

    private List<ContactRecord> toRecords(ExtractionOutput output, String country) {
        if (output == null || output.contacts() == null) {
            throw new ExtractionFailedException("Model output has no contacts array for " + country);
        }
        if (output.contacts().size() != ContactSet.CONTACT_COUNT) {
            log.warn("Model returned {} contacts for {}, expected {}",
                    output.contacts().size(), country, ContactSet.CONTACT_COUNT);
        }

        List<ContactRecord> records = new ArrayList<>(output.contacts().size());
        for (int i = 0; i < output.contacts().size(); i++) {
            ExtractionOutput.CandidateContact candidate = output.contacts().get(i);
            if (candidate == null) {
                throw new ExtractionFailedException("Contact " + (i + 1) + " is null for " + country);
            }
            requirePresent(candidate.name(), "name", i, country);
            requirePresent(candidate.phoneNumber(), "phoneNumber", i, country);
            requirePresent(candidate.category(), "category", i, country);
            requirePresent(candidate.sourceUrl(), "sourceUrl", i, country);

            records.add(new ContactRecord(
                    candidate.name().trim(),
                    candidate.phoneNumber().trim(),
                    parseCategory(candidate.category(), i, country),
                    candidate.sourceUrl().trim(),
                    country,
                    candidate.description()));
        }
        return records;
    }

    private static void requirePresent(String value, String field, int index, String country) {
        if (value == null) {
            throw new ExtractionFailedException("Contact " + (index + 1) + " is missing '" + field + "' for " + country);
        }
    }

    static ContactCategory parseCategory(String raw, int index, String country) {
        String normalized = raw.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replaceAll("[\\s-]+", "_")
                .toUpperCase(Locale.ROOT);
        try {
            return ContactCategory.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ExtractionFailedException("Contact " + (index + 1) + " has unknown category '"
                    + raw + "' for " + country, e);
        }
    }

    static String stripCodeFences(String text) {
        String cleaned = text.strip();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.strip();
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
