package com.eainde.sos.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw structured output of the extraction model, before any checks.
 *
 * @param contacts contacts as the model returned them, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionOutput(
        @JsonProperty("contacts") List<CandidateContact> contacts
) {

    /**
     * @param name        organisation or service name
     * @param phoneNumber number to dial
     * @param category    NATIONAL_EMERGENCY or CRISIS_HOTLINE (free text until parsed)
     * @param sourceUrl   page the number was read from
     * @param description short description, optional
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CandidateContact(
            @JsonProperty("name")        String name,
            @JsonProperty("phoneNumber") String phoneNumber,
            @JsonProperty("category")    String category,
            @JsonProperty("sourceUrl")   String sourceUrl,
            @JsonProperty("description") String description
    ) {}
}
