package com.eainde.sos.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single emergency or crisis contact for a country.
 *
 * <p>{@code sourceUrl} must resolve to an allow-listed domain when the record
 * comes from a fresh fetch. Cached and default records are exempt.</p>
 *
 * @param name        display name of the service or organisation
 * @param phoneNumber number as it should be dialled (may contain +, spaces, dashes)
 * @param category    national emergency or crisis hotline
 * @param sourceUrl   page the number was taken from
 * @param country     country the record belongs to (display form)
 * @param description short description of the service, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContactRecord(
        @JsonProperty("name")        String name,
        @JsonProperty("phoneNumber") String phoneNumber,
        @JsonProperty("category")    ContactCategory category,
        @JsonProperty("sourceUrl")   String sourceUrl,
        @JsonProperty("country")     String country,
        @JsonProperty("description") String description
) {

    public boolean isNationalEmergency() {
        return category == ContactCategory.NATIONAL_EMERGENCY;
    }

    public static ContactRecord nationalEmergency(String name, String phoneNumber, String sourceUrl,
                                                  String country, String description) {
        return new ContactRecord(name, phoneNumber, ContactCategory.NATIONAL_EMERGENCY,
                sourceUrl, country, description);
    }

    public static ContactRecord crisisHotline(String name, String phoneNumber, String sourceUrl,
                                              String country, String description) {
        return new ContactRecord(name, phoneNumber, ContactCategory.CRISIS_HOTLINE,
                sourceUrl, country, description);
    }
}
