package com.eainde.sos.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * The unit returned to callers: the emergency contacts of one country plus
 * their provenance.
 *
 * <p>A set handed to a caller always holds exactly 5 contacts, one of them
 * {@link ContactCategory#NATIONAL_EMERGENCY}. Candidate sets coming out of
 * extraction are not checked here; that is the validation stage's job, so a
 * malformed candidate can exist but is never returned.</p>
 *
 * @param country   country display name
 * @param contacts  ordered contacts, national emergency first once validated
 * @param fetchedAt when the contacts were fetched live (or built, for defaults)
 * @param origin    FRESH, CACHED or DEFAULT
 */
public record ContactSet(
        String country,
        List<ContactRecord> contacts,
        Instant fetchedAt,
        ContactOrigin origin
) {

    public static final int CONTACT_COUNT = 5;
    public static final int CRISIS_HOTLINE_COUNT = CONTACT_COUNT - 1;

    public ContactSet {
        contacts = contacts == null ? List.of() : List.copyOf(contacts);
    }

    public ContactSet withOrigin(ContactOrigin newOrigin) {
        return new ContactSet(country, contacts, fetchedAt, newOrigin);
    }

    public ContactSet withContacts(List<ContactRecord> newContacts) {
        return new ContactSet(country, newContacts, fetchedAt, origin);
    }

    public Duration age(Clock clock) {
        return Duration.between(fetchedAt, clock.instant());
    }

    public long countOf(ContactCategory category) {
        return contacts.stream().filter(c -> c.category() == category).count();
    }
}
