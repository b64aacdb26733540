package com.eainde.sos.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Well-formed contact sets for tests. Every source URL is on the default allow-list.
 */
public final class ContactFixtures {

    private ContactFixtures() {}

    public static List<ContactRecord> validContacts(String country) {
        return new ArrayList<>(List.of(
                ContactRecord.nationalEmergency("Emergency Response Support System", "112",
                        "https://112.gov.in/", country, "Police, fire and ambulance"),
                ContactRecord.crisisHotline("Tele-MANAS", "14416",
                        "https://telemanas.mohfw.gov.in/", country, "National tele mental health programme"),
                ContactRecord.crisisHotline("KIRAN Mental Health Helpline", "1800-599-0019",
                        "https://socialjustice.gov.in/", country, null),
                ContactRecord.crisisHotline("Vandrevala Foundation", "+91 9999 666 555",
                        "https://www.vandrevalafoundation.org/", country, null),
                ContactRecord.crisisHotline("AASRA", "+91-9820466726",
                        "http://www.aasra.org/", country, "24x7 suicide prevention helpline")
        ));
    }

    public static ContactSet validSet(String country, ContactOrigin origin, Instant fetchedAt) {
        return new ContactSet(country, validContacts(country), fetchedAt, origin);
    }
}
