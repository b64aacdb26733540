package com.eainde.sos.pipeline;

import com.eainde.sos.model.ContactOrigin;
import com.eainde.sos.model.ContactRecord;
import com.eainde.sos.model.ContactSet;

import java.time.Instant;
import java.util.List;

/**
 * Hardcoded last-resort contacts, used when nothing was ever cached for a country
 * and the live fetch fails. 112 is reachable from mobile networks in most countries;
 * the hotline entries point at international helpline directories.
 */
public final class DefaultContactSets {

    private DefaultContactSets() {}

    public static ContactSet forCountry(String country, Instant now) {
        return new ContactSet(country, List.of(
                ContactRecord.nationalEmergency(
                        "International Emergency Number",
                        "112",
                        "https://www.itu.int/",
                        country,
                        "GSM emergency number, routed to local emergency services from most mobile networks"),
                ContactRecord.crisisHotline(
                        "Find A Helpline",
                        "See findahelpline.com",
                        "https://findahelpline.com/",
                        country,
                        "Directory of free, confidential crisis lines by country"),
                ContactRecord.crisisHotline(
                        "Befrienders Worldwide",
                        "See befrienders.org",
                        "https://befrienders.org/",
                        country,
                        "Emotional support centres worldwide"),
                ContactRecord.crisisHotline(
                        "IASP Crisis Centres",
                        "See iasp.info",
                        "https://www.iasp.info/crisis-centres-helplines/",
                        country,
                        "International Association for Suicide Prevention crisis centre list"),
                ContactRecord.crisisHotline(
                        "Open Counseling Suicide Hotlines",
                        "See opencounseling.com",
                        "https://www.opencounseling.com/suicide-hotlines",
                        country,
                        "International list of suicide and crisis hotlines")
        ), now, ContactOrigin.DEFAULT);
    }
}
