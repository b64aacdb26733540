package com.eainde.sos.extraction;

import java.util.List;

/**
 * Prompt text for the contact extraction call.
 */
public final class ExtractionPrompts {

    private ExtractionPrompts() {}

    public static String systemPrompt(List<String> trustedDomainSuffixes) {
        return """
                You are an emergency contact information specialist. You extract verified \
                emergency and mental-health crisis contacts from web search results.

                Rules:
                1. Return EXACTLY 5 contacts, no more and no less.
                2. The first contact is the national emergency number, category NATIONAL_EMERGENCY. \
                There is exactly one of these.
                3. The other 4 contacts are mental-health crisis hotlines (suicide prevention, \
                crisis support), category CRISIS_HOTLINE.
                4. Only use numbers that appear in the search results. Never invent a number.
                5. sourceUrl must be the link of the search result the number came from.
                6. Prefer official sources whose domain ends in: %s.
                7. Output JSON only, matching the provided schema. No markdown.
                """.formatted(String.join(", ", trustedDomainSuffixes));
    }

    public static String userPrompt(String country, int currentYear, String evidence) {
        return """
                Country: %s
                Current year: %d

                Extract the 5 contacts for %s. Ignore information that is not confirmed \
                as current for %d (discontinued lines, old numbers, archived pages).

                Search results:
                %s
                """.formatted(country, currentYear, country, currentYear, evidence);
    }
}
