package com.eainde.sos.model;

/**
 * One organic search result.
 *
 * @param title     result title, may be empty
 * @param snippet   result text shown under the title
 * @param sourceUrl link of the result
 */
public record SearchSnippet(
        String title,
        String snippet,
        String sourceUrl
) {

    /** A snippet with no text and no title carries no evidence. */
    public boolean isUsable() {
        return (snippet != null && !snippet.isBlank())
                || (title != null && !title.isBlank());
    }
}
