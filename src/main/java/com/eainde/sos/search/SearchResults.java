package com.eainde.sos.search;

import com.eainde.sos.model.SearchSnippet;

import java.util.List;

/**
 * Concatenated evidence gathered for one country. Order carries no meaning;
 * extraction treats it as an unordered bag of snippets.
 *
 * @param country  country searched for
 * @param queries  the rendered queries, in template order
 * @param snippets usable snippets across all queries
 */
public record SearchResults(
        String country,
        List<String> queries,
        List<SearchSnippet> snippets
) {

    public SearchResults {
        queries = List.copyOf(queries);
        snippets = List.copyOf(snippets);
    }

    /**
     * Renders the snippets as numbered evidence entries, each with its source link.
     */
    public String toEvidenceText(int maxSnippets) {
        StringBuilder sb = new StringBuilder();
        int limit = Math.min(maxSnippets, snippets.size());
        for (int i = 0; i < limit; i++) {
            SearchSnippet s = snippets.get(i);
            sb.append(i + 1).append(". ").append(nullToEmpty(s.title())).append('\n')
              .append("   ").append(nullToEmpty(s.snippet())).append('\n')
              .append("   ").append(nullToEmpty(s.sourceUrl())).append('\n')
              .append('\n');
        }
        return sb.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
