package com.eainde.sos.search;

import com.eainde.sos.model.SearchSnippet;

import java.util.List;

/**
 * Black-box text search: one query in, organic results out.
 * Implementations may throw on transport errors; the search stage tolerates it per query.
 */
@FunctionalInterface
public interface SearchProvider {

    List<SearchSnippet> search(String query);
}
