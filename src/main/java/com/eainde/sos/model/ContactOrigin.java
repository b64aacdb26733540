package com.eainde.sos.model;

/**
 * Provenance of a returned {@link ContactSet}.
 *
 * <ul>
 *   <li><b>FRESH</b> - produced by a successful live search, extraction and validation run</li>
 *   <li><b>CACHED</b> - read back from the cache store, fresh or stale</li>
 *   <li><b>DEFAULT</b> - the hardcoded safety fallback</li>
 * </ul>
 */
public enum ContactOrigin {
    FRESH,
    CACHED,
    DEFAULT
}
