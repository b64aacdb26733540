package com.eainde.sos.pipeline;

/**
 * States of a single pipeline run.
 *
 * <pre>
 * CHECK_CACHE
 *   ├── fresh entry ─────────────────────────────▶ RETURN
 *   └── stale / missing / unavailable
 *         SEARCH ▶ EXTRACT ▶ VALIDATE ▶ CACHE_WRITE ▶ RETURN
 *         any failure or deadline
 *           FALLBACK
 *             ├── cached entry exists ───────────▶ RETURN_CACHED_STALE
 *             └── nothing cached ────────────────▶ RETURN_STATIC_DEFAULT
 * </pre>
 */
public enum PipelineStage {
    CHECK_CACHE,
    SEARCH,
    EXTRACT,
    VALIDATE,
    CACHE_WRITE,
    FALLBACK,
    RETURN,
    RETURN_CACHED_STALE,
    RETURN_STATIC_DEFAULT;

    public boolean isTerminal() {
        return this == RETURN || this == RETURN_CACHED_STALE || this == RETURN_STATIC_DEFAULT;
    }
}
