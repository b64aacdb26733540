package com.eainde.sos.cache;

import com.eainde.sos.pipeline.PipelineStage;
import com.eainde.sos.pipeline.StageFailureException;

/**
 * The cache store could not be read or written. Distinct from a cache miss,
 * which is an empty lookup.
 */
public class CacheUnavailableException extends StageFailureException {

    public CacheUnavailableException(PipelineStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
