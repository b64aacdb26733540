package com.eainde.sos.search;

import com.eainde.sos.pipeline.PipelineStage;
import com.eainde.sos.pipeline.StageFailureException;

/**
 * None of the search queries returned usable content.
 */
public class SearchFailedException extends StageFailureException {

    public SearchFailedException(String message) {
        super(PipelineStage.SEARCH, message);
    }

    public SearchFailedException(String message, Throwable cause) {
        super(PipelineStage.SEARCH, message, cause);
    }
}
