package com.eainde.sos.extraction;

import com.eainde.sos.pipeline.PipelineStage;
import com.eainde.sos.pipeline.StageFailureException;

/**
 * The model call failed, timed out, or returned output that does not parse
 * into a 5-contact candidate set.
 */
public class ExtractionFailedException extends StageFailureException {

    public ExtractionFailedException(String message) {
        super(PipelineStage.EXTRACT, message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(PipelineStage.EXTRACT, message, cause);
    }
}
