package com.eainde.sos.validation;

import com.eainde.sos.pipeline.PipelineStage;
import com.eainde.sos.pipeline.StageFailureException;

/**
 * A candidate set was rejected by validation. No part of it is used.
 */
public class ContactValidationException extends StageFailureException {

    private final ValidationError reason;

    public ContactValidationException(ValidationError reason, String detail) {
        super(PipelineStage.VALIDATE, reason + ": " + detail);
        this.reason = reason;
    }

    public ValidationError getReason() {
        return reason;
    }
}
