package com.eainde.sos.pipeline;

/**
 * Base type for a typed failure of one pipeline stage.
 *
 * <p>The orchestrator catches every subclass and turns it into a fallback
 * decision; none of them reaches the caller of
 * {@link EmergencyContactsPipeline#getEmergencyContacts(String)}.</p>
 */
public abstract class StageFailureException extends RuntimeException {

    private final PipelineStage stage;

    protected StageFailureException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected StageFailureException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
