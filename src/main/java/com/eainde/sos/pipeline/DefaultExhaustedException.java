package com.eainde.sos.pipeline;

/**
 * Thrown when the static safety default itself fails structural validation.
 * This is a programming error, not a runtime condition.
 */
public class DefaultExhaustedException extends IllegalStateException {

    public DefaultExhaustedException(String message) {
        super(message);
    }
}
