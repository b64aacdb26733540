package com.eainde.sos.validation;

/**
 * Reason a candidate set was rejected, in the order the checks run.
 */
public enum ValidationError {
    /** Not exactly 5 contacts. */
    COUNT_MISMATCH,
    /** Not exactly 1 national emergency and 4 crisis hotlines. */
    CATEGORY_MISMATCH,
    /** A contact has a blank name or phone number. */
    MISSING_FIELD,
    /** A fresh contact's source is outside the trusted domain allow-list. */
    UNTRUSTED_SOURCE
}
