package com.eainde.sos.validation;

import com.eainde.sos.model.ContactSet;

/**
 * Outcome of {@link ContactSetValidator#validate(ContactSet)}: either the accepted set,
 * reordered national emergency first, or the first failed check.
 *
 * @param contactSet accepted set, null when rejected
 * @param error      first failed check, null when valid
 * @param detail     human-readable explanation of the rejection
 */
public record ValidationResult(
        ContactSet contactSet,
        ValidationError error,
        String detail
) {

    public static ValidationResult valid(ContactSet contactSet) {
        return new ValidationResult(contactSet, null, null);
    }

    public static ValidationResult rejected(ValidationError error, String detail) {
        return new ValidationResult(null, error, detail);
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * @return the accepted set
     * @throws ContactValidationException if the set was rejected
     */
    public ContactSet orThrow() {
        if (!isValid()) {
            throw new ContactValidationException(error, detail);
        }
        return contactSet;
    }
}
