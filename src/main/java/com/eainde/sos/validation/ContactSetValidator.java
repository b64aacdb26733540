package com.eainde.sos.validation;

import com.eainde.sos.config.SosProperties;
import com.eainde.sos.model.ContactCategory;
import com.eainde.sos.model.ContactOrigin;
import com.eainde.sos.model.ContactRecord;
import com.eainde.sos.model.ContactSet;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic gate between the extraction model and the caller.
 *
 * <p>Checks run in a fixed order and the first failure wins:</p>
 * <ol>
 *   <li>exactly 5 contacts ({@link ValidationError#COUNT_MISMATCH})</li>
 *   <li>exactly 1 national emergency and 4 crisis hotlines ({@link ValidationError#CATEGORY_MISMATCH})</li>
 *   <li>non-blank name and phone number on every contact ({@link ValidationError#MISSING_FIELD})</li>
 *   <li>allow-listed source domain on every contact, FRESH sets only ({@link ValidationError#UNTRUSTED_SOURCE})</li>
 * </ol>
 * A rejected set is rejected whole.
 */
@Component
public class ContactSetValidator {

    private final TrustedDomainPolicy trustedDomainPolicy;

    @Autowired
    public ContactSetValidator(SosProperties properties) {
        this(new TrustedDomainPolicy(properties.getValidation().getTrustedDomainSuffixes()));
    }

    public ContactSetValidator(TrustedDomainPolicy trustedDomainPolicy) {
        this.trustedDomainPolicy = trustedDomainPolicy;
    }

    public ValidationResult validate(ContactSet candidate) {
        List<ContactRecord> contacts = candidate.contacts();

        if (contacts.size() != ContactSet.CONTACT_COUNT) {
            return ValidationResult.rejected(ValidationError.COUNT_MISMATCH,
                    "expected " + ContactSet.CONTACT_COUNT + " contacts, got " + contacts.size());
        }

        long national = candidate.countOf(ContactCategory.NATIONAL_EMERGENCY);
        long hotlines = candidate.countOf(ContactCategory.CRISIS_HOTLINE);
        if (national != 1 || hotlines != ContactSet.CRISIS_HOTLINE_COUNT) {
            return ValidationResult.rejected(ValidationError.CATEGORY_MISMATCH,
                    "expected 1 national emergency and " + ContactSet.CRISIS_HOTLINE_COUNT
                            + " crisis hotlines, got " + national + " and " + hotlines);
        }

        for (int i = 0; i < contacts.size(); i++) {
            ContactRecord contact = contacts.get(i);
            if (isBlank(contact.name())) {
                return ValidationResult.rejected(ValidationError.MISSING_FIELD,
                        "contact " + (i + 1) + " has no name");
            }
            if (isBlank(contact.phoneNumber())) {
                return ValidationResult.rejected(ValidationError.MISSING_FIELD,
                        "contact " + (i + 1) + " (" + contact.name() + ") has no phone number");
            }
        }

        if (candidate.origin() == ContactOrigin.FRESH) {
            for (int i = 0; i < contacts.size(); i++) {
                ContactRecord contact = contacts.get(i);
                if (!trustedDomainPolicy.isTrusted(contact.sourceUrl())) {
                    return ValidationResult.rejected(ValidationError.UNTRUSTED_SOURCE,
                            "contact " + (i + 1) + " (" + contact.name() + ") comes from untrusted source '"
                                    + contact.sourceUrl() + "'");
                }
            }
        }

        return ValidationResult.valid(candidate.withContacts(nationalEmergencyFirst(contacts)));
    }

    // Stable sort: hotlines keep their extraction order.
    private static List<ContactRecord> nationalEmergencyFirst(List<ContactRecord> contacts) {
        List<ContactRecord> ordered = new ArrayList<>(contacts);
        ordered.sort(Comparator.comparing((ContactRecord c) -> !c.isNationalEmergency()));
        return ordered;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
