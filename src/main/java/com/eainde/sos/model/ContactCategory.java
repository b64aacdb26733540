package com.eainde.sos.model;

/**
 * Classification of a single emergency contact.
 */
public enum ContactCategory {

    /** The country's national emergency number (police, ambulance, fire). */
    NATIONAL_EMERGENCY,

    /** A mental-health, suicide-prevention or crisis-support line. */
    CRISIS_HOTLINE
}
