package org.pragmatica.tscn.error;

/**
 * What the scanner does after a structural error.
 */
public enum RecoveryStrategy {
    /**
     * Fail the whole parse on the first error.
     */
    NONE,

    /**
     * Drop the offending section, record a diagnostic and resume at the next section header.
     */
    SKIP_SECTION
}
