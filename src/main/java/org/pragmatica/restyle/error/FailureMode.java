package org.pragmatica.restyle.error;

/**
 * What the pipeline does when a rule's traversal throws.
 */
public enum FailureMode {
    /**
     * Log the failure and continue with the tree as it stood before the rule started.
     */
    LOG,

    /**
     * Abort the run with a {@link RestyleException} carrying the failure.
     */
    RAISE
}
