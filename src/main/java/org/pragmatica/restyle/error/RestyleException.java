package org.pragmatica.restyle.error;

/**
 * Unchecked carrier for a {@link RestyleError}.
 */
public final class RestyleException extends RuntimeException {
    private final RestyleError error;

    public RestyleException(RestyleError error) {
        super(error.message(), error instanceof RestyleError.RuleFailure failure
                               ? failure.cause()
                               : null);
        this.error = error;
    }

    public RestyleError error() {
        return error;
    }
}
