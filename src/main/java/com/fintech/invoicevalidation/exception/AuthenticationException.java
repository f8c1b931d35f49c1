package com.fintech.invoicevalidation.exception;

/**
 * Thrown when no usable SUNAT access token can be obtained.
 * Aborts the current batch cycle; the next cycle tries again.
 */
public class AuthenticationException extends InvoiceValidationException {

    private final String lastError;

    public AuthenticationException(String message, String lastError) {
        super(lastError == null ? message : message + ". Last error: " + lastError);
        this.lastError = lastError;
    }

    public static AuthenticationException missingCredentials() {
        return new AuthenticationException("SUNAT client id or client secret is not configured", null);
    }

    /**
     * Description of the last failed token request, or null if none was made.
     */
    public String getLastError() {
        return lastError;
    }
}
