package com.cgraph.e2ee.client.error;

/** Listing or revoking devices failed at the key directory. Safe to retry. */
public class RevocationException extends E2eeException {

    public RevocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
