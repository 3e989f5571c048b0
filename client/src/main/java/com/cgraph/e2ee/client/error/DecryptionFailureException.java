package com.cgraph.e2ee.client.error;

/**
 * AES-GCM authentication failed. The message is undecryptable and must not be
 * retried; no partial plaintext is ever returned alongside this exception.
 */
public class DecryptionFailureException extends E2eeException {

    public DecryptionFailureException(String message) {
        super(message);
    }

    public DecryptionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
