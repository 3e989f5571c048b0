package com.cgraph.e2ee.client.error;

/**
 * X3DH could not produce a shared secret for one message: a remote key was
 * missing or malformed, a signature did not verify, or the one-time prekey the
 * message refers to is no longer available. Local state is left untouched.
 */
public class KeyAgreementException extends E2eeException {

    public KeyAgreementException(String message) {
        super(message);
    }

    public KeyAgreementException(String message, Throwable cause) {
        super(message, cause);
    }
}
