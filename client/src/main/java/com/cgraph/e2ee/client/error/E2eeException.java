package com.cgraph.e2ee.client.error;

/**
 * Root of every failure the E2EE subsystem reports.
 *
 * All public operations either produce a usable result or signal one of the
 * subclasses below through the Reactor error channel. None of them ever carries
 * plaintext or key material in its message.
 */
public abstract class E2eeException extends RuntimeException {

    protected E2eeException(String message) {
        super(message);
    }

    protected E2eeException(String message, Throwable cause) {
        super(message, cause);
    }
}
