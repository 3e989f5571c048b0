package com.cgraph.e2ee.client.error;

/**
 * Key bundle creation or persistence failed. Setup is all-or-nothing: when this
 * is raised nothing from the attempt remains in local storage.
 */
public class SetupException extends E2eeException {

    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
