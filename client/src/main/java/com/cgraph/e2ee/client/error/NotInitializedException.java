package com.cgraph.e2ee.client.error;

/** An operation needed local key material but this device has not been set up. */
public class NotInitializedException extends E2eeException {

    public NotInitializedException() {
        super("E2EE is not initialized on this device");
    }
}
