package com.cgraph.e2ee.client.directory;

/** Headers the authenticating gateway forwards to the key directory. */
public final class DirectoryHeaders {

    public static final String AUTHENTICATED_USER = "X-Authenticated-User";
    public static final String DEVICE_ID = "X-Device-Id";

    private DirectoryHeaders() {
    }
}
