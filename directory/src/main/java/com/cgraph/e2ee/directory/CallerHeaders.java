package com.cgraph.e2ee.directory;

/**
 * Identity headers set by the authenticating gateway in front of the directory.
 * The directory trusts them as-is; it is never exposed without the gateway.
 */
public final class CallerHeaders {

    public static final String USER = "X-Authenticated-User";
    public static final String DEVICE = "X-Device-Id";

    private CallerHeaders() {
    }
}
