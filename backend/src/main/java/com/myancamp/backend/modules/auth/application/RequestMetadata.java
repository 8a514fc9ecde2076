package com.myancamp.backend.modules.auth.application;

/**
 * Client address and user agent captured with every issued credential.
 */
public record RequestMetadata(String ipAddress, String userAgent) {

    private static final int USER_AGENT_MAX_LENGTH = 512;

    public static final RequestMetadata UNKNOWN = new RequestMetadata(null, null);

    public RequestMetadata {
        if (userAgent != null && userAgent.length() > USER_AGENT_MAX_LENGTH) {
            userAgent = userAgent.substring(0, USER_AGENT_MAX_LENGTH);
        }
    }
}
