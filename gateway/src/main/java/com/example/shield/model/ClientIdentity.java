package com.example.shield.model;

/**
 * Per-request client fingerprint used to bucket rate-limit and alert state.
 */
public record ClientIdentity(String ip, String userAgent) {

    public static final int USER_AGENT_PREFIX_LENGTH = 50;

    public String key() {
        String agent = userAgent == null ? "unknown" : userAgent;
        if (agent.length() > USER_AGENT_PREFIX_LENGTH) {
            agent = agent.substring(0, USER_AGENT_PREFIX_LENGTH);
        }
        return ip + ":" + agent;
    }
}
