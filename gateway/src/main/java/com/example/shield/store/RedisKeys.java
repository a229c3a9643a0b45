package com.example.shield.store;

public final class RedisKeys {
    public static final String RUNTIME_CONFIG_HASH = "shield:runtime_config";
    public static final String RATE_WINDOW_PREFIX = "shield:rate_window:";

    private RedisKeys() {
    }

    public static String rateWindowKey(String tier, String identifier) {
        return RATE_WINDOW_PREFIX + tier + ":" + identifier;
    }
}
