package com.example.shield.model;

/**
 * Which attribute of an event groups it with its neighbours when correlating.
 */
public enum CorrelationField {
    SOURCE_IP {
        @Override
        public String valueOf(SecurityEvent event) {
            return event.getSourceIp();
        }
    },
    USER_ID {
        @Override
        public String valueOf(SecurityEvent event) {
            return event.getUserId();
        }
    };

    public abstract String valueOf(SecurityEvent event);
}
