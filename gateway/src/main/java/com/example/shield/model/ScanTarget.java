package com.example.shield.model;

public enum ScanTarget {
    PATH,
    QUERY,
    BODY,
    USER_AGENT
}
