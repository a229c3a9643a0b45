package com.example.shield.dto;

public record CsrfVerification(boolean valid, String error) {

    private static final CsrfVerification OK = new CsrfVerification(true, null);

    public static CsrfVerification ok() {
        return OK;
    }

    public static CsrfVerification rejected(String error) {
        return new CsrfVerification(false, error);
    }
}
