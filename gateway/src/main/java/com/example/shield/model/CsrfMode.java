package com.example.shield.model;

public enum CsrfMode {
    /** Stateless signed token from header or cookie. */
    SIGNED,
    /** Cookie token and submitted token must both validate and be equal. */
    DOUBLE_SUBMIT,
    /** Submitted token must equal the token on file for the session. */
    SYNCHRONIZER
}
