package com.example.shield.exception;

import com.example.shield.model.ErrorKind;
import lombok.Getter;

/**
 * Raised by admin and token endpoints. The message is shown to the caller
 * after redaction, so it must be written for a client audience.
 */
@Getter
public class ShieldException extends RuntimeException {

    private final ErrorKind kind;

    public ShieldException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ShieldException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
