package com.portico.backend.global.crypto;

public class InvalidCiphertextException extends RuntimeException {

    public InvalidCiphertextException(String message) {
        super(message);
    }

    public InvalidCiphertextException(String message, Throwable cause) {
        super(message, cause);
    }
}
