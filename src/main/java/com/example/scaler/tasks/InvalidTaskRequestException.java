package com.example.scaler.tasks;

/**
 * A task submission the caller got wrong; answered with 400.
 */
public class InvalidTaskRequestException extends RuntimeException {

    public InvalidTaskRequestException(String message) {
        super(message);
    }

    public InvalidTaskRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
