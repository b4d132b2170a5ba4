package com.example.scaler.scaling;

public class MalformedResponseException extends ScalingException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
