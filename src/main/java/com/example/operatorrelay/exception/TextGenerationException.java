package com.example.operatorrelay.exception;

public class TextGenerationException extends RelayException {

    public TextGenerationException(String message) {
        super(message);
    }

    public TextGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
