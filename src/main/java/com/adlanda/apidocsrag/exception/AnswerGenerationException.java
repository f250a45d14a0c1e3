package com.adlanda.apidocsrag.exception;

/**
 * Thrown when the chat model fails to produce an answer.
 */
public class AnswerGenerationException extends RuntimeException {

    public AnswerGenerationException(String message) {
        super(message);
    }

    public AnswerGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
