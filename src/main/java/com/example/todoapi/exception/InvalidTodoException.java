package com.example.todoapi.exception;

import java.util.Optional;

/**
 * Raised when a todo payload violates one of the item invariants. Answered with 400.
 * Only a client message, when present, is written to the response body.
 */
public class InvalidTodoException extends RuntimeException {

    private final String clientMessage;

    private InvalidTodoException(String reason, String clientMessage) {
        super(reason);
        this.clientMessage = clientMessage;
    }

    public static InvalidTodoException withoutBody(String reason) {
        return new InvalidTodoException(reason, null);
    }

    public static InvalidTodoException withClientMessage(String clientMessage) {
        return new InvalidTodoException(clientMessage, clientMessage);
    }

    public Optional<String> getClientMessage() {
        return Optional.ofNullable(clientMessage);
    }
}
