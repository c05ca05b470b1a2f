package com.example.todoapi.controller;

import com.example.todoapi.exception.InvalidTodoException;
import com.example.todoapi.exception.TodoNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps each failure kind raised by the todo handlers to its HTTP status.
 * <ul>
 *   <li>{@link InvalidTodoException} - 400, with the client message as plain text if there is one</li>
 *   <li>{@link TodoNotFoundException} - 404</li>
 *   <li>{@link DataAccessException} - 500</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidTodoException.class)
    public ResponseEntity<String> handleInvalidTodo(InvalidTodoException e) {
        log.info("Rejected todo request: {}", e.getMessage());
        return e.getClientMessage()
                .map(message -> ResponseEntity.badRequest()
                        .contentType(MediaType.TEXT_PLAIN)
                        .body(message))
                .orElseGet(() -> ResponseEntity.badRequest().build());
    }

    @ExceptionHandler(TodoNotFoundException.class)
    public ResponseEntity<Void> handleNotFound(TodoNotFoundException e) {
        log.info("Todo item not found: id={}", e.getId());
        return ResponseEntity.notFound().build();
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Void> handlePersistenceFailure(DataAccessException e) {
        log.error("Persistence failure while handling todo request", e);
        return ResponseEntity.internalServerError().build();
    }
}
