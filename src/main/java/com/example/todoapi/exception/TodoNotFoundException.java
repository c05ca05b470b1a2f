package com.example.todoapi.exception;

public class TodoNotFoundException extends RuntimeException {

    private final Long id;

    public TodoNotFoundException(Long id) {
        super("Todo item not found: id=" + id);
        this.id = id;
    }

    public Long getId() {
        return id;
    }
}
