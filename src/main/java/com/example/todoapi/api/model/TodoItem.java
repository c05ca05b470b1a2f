package com.example.todoapi.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;

/**
 * TodoItem DTO - API contract for todo data exchange. This is a pure data transfer object
 * without any database annotations.
 */
public record TodoItem(
        @Schema(description = "Identifier assigned by the server", example = "1")
        Long id,
        @Schema(description = "Short title", example = "Groceries")
        String title,
        @Schema(description = "Free text, at most 100 characters", example = "buy milk")
        String description,
        @Schema(description = "When the item is due, ISO-8601", example = "2030-01-01T09:00:00Z", requiredMode = Schema.RequiredMode.REQUIRED)
        OffsetDateTime dueDate,
        @Schema(description = "When the item was completed, ISO-8601", example = "2030-01-01T10:30:00Z")
        OffsetDateTime completedDate,
        @Schema(description = "Whether the item is completed", example = "false")
        @JsonProperty("isCompleted")
        boolean completed
) {
    /** Constructor for creating new items without an ID. */
    public TodoItem(String title, String description, OffsetDateTime dueDate) {
        this(null, title, description, dueDate, null, false);
    }

    public TodoItem withId(Long newId) {
        return new TodoItem(newId, title, description, dueDate, completedDate, completed);
    }

    public TodoItem withCompletedDate(OffsetDateTime newCompletedDate) {
        return new TodoItem(id, title, description, dueDate, newCompletedDate, completed);
    }
}
