package com.example.todoapi.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Todo item database entity - internal persistence model. Used for R2DBC (PostgreSQL)
 * persistence. Timestamps are stored as {@link Instant}s and therefore always in UTC.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table("todo_item")
public class TodoItemEntity {

    @Id
    private Long id;
    private String title;
    private String description;
    private Instant dueDate;
    private Instant completedDate;

    @Column("is_completed")
    private boolean completed;

    /** Constructor for creating new items without an ID. */
    public TodoItemEntity(String title, String description, Instant dueDate,
                          Instant completedDate, boolean completed) {
        this.title = title;
        this.description = description;
        this.dueDate = dueDate;
        this.completedDate = completedDate;
        this.completed = completed;
    }
}
