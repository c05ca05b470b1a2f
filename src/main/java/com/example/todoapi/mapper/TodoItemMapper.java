package com.example.todoapi.mapper;

import com.example.todoapi.api.model.TodoItem;
import com.example.todoapi.model.TodoItemEntity;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Mapper utility to convert between TodoItem DTO and TodoItemEntity. Offsets carried by the
 * DTO are dropped on the way in; everything coming out is rendered in UTC.
 */
public class TodoItemMapper {

    private TodoItemMapper() {
        // Utility class
    }

    public static TodoItem toDto(TodoItemEntity entity) {
        if (entity == null) {
            return null;
        }
        return new TodoItem(
                entity.getId(),
                entity.getTitle(),
                entity.getDescription(),
                toUtc(entity.getDueDate()),
                toUtc(entity.getCompletedDate()),
                entity.isCompleted()
        );
    }

    public static TodoItemEntity toEntity(TodoItem dto) {
        if (dto == null) {
            return null;
        }
        TodoItemEntity entity = new TodoItemEntity(
                dto.title(),
                dto.description(),
                toInstant(dto.dueDate()),
                toInstant(dto.completedDate()),
                dto.completed()
        );
        if (dto.id() != null) {
            entity.setId(dto.id());
        }
        return entity;
    }

    public static OffsetDateTime toUtc(OffsetDateTime timestamp) {
        return timestamp == null ? null : timestamp.withOffsetSameInstant(ZoneOffset.UTC);
    }

    private static OffsetDateTime toUtc(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
