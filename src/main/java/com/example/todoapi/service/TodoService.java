package com.example.todoapi.service;

import com.example.todoapi.api.model.TodoItem;
import com.example.todoapi.exception.InvalidTodoException;
import com.example.todoapi.exception.TodoNotFoundException;
import com.example.todoapi.mapper.TodoItemMapper;
import com.example.todoapi.repository.TodoItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

@Service
public class TodoService {

    public static final int MAX_DESCRIPTION_LENGTH = 100;
    public static final String DUE_DATE_IN_PAST = "due date is in the past";
    public static final String DUE_DATE_REQUIRED = "due date is required";

    private static final Logger log = LoggerFactory.getLogger(TodoService.class);
    private final TodoItemRepository todoItemRepository;
    private final Clock clock;

    public TodoService(TodoItemRepository todoItemRepository, Clock clock) {
        this.todoItemRepository = todoItemRepository;
        this.clock = clock;
    }

    public Flux<TodoItem> getAllTodos() {
        return todoItemRepository.findAll()
                .map(TodoItemMapper::toDto);
    }

    public Flux<TodoItem> getTodosByCompletion(boolean completed) {
        return todoItemRepository.findByCompleted(completed)
                .map(TodoItemMapper::toDto);
    }

    /**
     * Inserts a new item. Any id sent by the client is discarded so the store assigns one.
     */
    @Transactional
    public Mono<TodoItem> createTodo(TodoItem item) {
        return Mono.fromCallable(() -> prepareForCreate(item))
                .map(TodoItemMapper::toEntity)
                .flatMap(todoItemRepository::save)
                .doOnSuccess(saved -> log.info("Todo item created with id={}", saved.getId()))
                .map(TodoItemMapper::toDto);
    }

    /**
     * Replaces every mutable field of the item with the given state, without reading the
     * current row first. An update that matches no row resolves to {@link TodoNotFoundException}
     * when the row is really gone; any other conflict is passed on unchanged.
     */
    @Transactional
    public Mono<Void> updateTodo(Long id, TodoItem item) {
        return Mono.fromCallable(() -> prepareForUpdate(id, item))
                .map(TodoItemMapper::toEntity)
                .flatMap(todoItemRepository::save)
                .doOnSuccess(saved -> log.info("Todo item updated with id={}", id))
                .onErrorResume(TodoService::isConcurrencyConflict, error -> resolveConflict(id, error))
                .then();
    }

    @Transactional
    public Mono<Void> deleteTodo(Long id) {
        return todoItemRepository.findById(id)
                .switchIfEmpty(Mono.error(() -> new TodoNotFoundException(id)))
                .flatMap(todoItemRepository::delete)
                .doOnSuccess(v -> log.info("Todo item deleted with id={}", id));
    }

    private TodoItem prepareForCreate(TodoItem item) {
        checkDescription(item);
        checkDueDatePresent(item);
        if (item.dueDate().toInstant().isBefore(clock.instant())) {
            throw InvalidTodoException.withClientMessage(DUE_DATE_IN_PAST);
        }
        return normalizeTimestamps(item).withId(null);
    }

    private TodoItem prepareForUpdate(Long id, TodoItem item) {
        if (!Objects.equals(id, item.id())) {
            throw InvalidTodoException.withoutBody(
                    "Route id " + id + " does not match payload id " + item.id());
        }
        checkDescription(item);
        checkDueDatePresent(item);
        TodoItem normalized = normalizeTimestamps(item);
        if (normalized.completed() && normalized.completedDate() == null) {
            normalized = normalized.withCompletedDate(toStoredPrecision(OffsetDateTime.now(clock)));
        }
        return normalized;
    }

    private static void checkDescription(TodoItem item) {
        if (item.description() != null && item.description().length() > MAX_DESCRIPTION_LENGTH) {
            throw InvalidTodoException.withoutBody(
                    "Description exceeds " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }

    private static void checkDueDatePresent(TodoItem item) {
        if (item.dueDate() == null) {
            throw InvalidTodoException.withClientMessage(DUE_DATE_REQUIRED);
        }
    }

    // timestamptz keeps microseconds; the response must match what a later read returns.
    private static TodoItem normalizeTimestamps(TodoItem item) {
        return new TodoItem(
                item.id(),
                item.title(),
                item.description(),
                toStoredPrecision(item.dueDate()),
                toStoredPrecision(item.completedDate()),
                item.completed()
        );
    }

    private static OffsetDateTime toStoredPrecision(OffsetDateTime timestamp) {
        OffsetDateTime utc = TodoItemMapper.toUtc(timestamp);
        return utc == null ? null : utc.truncatedTo(ChronoUnit.MICROS);
    }

    private static boolean isConcurrencyConflict(Throwable error) {
        return error instanceof TransientDataAccessResourceException
                || error instanceof OptimisticLockingFailureException;
    }

    private <T> Mono<T> resolveConflict(Long id, Throwable error) {
        log.warn("Update of todo item id={} hit a concurrency conflict: {}", id, error.getMessage());
        return todoItemRepository.existsById(id)
                .flatMap(exists -> exists
                        ? Mono.<T>error(error)
                        : Mono.<T>error(new TodoNotFoundException(id)));
    }
}
