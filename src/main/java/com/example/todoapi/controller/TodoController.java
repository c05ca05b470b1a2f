package com.example.todoapi.controller;

import com.example.todoapi.api.model.TodoItem;
import com.example.todoapi.service.TodoService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;

@RestController
@RequestMapping(TodoController.BASE_PATH)
@Tag(name = "Todo", description = "Todo item management")
public class TodoController {

    static final String BASE_PATH = "/api/Todo";

    private static final Logger log = LoggerFactory.getLogger(TodoController.class);
    private final TodoService todoService;

    public TodoController(TodoService todoService) {
        this.todoService = todoService;
    }

    @Operation(summary = "Get all todo items", description = "Returns every todo item, completed or not")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Successfully retrieved all todo items",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                schema = @Schema(implementation = TodoItem.class)))
    })
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Flux<TodoItem> getTodoItems() {
        return todoService.getAllTodos();
    }

    @Operation(summary = "Get incomplete todo items")
    @GetMapping(value = "/incomplete", produces = MediaType.APPLICATION_JSON_VALUE)
    public Flux<TodoItem> getIncompleteTodoItems() {
        return todoService.getTodosByCompletion(false);
    }

    @Operation(summary = "Get completed todo items")
    @GetMapping(value = "/completed", produces = MediaType.APPLICATION_JSON_VALUE)
    public Flux<TodoItem> getCompletedTodoItems() {
        return todoService.getTodosByCompletion(true);
    }

    @Operation(summary = "Create a todo item",
        description = "Stores a new todo item. The id is assigned by the server; timestamps are stored in UTC.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Todo item created",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                schema = @Schema(implementation = TodoItem.class))),
        @ApiResponse(responseCode = "400", description = "Description too long, due date missing or in the past")
    })
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<TodoItem>> postTodoItem(
        @RequestBody TodoItem request
    ) {
        log.info("Creating todo item: title='{}', dueDate={}", request.title(), request.dueDate());
        return todoService.createTodo(request)
                .map(created -> ResponseEntity.created(locationOf(created)).body(created))
                .doOnError(error -> log.error("Failed to create todo item: {}", error.getMessage()));
    }

    @Operation(summary = "Update a todo item",
        description = "Replaces the todo item with the given state. Completing an item without a completion time stamps it with the current time.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Todo item updated"),
        @ApiResponse(responseCode = "400", description = "Route and payload ids differ, or the payload is invalid"),
        @ApiResponse(responseCode = "404", description = "Todo item not found")
    })
    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> updateTodoItem(
        @Parameter(description = "Todo item identifier", example = "1", required = true)
        @PathVariable Long id,
        @RequestBody TodoItem request
    ) {
        log.info("Updating todo item: id={}, completed={}", id, request.completed());
        return todoService.updateTodo(id, request)
                .doOnError(error -> log.error("Failed to update todo item id={}: {}", id, error.getMessage()));
    }

    @Operation(summary = "Delete a todo item")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "Todo item deleted"),
        @ApiResponse(responseCode = "404", description = "Todo item not found")
    })
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteTodoItem(
        @Parameter(description = "Todo item identifier", example = "1", required = true)
        @PathVariable Long id
    ) {
        log.info("Deleting todo item: id={}", id);
        return todoService.deleteTodo(id)
                .doOnError(error -> log.error("Failed to delete todo item id={}: {}", id, error.getMessage()));
    }

    // Points at the list endpoint, with the new id as a query value.
    private static URI locationOf(TodoItem created) {
        return UriComponentsBuilder.fromPath(BASE_PATH)
                .queryParam("id", created.id())
                .build()
                .toUri();
    }
}
