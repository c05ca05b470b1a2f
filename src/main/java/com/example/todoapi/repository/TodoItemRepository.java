package com.example.todoapi.repository;

import com.example.todoapi.model.TodoItemEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface TodoItemRepository extends ReactiveCrudRepository<TodoItemEntity, Long> {

    Flux<TodoItemEntity> findByCompleted(boolean completed);
}
