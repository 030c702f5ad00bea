package com.flow.core.graph;

import com.flow.core.model.Task;

/**
 * "producer must finish before consumer starts", inferred from a shared file path.
 */
public record Edge(Task producer, Task consumer) {

    @Override
    public String toString() {
        return producer.id() + " -> " + consumer.id();
    }
}
