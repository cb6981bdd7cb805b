package com.hybridsearch.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    /**
     * Blocks until one request carrying {@code tokens} tokens fits under the limits of {@code key}.
     */
    void acquire(String key, int tokens);

    default <T> T execute(String key, int tokens, Supplier<T> task) {
        acquire(key, tokens);
        return task.get();
    }
}
