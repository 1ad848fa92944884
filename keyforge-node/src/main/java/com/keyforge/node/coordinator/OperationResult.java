package com.keyforge.node.coordinator;

import com.keyforge.core.error.KeyforgeException;

import java.util.Optional;

/**
 * Result of one batched operation. Exactly one of {@code result} and {@code error} is set.
 *
 * @param index position of the operation in the submitted list
 */
public record OperationResult(
        int index,
        Operation operation,
        boolean success,
        Object result,
        KeyforgeException error
) {
    public static OperationResult success(int index, Operation operation, Object result) {
        return new OperationResult(index, operation, true, result, null);
    }

    public static OperationResult failure(int index, Operation operation, KeyforgeException error) {
        return new OperationResult(index, operation, false, null, error);
    }

    public <T> Optional<T> resultAs(Class<T> type) {
        return Optional.ofNullable(result).filter(type::isInstance).map(type::cast);
    }
}
