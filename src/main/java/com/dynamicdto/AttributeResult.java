package com.dynamicdto;

import java.util.Optional;

import com.dynamicdto.exception.DtoException;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of a non-throwing attribute read or write.
 *
 * A success carries the value that was read or stored; a failure carries the
 * exception the throwing variant would have raised.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AttributeResult {

    private final String name;
    private final Object value;
    private final DtoException error;

    public static AttributeResult success(String name, Object value) {
        return new AttributeResult(name, value, null);
    }

    public static AttributeResult failure(String name, DtoException error) {
        return new AttributeResult(name, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public Optional<DtoException> getErrorIfPresent() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the value, or rethrows the captured failure.
     */
    public Object orElseThrow() {
        if (error != null) {
            throw error;
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "AttributeResult[" + name + " = " + value + "]"
                : "AttributeResult[" + name + " failed: " + error.getMessage() + "]";
    }
}
