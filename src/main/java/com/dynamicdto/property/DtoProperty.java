package com.dynamicdto.property;

import com.dynamicdto.exception.DtoInvalidKeyException;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A single attribute assignment, built fresh for every set call.
 *
 * {@code rawValue} is the value as handed in, {@code value} is what gets
 * stored. Both are currently the same object.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DtoProperty {

    String name;

    /**
     * Optional type tag; {@code null} when the caller did not supply one.
     */
    Class<?> type;

    Object rawValue;

    Object value;

    public static DtoProperty make(Object name, Object value) {
        return make(name, value, null);
    }

    /**
     * @throws DtoInvalidKeyException if {@code name} is null, not a string, empty or numeric
     */
    public static DtoProperty make(Object name, Object value, Class<?> type) {
        if (!AttributeKeys.isValid(name)) {
            throw new DtoInvalidKeyException(String.valueOf(name));
        }
        return new DtoProperty(name.toString(), type, value, coerce(value, type));
    }

    private static Object coerce(Object rawValue, Class<?> type) {
        return rawValue;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
