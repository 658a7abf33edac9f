package com.dynamicdto.options;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

import lombok.experimental.UtilityClass;

/**
 * Loose truthiness used when option values arrive untyped.
 *
 * False: null, false, numeric zero, "" and "0", empty collections, maps and
 * arrays. Everything else is true.
 */
@UtilityClass
public class BooleanCoercion {

    public boolean toBoolean(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() != 0;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0d;
        }
        if (value instanceof CharSequence chars) {
            String s = chars.toString();
            return !s.isEmpty() && !"0".equals(s);
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }
}
