package com.dynamicdto.factory;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.Map;

import com.dynamicdto.exception.DtoInvalidArgumentException;
import com.dynamicdto.property.AttributeKeys;

/**
 * Turns the shapes accepted by {@link DtoFactory} into a flat name to value map.
 *
 * <ul>
 *   <li>{@link Map}: taken as-is (string keys only, numeric strings included)</li>
 *   <li>{@link Iterable} or array: {@link Map.Entry} elements with a non-numeric
 *       string key; any other element is positional and dropped</li>
 *   <li>record: its components</li>
 *   <li>any other object: its public instance fields</li>
 * </ul>
 *
 * Entries from iterables, arrays and reflected objects are filtered to
 * non-numeric string keys. Later duplicates win.
 */
public class SourceNormalizer {

    public Map<String, Object> normalize(Object source) {
        if (source == null) {
            throw new DtoInvalidArgumentException("Source data must be provided");
        }

        Map<String, Object> values;
        if (source instanceof Map<?, ?> map) {
            values = fromMap(map);
        } else if (source instanceof Iterable<?> iterable) {
            values = fromIterable(iterable);
        } else if (source.getClass().isArray()) {
            values = fromArray(source);
        } else if (source.getClass().isRecord()) {
            values = fromRecord((Record) source);
        } else {
            values = fromPublicFields(source);
        }

        if (values.isEmpty()) {
            throw new DtoInvalidArgumentException("Non-empty attributes must be provided");
        }
        return values;
    }

    private Map<String, Object> fromMap(Map<?, ?> map) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() instanceof CharSequence key) {
                values.put(key.toString(), entry.getValue());
            }
        }
        return values;
    }

    private Map<String, Object> fromIterable(Iterable<?> iterable) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Object element : iterable) {
            putEntry(values, element);
        }
        return values;
    }

    private Map<String, Object> fromArray(Object array) {
        Map<String, Object> values = new LinkedHashMap<>();
        int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            putEntry(values, Array.get(array, i));
        }
        return values;
    }

    private Map<String, Object> fromRecord(Record record) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Method accessor = component.getAccessor();
            accessor.trySetAccessible();
            try {
                putKeyed(values, component.getName(), accessor.invoke(record));
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new DtoInvalidArgumentException(
                        "Unable to read component [" + component.getName() + "] of "
                                + record.getClass().getName(), e);
            }
        }
        return values;
    }

    private Map<String, Object> fromPublicFields(Object source) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : source.getClass().getFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            field.trySetAccessible();
            try {
                putKeyed(values, field.getName(), field.get(source));
            } catch (IllegalAccessException e) {
                throw new DtoInvalidArgumentException(
                        "Unable to read field [" + field.getName() + "] of " + source.getClass().getName(), e);
            }
        }
        return values;
    }

    private void putEntry(Map<String, Object> values, Object element) {
        if (element instanceof Map.Entry<?, ?> entry) {
            putKeyed(values, entry.getKey(), entry.getValue());
        }
    }

    private void putKeyed(Map<String, Object> values, Object key, Object value) {
        if (key instanceof String name && !AttributeKeys.isNumeric(name)) {
            values.put(name, value);
        }
    }
}
