package com.dynamicdto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.dynamicdto.exception.DtoEncodingException;
import com.dynamicdto.exception.DtoException;
import com.dynamicdto.exception.DtoInvalidAttributeException;
import com.dynamicdto.exception.DtoPropertyNonFillableException;
import com.dynamicdto.exception.DtoPropertyOverrideException;
import com.dynamicdto.exception.DtoReadOnlyException;
import com.dynamicdto.options.DtoOption;
import com.dynamicdto.options.DtoOptions;
import com.dynamicdto.property.DtoProperty;
import com.dynamicdto.registry.DtoTypeDescriptor;
import com.dynamicdto.registry.DtoTypeRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Base type for attribute containers.
 *
 * A Dto holds a name to value map and remembers, per name, the value it was
 * first given ({@link #getOriginal()}) and the changed value when it was later
 * overwritten with something different ({@link #getDirty()}).
 *
 * <p>Lifecycle: a Dto starts uninitialized. The first {@link #fill} call,
 * including the one made by {@link #Dto(Map)}, applies its entries and then
 * initializes the Dto: {@code original} is synced with the current attributes
 * and the Dto is marked initialized for good.
 *
 * <p>Policies come from the concrete type:
 * <ul>
 *   <li>{@link com.dynamicdto.contract.ReadOnlyAttributes}: no mutation after initialization</li>
 *   <li>{@link com.dynamicdto.contract.ForbidsOverrides}: a name can be assigned once</li>
 *   <li>{@link com.dynamicdto.contract.IgnoresUnknownAttributes}: reading an unset name yields null</li>
 *   <li>{@link com.dynamicdto.contract.Fillable}: whitelist of accepted names</li>
 * </ul>
 * and can be changed per instance with {@link #setOptions(Map)}.
 *
 * <p>Instances are not thread-safe.
 */
public abstract class Dto implements Iterable<Map.Entry<String, Object>> {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, Object> attributes = new LinkedHashMap<>();

    private final DtoTypeDescriptor descriptor;

    private Map<String, Object> original = new LinkedHashMap<>();

    private final Map<String, Object> dirty = new LinkedHashMap<>();

    private boolean initialized;

    private boolean silent;

    private DtoOptions options;

    /**
     * Creates an empty, uninitialized Dto. The first {@link #fill} initializes it.
     */
    protected Dto() {
        this.descriptor = DtoTypeRegistry.resolve(getClass());
        this.options = descriptor.getOptions();
        this.silent = QuietConstruction.isActive();
    }

    /**
     * Creates a Dto and fills it with {@code attributes}; the result is initialized
     * even when the map is empty.
     */
    protected Dto(Map<String, ?> attributes) {
        this();
        fill(attributes);
    }

    // ---- Mutation ----

    /**
     * Assigns {@code value} to {@code name} after running the policy checks.
     * In silent mode a rejected assignment is dropped instead of thrown.
     *
     * @throws com.dynamicdto.exception.DtoInvalidKeyException if the name is empty or numeric
     * @throws DtoReadOnlyException if the Dto is read only and initialized
     * @throws DtoPropertyNonFillableException if the name is not whitelisted
     * @throws DtoPropertyOverrideException if the name is set and overrides are forbidden
     */
    public Dto setAttribute(String name, Object value) {
        try {
            applyAttribute(name, value);
        } catch (DtoException e) {
            if (!silent) {
                throw e;
            }
        }
        return this;
    }

    public Dto set(String name, Object value) {
        return setAttribute(name, value);
    }

    /**
     * Same checks as {@link #setAttribute}, reported as a result instead of thrown.
     * Ignores silent mode.
     */
    public AttributeResult trySetAttribute(String name, Object value) {
        try {
            applyAttribute(name, value);
            return AttributeResult.success(name, value);
        } catch (DtoException e) {
            return AttributeResult.failure(name, e);
        }
    }

    /**
     * Removes {@code name} and its dirty entry. Unknown names are ignored.
     *
     * @throws DtoReadOnlyException if the Dto is read only and initialized
     */
    public Dto unset(String name) {
        try {
            if (option(DtoOption.READ_ONLY) && initialized) {
                throw new DtoReadOnlyException(name);
            }
            attributes.remove(name);
            dirty.remove(name);
        } catch (DtoException e) {
            if (!silent) {
                throw e;
            }
        }
        return this;
    }

    /**
     * Sets every entry in iteration order, then initializes the Dto if it was not yet.
     */
    public Dto fill(Map<String, ?> values) {
        if (values != null) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                setAttribute(entry.getKey(), entry.getValue());
            }
        }
        initialize();
        return this;
    }

    public Dto fill() {
        return fill(Map.of());
    }

    /**
     * Fills like {@link #fill(Map)} but never throws for rejected entries.
     *
     * @return the rejected entries, in input order
     */
    public List<AttributeResult> fillQuietly(Map<String, ?> values) {
        List<AttributeResult> rejected = new ArrayList<>();
        if (values != null) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                AttributeResult result = trySetAttribute(entry.getKey(), entry.getValue());
                if (result.isFailure()) {
                    rejected.add(result);
                }
            }
        }
        initialize();
        return rejected;
    }

    // ---- Read ----

    /**
     * Returns the value of {@code name}, or null when it is not set and the Dto
     * ignores unknown attributes. In silent mode failures also yield null.
     *
     * @throws DtoInvalidAttributeException if the name is not set
     */
    public Object getAttribute(String name) {
        try {
            validateGetAttribute(name);
            return attributes.get(name);
        } catch (DtoException e) {
            if (!silent) {
                throw e;
            }
            return null;
        }
    }

    public Object get(String name) {
        return getAttribute(name);
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(getAttribute(name));
    }

    public AttributeResult tryGetAttribute(String name) {
        try {
            validateGetAttribute(name);
            return AttributeResult.success(name, attributes.get(name));
        } catch (DtoException e) {
            return AttributeResult.failure(name, e);
        }
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public boolean has(String name) {
        return hasAttribute(name);
    }

    public Map<String, Object> getAttributes() {
        return new LinkedHashMap<>(attributes);
    }

    public Map<String, Object> all() {
        return getAttributes();
    }

    public Map<String, Object> toArray() {
        return getAttributes();
    }

    public Set<String> getFillable() {
        return descriptor.getFillable();
    }

    public int count() {
        return attributes.size();
    }

    /**
     * Iterates over a snapshot of the attributes.
     */
    @Override
    public Iterator<Map.Entry<String, Object>> iterator() {
        return Collections.unmodifiableMap(getAttributes()).entrySet().iterator();
    }

    // ---- Change tracking ----

    public Map<String, Object> getOriginal() {
        return new LinkedHashMap<>(original);
    }

    public Object getOriginal(String name) {
        return original.get(name);
    }

    public Map<String, Object> getDirty() {
        return new LinkedHashMap<>(dirty);
    }

    public Object getDirty(String name) {
        return dirty.get(name);
    }

    public boolean isDirty() {
        return !dirty.isEmpty();
    }

    /**
     * Replaces the original values with the current attributes. Dirty entries are kept.
     */
    public Dto syncOriginal() {
        this.original = getAttributes();
        return this;
    }

    // ---- State ----

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * True when no attribute holds a non-null value.
     */
    public boolean isEmpty() {
        return attributes.values().stream().allMatch(Objects::isNull);
    }

    public boolean isFilled() {
        return !isEmpty();
    }

    // ---- Options ----

    public DtoOptions getOptions() {
        return options;
    }

    public boolean option(DtoOption option) {
        return options.isEnabled(option);
    }

    /**
     * Merges the recognized keys ({@code forbids_overrides}, {@code ignores_unknown},
     * {@code read_only}) into the current options. Other keys are ignored.
     */
    public Dto setOptions(Map<String, ?> overrides) {
        this.options = options.merge(overrides);
        return this;
    }

    public Dto setOptions(DtoOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        return this;
    }

    public Dto shouldBeSilent(boolean silent) {
        this.silent = silent;
        return this;
    }

    public boolean isSilent() {
        return silent;
    }

    // ---- Encoding ----

    public String toJson() {
        return toJson(new SerializationFeature[0]);
    }

    /**
     * Encodes the attributes as a JSON object, in insertion order.
     *
     * @throws DtoEncodingException if a value cannot be encoded
     */
    public String toJson(SerializationFeature... features) {
        ObjectWriter writer = JSON.writer();
        for (SerializationFeature feature : features) {
            writer = writer.with(feature);
        }
        try {
            return writer.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new DtoEncodingException(getClass().getSimpleName(), e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + attributes;
    }

    // ---- Internals ----

    protected void initialize() {
        if (!initialized) {
            syncOriginal();
            initialized = true;
        }
    }

    protected void validateSetAttribute(DtoProperty property) {
        String name = property.getName();
        if (option(DtoOption.READ_ONLY) && initialized) {
            throw new DtoReadOnlyException(name);
        }
        if (!descriptor.isFillable(name)) {
            throw new DtoPropertyNonFillableException(name);
        }
        if (option(DtoOption.FORBIDS_OVERRIDES) && hasAttribute(name)) {
            throw new DtoPropertyOverrideException(name);
        }
    }

    protected void validateGetAttribute(String name) {
        if (!option(DtoOption.IGNORES_UNKNOWN) && !hasAttribute(name)) {
            throw new DtoInvalidAttributeException(name);
        }
    }

    private void applyAttribute(String name, Object value) {
        DtoProperty property = DtoProperty.make(name, value);
        validateSetAttribute(property);

        String key = property.getName();
        Object stored = property.getValue();
        if (hasAttribute(key)) {
            if (!Objects.equals(original.get(key), stored)) {
                dirty.put(key, stored);
            } else {
                dirty.remove(key);
            }
        } else {
            original.put(key, stored);
        }
        attributes.put(key, stored);
    }
}
