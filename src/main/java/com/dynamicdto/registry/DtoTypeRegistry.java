package com.dynamicdto.registry;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dynamicdto.Dto;
import com.dynamicdto.contract.Fillable;
import com.dynamicdto.contract.ForbidsOverrides;
import com.dynamicdto.contract.IgnoresUnknownAttributes;
import com.dynamicdto.contract.ReadOnlyAttributes;
import com.dynamicdto.options.DtoOptions;
import com.dynamicdto.property.AttributeKeys;

import lombok.experimental.UtilityClass;

/**
 * Process-wide cache of {@link DtoTypeDescriptor}s keyed by concrete class.
 *
 * Each type is inspected at most once; concurrent first use resolves through
 * {@link ConcurrentHashMap#computeIfAbsent}, so every caller sees the same descriptor.
 */
@UtilityClass
public class DtoTypeRegistry {

    private final Logger log = LoggerFactory.getLogger(DtoTypeRegistry.class);

    private final Map<Class<? extends Dto>, DtoTypeDescriptor> DESCRIPTORS = new ConcurrentHashMap<>();

    public DtoTypeDescriptor resolve(Class<? extends Dto> type) {
        return DESCRIPTORS.computeIfAbsent(type, DtoTypeRegistry::describe);
    }

    /**
     * Resolves {@code type} eagerly, e.g. at application startup.
     */
    public DtoTypeDescriptor register(Class<? extends Dto> type) {
        return resolve(type);
    }

    public boolean isRegistered(Class<? extends Dto> type) {
        return DESCRIPTORS.containsKey(type);
    }

    /**
     * Drops every cached descriptor.
     */
    public void clear() {
        DESCRIPTORS.clear();
    }

    private DtoTypeDescriptor describe(Class<? extends Dto> type) {
        DtoOptions options = DtoOptions.builder()
                .forbidsOverrides(ForbidsOverrides.class.isAssignableFrom(type))
                .ignoresUnknown(IgnoresUnknownAttributes.class.isAssignableFrom(type))
                .readOnly(ReadOnlyAttributes.class.isAssignableFrom(type))
                .build();

        Set<String> fillable = readFillable(type);

        log.debug("Resolved Dto type {}: options={}, fillable={}", type.getName(), options, fillable);

        return DtoTypeDescriptor.builder()
                .type(type)
                .options(options)
                .fillable(fillable)
                .build();
    }

    private Set<String> readFillable(Class<? extends Dto> type) {
        Fillable annotation = type.getAnnotation(Fillable.class);
        if (annotation == null || annotation.value().length == 0) {
            return Set.of();
        }

        Set<String> names = new LinkedHashSet<>(Arrays.asList(annotation.value()));
        for (String name : names) {
            if (!AttributeKeys.isValid(name)) {
                log.warn("Dto type {} declares invalid fillable name [{}]; it can never be assigned",
                        type.getName(), name);
            }
        }
        return Collections.unmodifiableSet(names);
    }
}
