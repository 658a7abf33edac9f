package com.dynamicdto.registry;

import java.util.Set;

import com.dynamicdto.Dto;
import com.dynamicdto.options.DtoOptions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Per-type metadata resolved once from a Dto class declaration.
 */
@Value
@Builder
public class DtoTypeDescriptor {

    @NonNull
    Class<? extends Dto> type;

    /**
     * Options derived from the capability markers the type implements.
     */
    @NonNull
    DtoOptions options;

    /**
     * Ordered whitelist from {@code @Fillable}; empty means every name is accepted.
     */
    @NonNull
    @Builder.Default
    Set<String> fillable = Set.of();

    public boolean isFillable(String name) {
        return fillable.isEmpty() || fillable.contains(name);
    }
}
