package com.dynamicdto.options;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Boolean policy switches evaluated on every attribute read and write.
 *
 * The three flags are independent; any combination is valid.
 */
@Value
@Builder(toBuilder = true)
public class DtoOptions {

    private static final DtoOptions DEFAULTS = DtoOptions.builder().build();

    /**
     * Reject assignments to a name that already holds a value.
     */
    boolean forbidsOverrides;

    /**
     * Return null instead of failing when reading a name that was never set.
     */
    boolean ignoresUnknown;

    /**
     * Reject every mutation once the Dto has been initialized.
     */
    boolean readOnly;

    public static DtoOptions defaults() {
        return DEFAULTS;
    }

    public boolean isEnabled(DtoOption option) {
        return switch (option) {
            case FORBIDS_OVERRIDES -> forbidsOverrides;
            case IGNORES_UNKNOWN -> ignoresUnknown;
            case READ_ONLY -> readOnly;
        };
    }

    /**
     * Returns a copy with the recognized keys of {@code overrides} applied.
     * Values are coerced with {@link BooleanCoercion}; unknown keys are ignored.
     */
    public DtoOptions merge(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        DtoOptionsBuilder builder = toBuilder();
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            boolean enabled = BooleanCoercion.toBoolean(entry.getValue());
            DtoOption.fromKey(entry.getKey()).ifPresent(option -> {
                switch (option) {
                    case FORBIDS_OVERRIDES -> builder.forbidsOverrides(enabled);
                    case IGNORES_UNKNOWN -> builder.ignoresUnknown(enabled);
                    case READ_ONLY -> builder.readOnly(enabled);
                }
            });
        }
        return builder.build();
    }
}
