package com.dynamicdto.property;

import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Rules for what may be used as an attribute name.
 *
 * A name must be a non-empty string that does not read as a number. Numeric
 * names almost always come from positional data (list indexes) leaking into a
 * keyed structure, so they are rejected everywhere.
 */
@UtilityClass
public class AttributeKeys {

    /**
     * Loose numeric form: surrounding whitespace, optional sign, integer or
     * decimal digits, optional exponent. Examples: "12", "-4", "1.5", ".5", "1e3".
     */
    private static final Pattern NUMERIC = Pattern.compile(
            "^\\s*[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?\\s*$");

    public boolean isNumeric(CharSequence key) {
        return key != null && NUMERIC.matcher(key).matches();
    }

    /**
     * True when {@code key} can be used as an attribute name.
     */
    public boolean isValid(Object key) {
        return key instanceof CharSequence name && name.length() > 0 && !isNumeric(name);
    }
}
