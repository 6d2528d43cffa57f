package com.quantumskylink.orchestration.model;

import java.util.Collection;
import java.util.Map;

/**
 * Type tag attached to every declared workflow input.
 */
public enum InputType {
    STRING,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY;

    /** True if a JSON-decoded value carries this type. Null never matches. */
    public boolean accepts(Object value) {
        return switch (this) {
            case STRING  -> value instanceof CharSequence;
            case NUMBER  -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT  -> value instanceof Map;
            case ARRAY   -> value instanceof Collection || (value != null && value.getClass().isArray());
        };
    }
}
