package com.quantumskylink.orchestration.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads one named entry of the input bag as a typed request record.
 */
@Component
public class RequestBinder {

    private final ObjectMapper json;

    public RequestBinder(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public <T> T bind(Map<String, Object> inputs, String inputName, Class<T> type) {
        Object raw = inputs.get(inputName);
        if (raw == null) {
            throw new RequestBindingException("Required input missing: " + inputName);
        }
        try {
            return json.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            throw new RequestBindingException(
                    "Input '" + inputName + "' is not a valid " + type.getSimpleName(), e);
        }
    }

    /**
     * Bind and check the request, failing with every field error at once.
     *
     * @param fieldErrors returns one message per violated field rule
     */
    public <T> T bindChecked(Map<String, Object> inputs, String inputName, Class<T> type,
                             Function<T, List<String>> fieldErrors) {
        T request = bind(inputs, inputName, type);
        List<String> errors = fieldErrors.apply(request);
        if (!errors.isEmpty()) {
            throw new RequestBindingException(String.join("; ", errors));
        }
        return request;
    }

    /**
     * Every error {@link #bindChecked} would report, without throwing.
     * An absent input yields no errors; the catalog reports missing inputs.
     */
    public <T> List<String> check(Map<String, Object> inputs, String inputName, Class<T> type,
                                  Function<T, List<String>> fieldErrors) {
        if (inputs.get(inputName) == null) {
            return List.of();
        }
        T request;
        try {
            request = bind(inputs, inputName, type);
        } catch (RequestBindingException e) {
            return List.of(e.getMessage());
        }
        return List.copyOf(fieldErrors.apply(request));
    }

    /** Add a "required" error unless {@code value} has text. */
    public static void requireText(List<String> errors, String value, String field) {
        if (value == null || value.isBlank()) {
            errors.add("Field '" + field + "' is required");
        }
    }
}
