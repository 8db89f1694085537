package com.invoice.memory.rules;

import com.invoice.memory.core.model.FieldPath;

import java.util.Objects;

/**
 * A change a matcher wants to make, before it is attributed to a memory.
 */
public record FieldChange(FieldPath field, Object from, Object to) {

    public FieldChange {
        Objects.requireNonNull(field, "field is required");
    }
}
