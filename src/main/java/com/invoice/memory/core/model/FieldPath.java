package com.invoice.memory.core.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Address of a document field, either a plain name ({@code serviceDate})
 * or a positional element of a collection ({@code lineItems[2].sku}).
 *
 * @param name  top-level field name
 * @param index element position for collection paths, or null
 * @param child field inside the element for collection paths, or null
 */
public record FieldPath(String name, Integer index, String child) {

    private static final Pattern PATH = Pattern.compile("^([A-Za-z][A-Za-z0-9]*)(?:\\[(\\d*)]\\.([A-Za-z][A-Za-z0-9]*))?$");

    public FieldPath {
        Objects.requireNonNull(name, "name is required");
        if (index != null && child == null) {
            throw new IllegalArgumentException("indexed path requires a child field");
        }
        if (index != null && index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
    }

    public static FieldPath of(String name) {
        return new FieldPath(name, null, null);
    }

    public static FieldPath element(String collection, int index, String child) {
        return new FieldPath(collection, index, Objects.requireNonNull(child, "child is required"));
    }

    /**
     * Parses a path string. Accepts {@code name}, {@code name[i].child}
     * and the template form {@code name[].child}.
     */
    public static FieldPath parse(String path) {
        Objects.requireNonNull(path, "path is required");
        Matcher m = PATH.matcher(path.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed field path: " + path);
        }
        String child = m.group(3);
        if (child == null) {
            return of(m.group(1));
        }
        String idx = m.group(2);
        if (idx.isEmpty()) {
            return new FieldPath(m.group(1), null, child);
        }
        return element(m.group(1), Integer.parseInt(idx), child);
    }

    public boolean indexed() {
        return index != null;
    }

    /**
     * The position-free form of this path, shared by every element of a collection.
     */
    public String template() {
        return child == null ? name : name + "[]." + child;
    }

    @Override
    public String toString() {
        if (child == null) {
            return name;
        }
        return name + "[" + (index != null ? index : "") + "]." + child;
    }
}
