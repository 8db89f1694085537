package com.invoice.memory.core.model;

/**
 * Kind of knowledge a {@link Memory} captures about a vendor.
 */
public enum MemoryType {
    /** Vendor-level habits (layout, labels, language). */
    VENDOR,

    /** A field correction learned from human edits. */
    CORRECTION,

    /** How a recurring ambiguity was resolved. */
    RESOLUTION
}
