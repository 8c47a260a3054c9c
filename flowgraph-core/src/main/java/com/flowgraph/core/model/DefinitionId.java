package com.flowgraph.core.model;

/**
 * Immutable handle of one version of a workflow definition.
 * Rendered as {key}:{version}.
 */
public record DefinitionId(String key, int version) {

    public DefinitionId {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Definition key cannot be empty");
        }
        if (key.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Definition key cannot contain ':' - " + key);
        }
        if (version < 1) {
            throw new IllegalArgumentException("Definition version must be positive: " + version);
        }
    }

    public static DefinitionId of(String key, int version) {
        return new DefinitionId(key, version);
    }

    /**
     * Parse the {key}:{version} form.
     */
    public static DefinitionId parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Definition id cannot be null");
        }
        int separator = value.lastIndexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Definition id must look like key:version - " + value);
        }
        try {
            return new DefinitionId(value.substring(0, separator),
                Integer.parseInt(value.substring(separator + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Definition version is not a number - " + value, e);
        }
    }

    /**
     * Check whether a string is in {key}:{version} form rather than a bare key.
     */
    public static boolean isQualified(String value) {
        return value != null && value.indexOf(':') >= 0;
    }

    @Override
    public String toString() {
        return key + ":" + version;
    }
}
