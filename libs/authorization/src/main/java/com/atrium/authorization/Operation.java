package com.atrium.authorization;

/**
 * A requested operation: an action on a module (e.g., {@code students} / {@code read}).
 * <p>
 * Operations come from route declarations, never from request content. Whether an operation is
 * known is decided by the {@link PermissionCatalog}, not by this record.
 *
 * @param module resource domain (e.g., "students")
 * @param action operation on the module (e.g., "read")
 */
public record Operation(String module, String action) {

    /** Separator used by the textual form {@code module:action}. */
    public static final char SEPARATOR = ':';

    public Operation {
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("module must not be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be null or blank");
        }
    }

    public static Operation of(String module, String action) {
        return new Operation(module, action);
    }

    /**
     * Parses the {@code module:action} form used in route declarations and configuration.
     *
     * @param text the declaration (e.g., "students:read")
     * @return the parsed operation
     * @throws IllegalArgumentException if the text has no separator or an empty part
     */
    public static Operation parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        int idx = text.indexOf(SEPARATOR);
        if (idx <= 0 || idx == text.length() - 1 || text.indexOf(SEPARATOR, idx + 1) >= 0) {
            throw new IllegalArgumentException("operation must have the form module:action, got '%s'"
                    .formatted(text));
        }
        return new Operation(text.substring(0, idx).trim(), text.substring(idx + 1).trim());
    }

    @Override
    public String toString() {
        return module + SEPARATOR + action;
    }
}
