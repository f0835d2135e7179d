package com.paramguard.validation.source;

/**
 * Origins a handler parameter can be bound to.
 */
public enum SourceKind {
    ROUTE("Route"),
    JSON("Json"),
    QUERY("Query"),
    FORM("Form"),
    FILE("File");

    private final String displayName;

    SourceKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
