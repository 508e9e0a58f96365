package com.cloud.costspike.exception;

import java.util.List;

/**
 * One or more of the required columns (date, service, cost) is absent.
 */
public class SchemaException extends CostDataException {

    private final List<String> missingColumns;

    public SchemaException(List<String> missingColumns) {
        super("Input must contain columns: date, service, cost (case-insensitive). Missing: "
                + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public SchemaException(String message) {
        super(message);
        this.missingColumns = List.of();
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.SCHEMA;
    }
}
