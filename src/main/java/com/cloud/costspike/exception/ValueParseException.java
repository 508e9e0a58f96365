package com.cloud.costspike.exception;

/**
 * A cell in one of the required columns could not be coerced to its type.
 */
public class ValueParseException extends CostDataException {

    private final String column;
    private final Object rawValue;
    private final int rowIndex;

    public ValueParseException(String column, Object rawValue, int rowIndex, String reason) {
        super(String.format("Some '%s' values could not be parsed: row %d value '%s' (%s)",
                column, rowIndex, rawValue, reason));
        this.column = column;
        this.rawValue = rawValue;
        this.rowIndex = rowIndex;
    }

    public String getColumn() { return column; }
    public Object getRawValue() { return rawValue; }
    public int getRowIndex() { return rowIndex; }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PARSE;
    }
}
