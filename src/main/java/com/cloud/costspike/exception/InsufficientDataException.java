package com.cloud.costspike.exception;

public class InsufficientDataException extends CostDataException {

    public InsufficientDataException(int rowCount, int required) {
        super(String.format("At least %d rows are required to build the isolation forest, got %d",
                required, rowCount));
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INSUFFICIENT_DATA;
    }
}
