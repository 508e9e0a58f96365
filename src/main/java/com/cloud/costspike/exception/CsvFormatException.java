package com.cloud.costspike.exception;

/**
 * The uploaded file is not readable as CSV.
 */
public class CsvFormatException extends CostDataException {

    public CsvFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PARSE;
    }
}
