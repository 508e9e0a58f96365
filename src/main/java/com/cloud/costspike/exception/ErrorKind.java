package com.cloud.costspike.exception;

public enum ErrorKind {
    SCHEMA,
    PARSE,
    INSUFFICIENT_DATA
}
