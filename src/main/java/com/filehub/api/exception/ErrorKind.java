package com.filehub.api.exception;

public enum ErrorKind {
    VALIDATION,
    DUPLICATE_NAME,
    REFERENCE_EXISTS,
    NOT_FOUND,
    STORAGE_FAILURE
}
