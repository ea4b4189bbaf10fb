package com.filehub.api.exception;

public class StorageFailureException extends FileHubException {

    public StorageFailureException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_FAILURE, message, cause);
    }
}
