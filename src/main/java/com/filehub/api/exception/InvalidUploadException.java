package com.filehub.api.exception;

public class InvalidUploadException extends FileHubException {

    public InvalidUploadException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
