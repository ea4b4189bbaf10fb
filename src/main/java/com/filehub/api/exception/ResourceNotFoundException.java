package com.filehub.api.exception;

public class ResourceNotFoundException extends FileHubException {

    public ResourceNotFoundException(String what, String id) {
        super(ErrorKind.NOT_FOUND, what + " not found: " + id);
    }
}
