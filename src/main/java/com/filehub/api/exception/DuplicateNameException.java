package com.filehub.api.exception;

import lombok.Getter;

/** A reference with the requested name already exists. */
@Getter
public class DuplicateNameException extends FileHubException {

    private final String existingFilename;

    public DuplicateNameException(String name, String existingFilename) {
        super(ErrorKind.DUPLICATE_NAME,
                "This file appears to be identical to " + existingFilename
                        + " and a reference named '" + name + "' already exists");
        this.existingFilename = existingFilename;
    }
}
