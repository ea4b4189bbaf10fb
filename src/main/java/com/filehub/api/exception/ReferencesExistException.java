package com.filehub.api.exception;

import lombok.Getter;

@Getter
public class ReferencesExistException extends FileHubException {

    private final long referenceCount;

    public ReferencesExistException(String fileId, long referenceCount) {
        super(ErrorKind.REFERENCE_EXISTS,
                "File " + fileId + " has " + referenceCount + " references. Delete the references first.");
        this.referenceCount = referenceCount;
    }
}
