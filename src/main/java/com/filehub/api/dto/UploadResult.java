package com.filehub.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.filehub.api.model.FileReference;
import com.filehub.api.model.StoredFile;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a successful upload: either a new original file or a reference to
 * content that was already stored.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadResult {

    public enum Type { ORIGINAL, REFERENCE }

    Type type;
    String message;
    StoredFile file;
    FileReference reference;

    public static UploadResult created(StoredFile file) {
        return UploadResult.builder()
                .type(Type.ORIGINAL)
                .message("File uploaded successfully")
                .file(file)
                .build();
    }

    public static UploadResult referenced(FileReference reference) {
        return UploadResult.builder()
                .type(Type.REFERENCE)
                .message("File content already exists as " + reference.getOriginalFile().getOriginalFilename()
                        + ". Created a reference instead.")
                .reference(reference)
                .build();
    }

    /** The stored file holding the content, whichever way the upload resolved. */
    @JsonIgnore
    public StoredFile getOwningFile() {
        return type == Type.ORIGINAL ? file : reference.getOriginalFile();
    }
}
