package com.filehub.api.dto;

import com.filehub.api.model.ByteSizes;
import lombok.Value;

@Value
public class StorageSummary {

    long fileCount;
    long referenceCount;
    long storedBytes;
    long storageSaved;

    public String getStorageSavedFormatted() {
        return ByteSizes.format(storageSaved);
    }
}
