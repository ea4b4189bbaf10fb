package com.filehub.api.dto;

import lombok.Value;
import org.springframework.core.io.Resource;

/** Bytes of a stored file, with the name and type to serve them under. */
@Value
public class StoredContent {

    String filename;
    String contentType;
    long size;
    Resource resource;
}
