package com.filehub.api.service;

import lombok.Value;

/** SHA-256 of some content, with the number of bytes it was computed over. */
@Value
public class ContentDigest {

    String hex;
    long length;
}
