package com.filehub.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.filehub.api.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    ErrorKind kind;
    String message;
    String existing;        // name of the entity already holding the name/content
    Long referenceCount;    // live references blocking a delete
}
