package com.filehub.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;

/** Listing criteria; every field is optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileFilter {

    private String filename;     // contains, case-insensitive
    private String fileType;     // equals, case-insensitive
    private Long minSize;
    private Long maxSize;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate uploadedAfter;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate uploadedBefore;

    private String search;       // filename or file type contains, case-insensitive

    // original_filename, size or uploaded_at; a leading '-' sorts descending
    private String ordering;

    public static FileFilter none() {
        return new FileFilter();
    }
}
