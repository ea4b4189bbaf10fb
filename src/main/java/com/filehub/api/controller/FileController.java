package com.filehub.api.controller;

import com.filehub.api.dto.FileFilter;
import com.filehub.api.dto.StorageSummary;
import com.filehub.api.dto.StoredContent;
import com.filehub.api.dto.UploadResult;
import com.filehub.api.exception.InvalidUploadException;
import com.filehub.api.model.StoredFile;
import com.filehub.api.service.DeduplicationService;
import com.filehub.api.service.FileCatalogService;
import com.filehub.api.service.FileLifecycleService;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/files")
public class FileController {

    private final DeduplicationService deduplicationService;
    private final FileCatalogService catalogService;
    private final FileLifecycleService lifecycleService;

    public FileController(DeduplicationService deduplicationService,
                          FileCatalogService catalogService,
                          FileLifecycleService lifecycleService) {
        this.deduplicationService = deduplicationService;
        this.catalogService = catalogService;
        this.lifecycleService = lifecycleService;
    }

    // POST /api/files  (form-data key="file")
    @PostMapping
    public ResponseEntity<UploadResult> uploadFile(@RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null) {
            throw new InvalidUploadException("No file provided");
        }
        UploadResult result = deduplicationService.submit(
                file, file.getOriginalFilename(), file.getContentType(), file.getSize());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    // GET /api/files?filename=&fileType=&minSize=&maxSize=&uploadedAfter=&uploadedBefore=
    @GetMapping
    public List<StoredFile> listFiles(@ModelAttribute FileFilter filter) {
        return catalogService.listFiles(filter);
    }

    @GetMapping("/summary")
    public StorageSummary summary() {
        return catalogService.summary();
    }

    @GetMapping("/{id}")
    public StoredFile getFile(@PathVariable String id) {
        return catalogService.getFile(id);
    }

    // Accepts a file id or a reference id
    @GetMapping("/{id}/content")
    public ResponseEntity<Resource> downloadFile(@PathVariable String id) {
        StoredContent content = catalogService.openContent(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(content.getFilename(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .contentType(mediaTypeOf(content.getContentType()))
                .contentLength(content.getSize())
                .body(content.getResource());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteFile(@PathVariable String id) {
        lifecycleService.deleteFile(id);
        return ResponseEntity.noContent().build();
    }

    private static MediaType mediaTypeOf(String fileType) {
        try {
            return MediaType.parseMediaType(fileType);
        } catch (InvalidMediaTypeException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
