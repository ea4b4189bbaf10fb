package com.filehub.api.controller;

import com.filehub.api.model.FileReference;
import com.filehub.api.service.FileCatalogService;
import com.filehub.api.service.FileLifecycleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/references")
public class ReferenceController {

    private final FileCatalogService catalogService;
    private final FileLifecycleService lifecycleService;

    public ReferenceController(FileCatalogService catalogService, FileLifecycleService lifecycleService) {
        this.catalogService = catalogService;
        this.lifecycleService = lifecycleService;
    }

    // GET /api/references?originalFile={fileId}
    @GetMapping
    public List<FileReference> listReferences(@RequestParam(value = "originalFile", required = false) String originalFileId) {
        return catalogService.listReferences(originalFileId);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteReference(@PathVariable String id) {
        lifecycleService.deleteReference(id);
        return ResponseEntity.noContent().build();
    }
}
