package com.reelindex.controller;

import com.reelindex.dto.EdlExportRequest;
import com.reelindex.service.ExportService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * POST /api/export/edl - body {@code {"title": "...", "scenes": [{"sceneId": 1, "inTc": 2.5, "outTc": 4.0}]}};
 * answers the EDL as a text attachment.
 */
@RestController
@RequestMapping("/api/export")
public class ExportController {

    private final ExportService exportService;

    public ExportController(ExportService exportService) {
        this.exportService = exportService;
    }

    @PostMapping("/edl")
    public ResponseEntity<String> edl(@RequestBody EdlExportRequest request) {
        String edl = exportService.exportEdl(request);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(request.getTitle() + ".edl", StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(edl);
    }
}
