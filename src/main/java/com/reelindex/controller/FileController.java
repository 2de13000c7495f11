package com.reelindex.controller;

import com.reelindex.exception.NotFoundException;
import com.reelindex.service.LibraryQueryService;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Endpoints:
 * GET /api/files - live files, completed only by default
 * GET /api/files/{id} - file with its scenes
 * GET /api/video/{fileId} - video bytes; Range requests answer 206 or 416
 */
@RestController
@RequestMapping("/api")
public class FileController {

    private static final Map<String, MediaType> VIDEO_TYPES = Map.of(
            "mp4", MediaType.parseMediaType("video/mp4"),
            "mov", MediaType.parseMediaType("video/quicktime"),
            "avi", MediaType.parseMediaType("video/x-msvideo"),
            "mkv", MediaType.parseMediaType("video/x-matroska"),
            "webm", MediaType.parseMediaType("video/webm"),
            "mxf", MediaType.parseMediaType("application/mxf"));

    private final LibraryQueryService libraryQueryService;

    public FileController(LibraryQueryService libraryQueryService) {
        this.libraryQueryService = libraryQueryService;
    }

    @GetMapping("/files")
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(defaultValue = "true") boolean completed,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        List<Map<String, Object>> files = libraryQueryService.listFiles(completed,
                Math.max(1, Math.min(limit, 500)), Math.max(0, offset));
        return ResponseEntity.ok(Map.of("files", files, "count", files.size()));
    }

    @GetMapping("/files/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable Long id) {
        return ResponseEntity.ok(libraryQueryService.getFile(id));
    }

    @GetMapping("/video/{fileId}")
    public ResponseEntity<Resource> video(@PathVariable Long fileId) {
        Path path = Paths.get(libraryQueryService.videoPath(fileId));
        if (!Files.isRegularFile(path)) {
            throw new NotFoundException("Video file not found on disk");
        }
        Resource resource = new FileSystemResource(path);
        return ResponseEntity.ok()
                .header(HttpHeaders.ACCEPT_RANGES, "bytes")
                .contentType(videoType(path, resource))
                .body(resource);
    }

    static MediaType videoType(Path path, Resource resource) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        MediaType known = dot >= 0 ? VIDEO_TYPES.get(name.substring(dot + 1)) : null;
        if (known != null) {
            return known;
        }
        return MediaTypeFactory.getMediaType(resource).orElse(MediaType.parseMediaType("video/mp4"));
    }
}
