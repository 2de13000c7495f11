package com.reelindex.controller;

import com.reelindex.dto.SceneResult;
import com.reelindex.exception.NotFoundException;
import com.reelindex.service.LibraryQueryService;
import com.reelindex.service.ThumbnailService;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
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
import java.util.concurrent.TimeUnit;

/**
 * Scene browsing and poster images.
 *
 * Endpoints:
 * GET /api/scenes - paged browse of searchable scenes
 * GET /api/scenes/{id} - scene with faces and embedding metadata
 * GET /api/scenes/{id}/thumbnail - grid thumbnail, poster as fallback
 * GET /api/scenes/{id}/poster - full poster still
 * GET /api/scenes/clusters/{clusterId} - appearance cluster members
 */
@RestController
@RequestMapping("/api/scenes")
public class SceneController {

    static final int DEFAULT_PAGE = 40;
    static final int MAX_PAGE = 200;

    private final LibraryQueryService libraryQueryService;
    private final ThumbnailService thumbnailService;

    public SceneController(LibraryQueryService libraryQueryService, ThumbnailService thumbnailService) {
        this.libraryQueryService = libraryQueryService;
        this.thumbnailService = thumbnailService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(defaultValue = "40") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        int pageSize = limit > 0 ? Math.min(limit, MAX_PAGE) : DEFAULT_PAGE;
        return ResponseEntity.ok(libraryQueryService.listScenes(pageSize, Math.max(0, offset)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable Long id) {
        return ResponseEntity.ok(libraryQueryService.getScene(id));
    }

    @GetMapping("/{id}/thumbnail")
    public ResponseEntity<Resource> thumbnail(@PathVariable Long id) {
        Path poster = Paths.get(libraryQueryService.posterPath(id));
        Path image = thumbnailService.thumbnailFor(poster).orElse(poster);
        return image(image);
    }

    @GetMapping("/{id}/poster")
    public ResponseEntity<Resource> poster(@PathVariable Long id) {
        return image(Paths.get(libraryQueryService.posterPath(id)));
    }

    @GetMapping("/clusters/{clusterId}")
    public ResponseEntity<Map<String, Object>> cluster(@PathVariable int clusterId) {
        List<SceneResult> scenes = libraryQueryService.scenesInCluster(clusterId);
        return ResponseEntity.ok(Map.of("clusterId", clusterId, "scenes", scenes, "count", scenes.size()));
    }

    private static ResponseEntity<Resource> image(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new NotFoundException("Image file not found");
        }
        return ResponseEntity.ok()
                .contentType(imageType(path))
                .cacheControl(CacheControl.maxAge(1, TimeUnit.HOURS))
                .body(new FileSystemResource(path));
    }

    static MediaType imageType(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".webp")) {
            return MediaType.parseMediaType("image/webp");
        }
        if (name.endsWith(".png")) {
            return MediaType.IMAGE_PNG;
        }
        return MediaType.IMAGE_JPEG;
    }
}
