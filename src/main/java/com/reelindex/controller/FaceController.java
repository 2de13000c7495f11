package com.reelindex.controller;

import com.reelindex.service.LibraryQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/faces")
public class FaceController {

    private final LibraryQueryService libraryQueryService;

    public FaceController(LibraryQueryService libraryQueryService) {
        this.libraryQueryService = libraryQueryService;
    }

    /** Most recently detected faces first. */
    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(defaultValue = "50") int limit) {
        List<Map<String, Object>> faces = libraryQueryService.listFaces(Math.max(1, Math.min(limit, 200)));
        return ResponseEntity.ok(Map.of("faces", faces));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable Long id) {
        return ResponseEntity.ok(libraryQueryService.getFace(id));
    }

    @GetMapping("/clusters")
    public ResponseEntity<Map<String, Object>> clusters() {
        List<Map<String, Object>> clusters = libraryQueryService.faceClusters();
        return ResponseEntity.ok(Map.of("clusters", clusters, "count", clusters.size()));
    }

    @GetMapping("/clusters/{clusterId}")
    public ResponseEntity<Map<String, Object>> cluster(@PathVariable int clusterId) {
        List<Map<String, Object>> faces = libraryQueryService.facesInCluster(clusterId);
        return ResponseEntity.ok(Map.of("clusterId", clusterId, "faces", faces, "count", faces.size()));
    }
}
