package com.reelindex.controller;

import com.reelindex.dto.SceneQuery;
import com.reelindex.dto.SceneResult;
import com.reelindex.service.SceneSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * GET /api/search - combined scene search. Every parameter is optional and
 * every one given narrows the result.
 */
@RestController
@RequestMapping("/api")
public class SearchController {

    private static final Logger log = LoggerFactory.getLogger(SearchController.class);

    private final SceneSearchService searchService;

    public SearchController(SceneSearchService searchService) {
        this.searchService = searchService;
    }

    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> search(
            @RequestParam(name = "q", required = false) String visualText,
            @RequestParam(name = "visual_threshold", required = false) Double visualThreshold,
            @RequestParam(name = "match_scene", required = false) Long matchSceneId,
            @RequestParam(name = "visual_match_threshold", required = false) Double visualMatchThreshold,
            @RequestParam(name = "face", required = false) Long faceId,
            @RequestParam(name = "face_threshold", required = false) Double faceThreshold,
            @RequestParam(name = "transcript_query", required = false) String transcriptQuery,
            @RequestParam(name = "transcript_threshold", required = false) Double transcriptThreshold,
            @RequestParam(name = "tc_min", required = false) Double tcMin,
            @RequestParam(name = "tc_max", required = false) Double tcMax,
            @RequestParam(name = "transcript", required = false) String transcriptContains,
            @RequestParam(name = "path", required = false) String pathContains,
            @RequestParam(name = "duration_min", required = false) Double durationMin,
            @RequestParam(name = "duration_max", required = false) Double durationMax,
            @RequestParam(name = "width_min", required = false) Integer widthMin,
            @RequestParam(name = "width_max", required = false) Integer widthMax,
            @RequestParam(name = "height_min", required = false) Integer heightMin,
            @RequestParam(name = "height_max", required = false) Integer heightMax,
            @RequestParam(name = "fps_min", required = false) Double fpsMin,
            @RequestParam(name = "fps_max", required = false) Double fpsMax,
            @RequestParam(name = "codec", required = false) String codec,
            @RequestParam(name = "limit", required = false) Integer limit) {

        SceneQuery query = new SceneQuery();
        query.setVisualText(visualText);
        query.setVisualThreshold(visualThreshold);
        query.setMatchSceneId(matchSceneId);
        query.setVisualMatchThreshold(visualMatchThreshold);
        query.setFaceId(faceId);
        query.setFaceThreshold(faceThreshold);
        query.setTranscriptQuery(transcriptQuery);
        query.setTranscriptThreshold(transcriptThreshold);
        query.setTcMin(tcMin);
        query.setTcMax(tcMax);
        query.setTranscriptContains(transcriptContains);
        query.setPathContains(pathContains);
        query.setDurationMin(durationMin);
        query.setDurationMax(durationMax);
        query.setWidthMin(widthMin);
        query.setWidthMax(widthMax);
        query.setHeightMin(heightMin);
        query.setHeightMax(heightMax);
        query.setFpsMin(fpsMin);
        query.setFpsMax(fpsMax);
        query.setCodec(codec);
        query.setLimit(limit);

        long start = System.currentTimeMillis();
        List<SceneResult> results = searchService.search(query);
        log.debug("Search returned {} scene(s) in {} ms", results.size(), System.currentTimeMillis() - start);
        return ResponseEntity.ok(Map.of("results", results, "count", results.size()));
    }
}
