package com.reelindex.service;

import com.reelindex.dto.EdlExportRequest;
import com.reelindex.entity.SceneEntity;
import com.reelindex.repository.SceneRepository;
import com.reelindex.util.EdlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ExportService {

    private static final Logger log = LoggerFactory.getLogger(ExportService.class);

    private final SceneRepository sceneRepository;

    public ExportService(SceneRepository sceneRepository) {
        this.sceneRepository = sceneRepository;
    }

    /**
     * CMX3600 EDL with one event per requested scene, in request order.
     * Unknown scene ids are skipped.
     */
    @Transactional(readOnly = true)
    public String exportEdl(EdlExportRequest request) {
        if (request.getScenes() == null || request.getScenes().isEmpty()) {
            throw new IllegalArgumentException("No scenes provided");
        }
        Map<Long, SceneEntity> scenes = sceneRepository.findAllById(request.getScenes().stream()
                        .map(EdlExportRequest.Item::getSceneId)
                        .filter(Objects::nonNull)
                        .toList())
                .stream()
                .collect(Collectors.toMap(SceneEntity::getId, Function.identity()));

        EdlWriter edl = new EdlWriter(request.getTitle());
        for (EdlExportRequest.Item item : request.getScenes()) {
            SceneEntity scene = scenes.get(item.getSceneId());
            if (scene == null) {
                log.warn("EDL export: scene {} not found, skipped", item.getSceneId());
                continue;
            }
            double in = item.getInTc() != null ? item.getInTc() : scene.getStartTc();
            double out = item.getOutTc() != null ? item.getOutTc() : scene.getEndTc();
            if (out < in) {
                throw new IllegalArgumentException("Out point before in point for scene " + scene.getId());
            }
            edl.addEvent(scene.getFile().getFilename(), in, out, scene.getFile().getFps());
        }
        log.info("EDL export '{}': {} event(s)", request.getTitle(), edl.getEventCount());
        return edl.build();
    }
}
