package com.reelindex.repository;

import com.reelindex.dto.SceneQuery;
import com.reelindex.entity.EnrichmentJobEntity;
import com.reelindex.entity.JobStatus;
import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;
import jakarta.persistence.criteria.*;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Criteria building blocks for scene browsing and the metadata half of scene
 * search.
 */
public final class SceneSpecifications {

    /** Deterministic base order: file name, then scene order within the file. */
    public static final Sort BASE_ORDER = Sort.by(Sort.Order.asc("file.filename"), Sort.Order.asc("sceneIndex"),
            Sort.Order.asc("id"));

    private SceneSpecifications() {
    }

    /**
     * Scenes of files that are present on disk and whose enrichment completed.
     */
    public static Specification<SceneEntity> searchable() {
        return (root, query, cb) -> {
            Join<SceneEntity, VideoFileEntity> file = fileJoin(root);
            Subquery<Long> completed = query.subquery(Long.class);
            Root<EnrichmentJobEntity> job = completed.from(EnrichmentJobEntity.class);
            completed.select(job.get("id"))
                    .where(cb.equal(job.get("file"), file),
                            cb.equal(job.get("status"), JobStatus.COMPLETE));
            return cb.and(cb.isNull(file.get("deletedAt")), cb.exists(completed));
        };
    }

    /**
     * All metadata predicates present on the query, AND-ed with
     * {@link #searchable()}.
     */
    public static Specification<SceneEntity> matching(SceneQuery q) {
        Specification<SceneEntity> metadata = (root, query, cb) -> {
            Join<SceneEntity, VideoFileEntity> file = fileJoin(root);
            List<Predicate> predicates = new ArrayList<>();

            if (q.getTcMin() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("startTc"), q.getTcMin()));
            }
            if (q.getTcMax() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("endTc"), q.getTcMax()));
            }
            if (hasText(q.getTranscriptContains())) {
                predicates.add(containsIgnoreCase(cb, root.get("transcript"), q.getTranscriptContains()));
            }
            if (hasText(q.getPathContains())) {
                predicates.add(containsIgnoreCase(cb, file.get("path"), q.getPathContains()));
            }
            if (hasText(q.getCodec())) {
                predicates.add(containsIgnoreCase(cb, file.get("codec"), q.getCodec()));
            }
            addRange(predicates, cb, file.get("durationSeconds"), q.getDurationMin(), q.getDurationMax());
            addRange(predicates, cb, file.get("width"), q.getWidthMin(), q.getWidthMax());
            addRange(predicates, cb, file.get("height"), q.getHeightMin(), q.getHeightMax());
            addRange(predicates, cb, file.get("fps"), q.getFpsMin(), q.getFpsMax());

            return cb.and(predicates.toArray(new Predicate[0]));
        };
        return searchable().and(metadata);
    }

    @SuppressWarnings("unchecked")
    private static Join<SceneEntity, VideoFileEntity> fileJoin(Root<SceneEntity> root) {
        for (Join<SceneEntity, ?> join : root.getJoins()) {
            if ("file".equals(join.getAttribute().getName())) {
                return (Join<SceneEntity, VideoFileEntity>) join;
            }
        }
        return root.join("file");
    }

    private static <T extends Comparable<? super T>> void addRange(List<Predicate> predicates, CriteriaBuilder cb,
            Path<T> path, T min, T max) {
        if (min != null) {
            predicates.add(cb.greaterThanOrEqualTo(path, min));
        }
        if (max != null) {
            predicates.add(cb.lessThanOrEqualTo(path, max));
        }
    }

    private static Predicate containsIgnoreCase(CriteriaBuilder cb, Expression<String> expression, String value) {
        String escaped = value.toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return cb.like(cb.lower(expression), "%" + escaped + "%", '\\');
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
