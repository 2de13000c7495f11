package com.reelindex.service.enrichment;

/**
 * One step of the per-file enrichment pipeline. Any exception fails the job
 * with the exception's message.
 */
public interface EnrichmentStage {

    /** Reported as the job's current stage. */
    String name();

    void run(EnrichmentContext context) throws Exception;
}
