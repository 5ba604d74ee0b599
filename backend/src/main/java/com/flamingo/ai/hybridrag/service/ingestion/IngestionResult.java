package com.flamingo.ai.hybridrag.service.ingestion;

/**
 * Summary of one ingested document.
 *
 * @param graphWritten false when the graph write failed and only the vector index was updated
 */
public record IngestionResult(
    String documentId,
    String fileName,
    int chunkCount,
    int entityCount,
    int relationCount,
    boolean graphWritten) {}
