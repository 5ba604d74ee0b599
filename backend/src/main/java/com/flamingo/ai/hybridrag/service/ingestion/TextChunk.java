package com.flamingo.ai.hybridrag.service.ingestion;

/**
 * A chunk produced by {@link TextChunker}, before embedding.
 *
 * @param index sequential position within the document, 0-based
 * @param offset character offset of {@code content} in the source text
 * @param content the chunk text, an exact slice of the source text
 */
public record TextChunk(int index, int offset, String content) {}
