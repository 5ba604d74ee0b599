package com.flamingo.ai.hybridrag.elasticsearch;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/** A bounded span of document text as stored in the chunk index. Immutable once built. */
@Value
@Builder
@With
public class DocumentChunk {

  String id;
  String documentId;
  String fileName;
  int chunkIndex;

  /** Character offset of the chunk within its source document. */
  int offset;

  String content;
  List<Float> embedding;
}
