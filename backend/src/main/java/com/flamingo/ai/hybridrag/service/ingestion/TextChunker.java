package com.flamingo.ai.hybridrag.service.ingestion;

import com.flamingo.ai.hybridrag.config.RagConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits plain text into overlapping, sentence-aligned chunks.
 *
 * <p>Sentences are packed until the next one would push the chunk past {@code chunkSize}. The next
 * chunk starts with as many trailing sentences of the previous one as fit in {@code chunkOverlap}.
 * A sentence longer than {@code chunkSize} is cut into fixed-size pieces first. Every chunk is an
 * exact slice of the input, so its offset locates it in the source.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextChunker {

  private static final Pattern SENTENCE = Pattern.compile("[^.!?]+(?:[.!?]+|$)");

  private final RagConfig ragConfig;

  public List<TextChunk> chunk(String text) {
    return chunk(
        text,
        ragConfig.getChunking().getChunkSize(),
        ragConfig.getChunking().getChunkOverlap());
  }

  static List<TextChunk> chunk(String text, int chunkSize, int chunkOverlap) {
    if (chunkSize <= 0 || chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new IllegalArgumentException(
          "Invalid chunking settings: size=" + chunkSize + ", overlap=" + chunkOverlap);
    }
    if (text == null || text.isBlank()) {
      return List.of();
    }

    List<Span> spans = sentenceSpans(text, chunkSize);
    List<TextChunk> chunks = new ArrayList<>();
    List<Span> current = new ArrayList<>();

    for (Span span : spans) {
      if (!current.isEmpty() && span.end() - current.get(0).start() > chunkSize) {
        chunks.add(toChunk(text, current, chunks.size()));
        current = overlapTail(current, chunkOverlap);
        while (!current.isEmpty() && span.end() - current.get(0).start() > chunkSize) {
          current.remove(0);
        }
      }
      current.add(span);
    }
    if (!current.isEmpty()) {
      chunks.add(toChunk(text, current, chunks.size()));
    }

    log.debug("Split {} chars into {} chunks", text.length(), chunks.size());
    return chunks;
  }

  private static List<Span> sentenceSpans(String text, int chunkSize) {
    List<Span> spans = new ArrayList<>();
    Matcher matcher = SENTENCE.matcher(text);
    while (matcher.find()) {
      int start = matcher.start();
      int end = matcher.end();
      while (start < end && Character.isWhitespace(text.charAt(start))) {
        start++;
      }
      while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
        end--;
      }
      for (int pieceStart = start; pieceStart < end; pieceStart += chunkSize) {
        spans.add(new Span(pieceStart, Math.min(end, pieceStart + chunkSize)));
      }
    }
    return spans;
  }

  private static List<Span> overlapTail(List<Span> spans, int chunkOverlap) {
    int end = spans.get(spans.size() - 1).end();
    int first = spans.size();
    while (first > 0 && end - spans.get(first - 1).start() <= chunkOverlap) {
      first--;
    }
    return new ArrayList<>(spans.subList(first, spans.size()));
  }

  private static TextChunk toChunk(String text, List<Span> spans, int index) {
    int start = spans.get(0).start();
    int end = spans.get(spans.size() - 1).end();
    return new TextChunk(index, start, text.substring(start, end));
  }

  private record Span(int start, int end) {}
}
