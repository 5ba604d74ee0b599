package com.flamingo.ai.hybridrag.service.rag.guard;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.enums.Verdict;
import com.flamingo.ai.hybridrag.service.rag.context.MergedContext;
import com.flamingo.ai.hybridrag.service.rag.retrieval.ScoredChunk;
import com.google.common.annotations.VisibleForTesting;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores how well an answer is supported by its context and decides whether it may be returned.
 *
 * <p>The composite is a weighted sum of six components. An answer is accepted only when the
 * context is non-empty, the composite reaches the threshold and the answer is not a refusal. A
 * refusal rejects regardless of the numeric score.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HallucinationGuard {

  private static final Pattern WORD = Pattern.compile("[a-z]{3,}");

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "and", "but", "for", "with", "from", "this", "that", "was", "were", "are",
          "been", "have", "has", "had", "its", "into", "than", "then", "there", "their", "they",
          "which", "what", "who", "whom", "also", "not");

  private static final double FULL_SOURCE_COUNT = 3.0;

  private final RagConfig ragConfig;

  public ConfidenceReport score(
      String answerText, MergedContext context, List<ScoredChunk> vectorHits) {
    RagConfig.Confidence settings = ragConfig.getConfidence();
    ComponentScores components = components(answerText, context, vectorHits, settings);
    double composite = composite(components, settings.getWeights());
    double threshold = settings.getThreshold();

    Verdict verdict;
    String reason;
    if (context.isEmpty()) {
      verdict = Verdict.REJECT;
      reason = "No context was retrieved for the question";
    } else if (components.rejectionPhrase() < 1.0) {
      verdict = Verdict.REJECT;
      reason = "Answer is a refusal or empty";
    } else if (composite < threshold) {
      verdict = Verdict.REJECT;
      reason =
          String.format(Locale.ROOT, "Score %.3f is below threshold %.3f", composite, threshold);
    } else {
      verdict = Verdict.ACCEPT;
      reason = String.format(Locale.ROOT, "Score %.3f meets threshold %.3f", composite, threshold);
    }

    log.debug(
        "Guard {}: score={} quality={} overlap={} rejection={} coverage={} sources={} length={}",
        verdict,
        String.format("%.3f", composite),
        String.format("%.3f", components.sourceQuality()),
        String.format("%.3f", components.textOverlap()),
        String.format("%.3f", components.rejectionPhrase()),
        String.format("%.3f", components.contextCoverage()),
        String.format("%.3f", components.sourceCount()),
        String.format("%.3f", components.answerLength()));

    return new ConfidenceReport(composite, components, verdict, reason);
  }

  private static ComponentScores components(
      String answerText,
      MergedContext context,
      List<ScoredChunk> vectorHits,
      RagConfig.Confidence settings) {
    String answer = answerText == null ? "" : answerText;
    return new ComponentScores(
        sourceQuality(context, vectorHits),
        textOverlap(answer, context.render()),
        RefusalPatterns.isRefusal(answer) ? 0.0 : 1.0,
        ratio(context.totalLength(), settings.getMinContextLength()),
        ratio(context.size(), FULL_SOURCE_COUNT),
        ratio(answer.strip().length(), settings.getMinAnswerLength()));
  }

  @VisibleForTesting
  static double composite(ComponentScores c, RagConfig.Weights w) {
    double sum =
        w.getSourceQuality() * c.sourceQuality()
            + w.getTextOverlap() * c.textOverlap()
            + w.getRejectionPhrase() * c.rejectionPhrase()
            + w.getContextCoverage() * c.contextCoverage()
            + w.getSourceCount() * c.sourceCount()
            + w.getAnswerLength() * c.answerLength();
    return clamp(sum);
  }

  /** Mean score of the vector hits that made it into the context. */
  private static double sourceQuality(MergedContext context, List<ScoredChunk> vectorHits) {
    Set<String> included = context.chunkIds();
    double total = 0.0;
    int count = 0;
    for (ScoredChunk hit : vectorHits) {
      if (included.contains(hit.chunkId())) {
        total += clamp(hit.score());
        count++;
      }
    }
    return count == 0 ? 0.0 : total / count;
  }

  /** Share of the answer's content words that also occur in the context. */
  @VisibleForTesting
  static double textOverlap(String answer, String context) {
    Set<String> answerWords = contentWords(answer);
    if (answerWords.isEmpty()) {
      return 0.0;
    }
    Set<String> contextWords = contentWords(context);
    long grounded = answerWords.stream().filter(contextWords::contains).count();
    return (double) grounded / answerWords.size();
  }

  @VisibleForTesting
  static Set<String> contentWords(String text) {
    Set<String> words = new HashSet<>();
    Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String word = matcher.group();
      if (!STOP_WORDS.contains(word)) {
        words.add(word);
      }
    }
    return words;
  }

  private static double ratio(double value, double full) {
    if (full <= 0) {
      return 1.0;
    }
    return clamp(value / full);
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
