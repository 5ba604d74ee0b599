package com.flamingo.ai.hybridrag.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Name detection and normalization shared by ingestion and query-time entity lookup. */
public final class EntityNames {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** Runs of capitalized words, such as "John Smith" or "Tech Corp". */
  public static final String CAPITALIZED_SPAN_REGEX = "[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*";

  private static final Pattern CAPITALIZED_SPAN =
      Pattern.compile("\\b" + CAPITALIZED_SPAN_REGEX + "\\b");

  // Capitalized only because they open a sentence or a question
  private static final Set<String> LEADING_WORDS =
      Set.of(
          "A", "An", "And", "Are", "But", "Can", "Could", "Describe", "Did", "Do", "Does",
          "Explain", "For", "From", "He", "How", "If", "In", "Is", "It", "List", "Of", "On", "She",
          "Should", "Tell", "The", "Their", "There", "They", "This", "What", "When", "Where",
          "Which", "Who", "Whom", "Whose", "Why", "Was", "We", "Were", "Would");

  private EntityNames() {}

  public static String normalize(String name) {
    if (name == null) {
      return "";
    }
    return WHITESPACE.matcher(name.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
  }

  /** Capitalized spans in text order, without leading function words, longer than two chars. */
  public static List<String> capitalizedSpans(String text) {
    List<String> spans = new ArrayList<>();
    Matcher matcher = CAPITALIZED_SPAN.matcher(text);
    while (matcher.find()) {
      String span = stripLeadingWords(matcher.group());
      if (span.length() > 2) {
        spans.add(span);
      }
    }
    return spans;
  }

  /** Drops sentence-opening function words, returns "" when nothing else remains. */
  public static String stripLeadingWords(String span) {
    String[] words = WHITESPACE.split(span.strip());
    int start = 0;
    while (start < words.length && LEADING_WORDS.contains(words[start])) {
      start++;
    }
    return String.join(" ", Arrays.copyOfRange(words, start, words.length));
  }
}
