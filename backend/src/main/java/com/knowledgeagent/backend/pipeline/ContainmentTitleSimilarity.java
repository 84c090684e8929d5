package com.knowledgeagent.backend.pipeline;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Treats titles as duplicates when, after normalization, they are equal or one contains the other.
 * Normalization lowercases, strips everything except ASCII letters, digits and whitespace, and
 * collapses whitespace.
 */
public class ContainmentTitleSimilarity implements TitleSimilarity {

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  @Override
  public boolean isDuplicate(String candidate, String existing) {
    String left = normalize(candidate);
    String right = normalize(existing);
    return left.equals(right) || left.contains(right) || right.contains(left);
  }

  static String normalize(String title) {
    if (title == null) {
      return "";
    }
    String lower = title.toLowerCase(Locale.ROOT);
    String stripped = NON_ALPHANUMERIC.matcher(lower).replaceAll("");
    return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
  }
}
