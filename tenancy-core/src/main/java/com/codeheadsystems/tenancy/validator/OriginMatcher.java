package com.codeheadsystems.tenancy.validator;

import java.util.List;

/**
 * Matches a token's {@code azp} claim against permitted origin patterns.
 * <p>
 * A pattern is either an exact origin ({@code https://app.example.com:8443}) or contains
 * {@code *}, which stands for one or more characters other than {@code .}. Patterns and origins
 * are compared label by label after splitting on {@code .}, so a wildcard can never span a dot:
 * {@code https://*.example.com} matches {@code https://sub.example.com} but neither
 * {@code https://example.com} nor {@code https://a.b.example.com}. Matching is case-sensitive and
 * any port suffix is compared literally.
 */
public final class OriginMatcher {

  private static final char WILDCARD = '*';

  private OriginMatcher() {
  }

  /**
   * Decides whether {@code azp} is permitted.
   * <p>
   * An empty or null pattern list places no restriction and always matches. With patterns
   * configured, a missing {@code azp} never matches.
   *
   * @param azp      authorized party from the token, may be null
   * @param patterns permitted origin patterns, may be null
   * @return true if no patterns are configured or any pattern matches
   */
  public static boolean matchOrigin(String azp, List<String> patterns) {
    if (patterns == null || patterns.isEmpty()) {
      return true;
    }
    if (azp == null || azp.isEmpty()) {
      return false;
    }
    for (String pattern : patterns) {
      if (pattern.equals(azp)) {
        return true;
      }
      if (pattern.indexOf(WILDCARD) >= 0 && wildcardMatches(pattern, azp)) {
        return true;
      }
    }
    return false;
  }

  private static boolean wildcardMatches(String pattern, String origin) {
    String[] patternLabels = pattern.split("\\.", -1);
    String[] originLabels = origin.split("\\.", -1);
    if (patternLabels.length != originLabels.length) {
      return false;
    }
    for (int i = 0; i < patternLabels.length; i++) {
      if (!labelMatches(patternLabels[i], 0, originLabels[i], 0)) {
        return false;
      }
    }
    return true;
  }

  // Labels contain no dots, so a wildcard here may consume any non-empty run of characters.
  private static boolean labelMatches(String pattern, int p, String label, int l) {
    if (p == pattern.length()) {
      return l == label.length();
    }
    char c = pattern.charAt(p);
    if (c != WILDCARD) {
      return l < label.length() && label.charAt(l) == c && labelMatches(pattern, p + 1, label, l + 1);
    }
    for (int end = l + 1; end <= label.length(); end++) {
      if (labelMatches(pattern, p + 1, label, end)) {
        return true;
      }
    }
    return false;
  }
}
