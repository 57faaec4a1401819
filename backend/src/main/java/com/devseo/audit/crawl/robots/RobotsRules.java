package com.devseo.audit.crawl.robots;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class RobotsRules {
  private final List<Rule> rules;

  public RobotsRules(List<Rule> rules) {
    this.rules = rules;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of());
  }

  public boolean isAllowAll() {
    return rules.isEmpty();
  }

  public boolean isAllowed(String pathAndQuery) {
    if (rules.isEmpty()) {
      return true;
    }

    Rule bestMatch = null;
    int bestMatchLength = -1;
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    for (Rule rule : rules) {
      if (!rule.matches(subject)) {
        continue;
      }
      int length = rule.path().length();
      if (length > bestMatchLength) {
        bestMatch = rule;
        bestMatchLength = length;
      } else if (length == bestMatchLength
          && bestMatch != null
          && rule.allow()
          && !bestMatch.allow()) {
        bestMatch = rule;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  public static RobotsRules parse(String robotsText) {
    return parse(robotsText, null);
  }

  /**
   * Groups naming {@code userAgent} (matched on the product token, case-insensitive) replace the
   * wildcard group entirely; otherwise the {@code *} group applies.
   */
  public static RobotsRules parse(String robotsText, String userAgent) {
    if (robotsText == null || robotsText.isBlank()) {
      return allowAll();
    }
    String token = productToken(userAgent);

    List<Rule> wildcardRules = new ArrayList<>();
    List<Rule> agentRules = new ArrayList<>();
    boolean agentGroupSeen = false;

    List<String> currentAgents = new ArrayList<>();
    boolean currentGroupWildcard = false;
    boolean currentGroupAgent = false;
    boolean lastDirectiveWasUserAgent = false;

    String[] lines = robotsText.split("\\R");
    for (String rawLine : lines) {
      String line = stripComment(rawLine).trim();
      if (line.isEmpty()) {
        continue;
      }
      int colonIdx = line.indexOf(':');
      if (colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent) {
          currentAgents.clear();
        }
        currentAgents.add(value.toLowerCase(Locale.ROOT));
        currentGroupWildcard = currentAgents.stream().anyMatch("*"::equals);
        currentGroupAgent = token != null && currentAgents.stream().anyMatch(token::equals);
        agentGroupSeen = agentGroupSeen || currentGroupAgent;
        lastDirectiveWasUserAgent = true;
        continue;
      }

      lastDirectiveWasUserAgent = false;
      if (!("allow".equals(key) || "disallow".equals(key)) || value.isBlank()) {
        continue;
      }
      Rule rule = new Rule(value, "allow".equals(key));
      if (currentGroupAgent) {
        agentRules.add(rule);
      }
      if (currentGroupWildcard) {
        wildcardRules.add(rule);
      }
    }

    return new RobotsRules(agentGroupSeen ? agentRules : wildcardRules);
  }

  private static String productToken(String userAgent) {
    if (userAgent == null || userAgent.isBlank()) {
      return null;
    }
    String trimmed = userAgent.trim();
    int end = trimmed.length();
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c == '/' || Character.isWhitespace(c)) {
        end = i;
        break;
      }
    }
    String token = trimmed.substring(0, end).toLowerCase(Locale.ROOT);
    return token.isEmpty() ? null : token;
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String normalizedPath = path.startsWith("/") ? path : "/" + path;
      if (!normalizedPath.contains("*") && !normalizedPath.contains("$")) {
        return testPath.startsWith(normalizedPath);
      }
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < normalizedPath.length(); i++) {
        char c = normalizedPath.charAt(i);
        if (c == '*') {
          regex.append(".*");
        } else if (c == '$') {
          regex.append("$");
        } else {
          regex.append(Pattern.quote(Character.toString(c)));
        }
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
