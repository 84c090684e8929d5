package com.knowledgeagent.backend.rawcontext;

import com.knowledgeagent.backend.evidence.EvidenceItem;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Derives themes from top-level path segments and workflows from well-known file locations. */
public class PathThemeInference implements ThemeInference {

  private static final String ROOT_SEGMENT = "(root)";

  private final int maxItems;

  public PathThemeInference(int maxItems) {
    if (maxItems <= 0) {
      throw new IllegalArgumentException("maxItems must be positive");
    }
    this.maxItems = maxItems;
  }

  @Override
  public ThemeSummary infer(List<EvidenceItem> evidence) {
    Map<String, Integer> segments = new LinkedHashMap<>();
    Map<String, Integer> workflows = new LinkedHashMap<>();
    for (EvidenceItem item : evidence) {
      segments.merge(topSegment(item.identifier()), 1, Integer::sum);
      String workflow = workflowFor(item.identifier());
      if (workflow != null) {
        workflows.merge(workflow, 1, Integer::sum);
      }
    }
    return new ThemeSummary(mostFrequent(segments), mostFrequent(workflows));
  }

  static String topSegment(String path) {
    int slash = path.indexOf('/');
    return slash > 0 ? path.substring(0, slash) : ROOT_SEGMENT;
  }

  static String workflowFor(String path) {
    String lower = path.toLowerCase(Locale.ROOT);
    String fileName = lower.substring(lower.lastIndexOf('/') + 1);
    if (fileName.equals("package.json")
        || fileName.endsWith(".lock")
        || fileName.equals("package-lock.json")
        || fileName.equals("pnpm-lock.yaml")
        || fileName.equals("pom.xml")
        || fileName.startsWith("build.gradle")) {
      return "Dependency management";
    }
    if (lower.startsWith(".github/workflows/")
        || fileName.equals("jenkinsfile")
        || fileName.equals(".gitlab-ci.yml")) {
      return "CI/CD pipeline";
    }
    if (fileName.startsWith("dockerfile") || fileName.startsWith("docker-compose")) {
      return "Container builds";
    }
    if (lower.contains("migration")) {
      return "Database migrations";
    }
    if (lower.contains("/test/")
        || lower.contains("/tests/")
        || lower.contains("__tests__")
        || fileName.contains(".test.")
        || fileName.contains(".spec.")) {
      return "Testing";
    }
    if (lower.startsWith("docs/") || fileName.endsWith(".md")) {
      return "Documentation";
    }
    return null;
  }

  private List<String> mostFrequent(Map<String, Integer> counts) {
    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
        .limit(maxItems)
        .map(Map.Entry::getKey)
        .toList();
  }
}
