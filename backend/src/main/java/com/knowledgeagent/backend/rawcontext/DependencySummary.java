package com.knowledgeagent.backend.rawcontext;

import com.knowledgeagent.backend.evidence.ContentSizeGovernor;
import com.knowledgeagent.backend.evidence.EvidenceItem;
import com.knowledgeagent.backend.evidence.PackageManifestSummary;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Unique dependency names mapped to the versions observed across every manifest summary of a run.
 * Names are sorted; versions keep first-observed order.
 */
public record DependencySummary(
    int projectCount, Map<String, Set<String>> runtime, Map<String, Set<String>> development) {

  public static DependencySummary from(List<EvidenceItem> evidence) {
    Map<String, Set<String>> runtime = new TreeMap<>();
    Map<String, Set<String>> development = new TreeMap<>();
    int projects = 0;
    for (EvidenceItem item : evidence) {
      Object value = item.metadata().get(ContentSizeGovernor.PACKAGE_JSON_SUMMARY_KEY);
      if (!(value instanceof PackageManifestSummary summary)) {
        continue;
      }
      projects++;
      collect(summary.dependencies(), runtime);
      collect(summary.devDependencies(), development);
    }
    return new DependencySummary(
        projects, Collections.unmodifiableMap(runtime), Collections.unmodifiableMap(development));
  }

  public boolean isEmpty() {
    return projectCount == 0;
  }

  public String render() {
    return "Projects with package.json detected: "
        + projectCount
        + "\n\n"
        + format(runtime, "Runtime dependencies")
        + "\n\n"
        + format(development, "Dev dependencies");
  }

  private static void collect(Map<String, String> source, Map<String, Set<String>> target) {
    if (source == null) {
      return;
    }
    source.forEach(
        (name, version) -> target.computeIfAbsent(name, key -> new LinkedHashSet<>()).add(version));
  }

  private static String format(Map<String, Set<String>> dependencies, String title) {
    if (dependencies.isEmpty()) {
      return title + ": None";
    }
    StringBuilder builder =
        new StringBuilder(title).append(" (unique ").append(dependencies.size()).append("):");
    dependencies.forEach(
        (name, versions) ->
            builder.append("\n- ").append(name).append(": ").append(String.join(" | ", versions)));
    return builder.toString();
  }
}
