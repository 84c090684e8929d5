package com.knowledgeagent.backend.rawcontext;

import static org.assertj.core.api.Assertions.assertThat;

import com.knowledgeagent.backend.evidence.ChangeType;
import com.knowledgeagent.backend.evidence.ContentSizeGovernor;
import com.knowledgeagent.backend.evidence.EvidenceItem;
import com.knowledgeagent.backend.evidence.PackageManifestSummary;
import com.knowledgeagent.backend.evidence.SourceType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DependencySummaryTest {

  @Test
  void aggregatesVersionsAcrossManifests() {
    Map<String, String> webDeps = new LinkedHashMap<>();
    webDeps.put("react", "^18.2.0");
    webDeps.put("axios", "^1.6.0");
    List<EvidenceItem> evidence =
        List.of(
            manifest("web/package.json", webDeps, Map.of("vitest", "^1.0.0")),
            manifest("admin/package.json", Map.of("react", "^17.0.2"), null),
            new EvidenceItem("plain", SourceType.GITHUB, "acme/web (main)", ChangeType.MODIFIED, "README.md", "t", Map.of(), ""));

    DependencySummary summary = DependencySummary.from(evidence);

    assertThat(summary.projectCount()).isEqualTo(2);
    assertThat(summary.render())
        .isEqualTo(
            "Projects with package.json detected: 2\n\n"
                + "Runtime dependencies (unique 2):\n"
                + "- axios: ^1.6.0\n"
                + "- react: ^18.2.0 | ^17.0.2\n\n"
                + "Dev dependencies (unique 1):\n"
                + "- vitest: ^1.0.0");
  }

  @Test
  void emptyWhenNoManifestWasSeen() {
    DependencySummary summary = DependencySummary.from(List.of());

    assertThat(summary.isEmpty()).isTrue();
    assertThat(summary.render()).endsWith("Runtime dependencies: None\n\nDev dependencies: None");
  }

  private static EvidenceItem manifest(
      String path, Map<String, String> dependencies, Map<String, String> devDependencies) {
    PackageManifestSummary summary =
        new PackageManifestSummary(null, null, null, null, dependencies, devDependencies, null, null, null, null);
    return new EvidenceItem(
        path,
        SourceType.GITHUB,
        "acme/web (main)",
        ChangeType.MODIFIED,
        path,
        "2024-03-01T10:15:30Z",
        Map.of(ContentSizeGovernor.PACKAGE_JSON_SUMMARY_KEY, summary),
        "");
  }
}
