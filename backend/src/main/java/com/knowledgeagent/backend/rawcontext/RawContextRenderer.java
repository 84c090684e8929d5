package com.knowledgeagent.backend.rawcontext;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.knowledgeagent.backend.evidence.ChangeType;
import com.knowledgeagent.backend.evidence.EvidenceItem;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Serializes evidence into the raw context markdown document. Output depends only on the input:
 * groups keep first-appearance order and metadata is written with sorted keys.
 */
@Component
public class RawContextRenderer {

  static final String TITLE = "# Raw Context – Consolidated Changes";
  static final String SEPARATOR = "---";

  private final ObjectMapper objectMapper;

  public RawContextRenderer(ObjectMapper objectMapper) {
    this.objectMapper =
        Objects.requireNonNull(objectMapper, "objectMapper")
            .copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.INDENT_OUTPUT, false);
  }

  public String render(RenderInput input) {
    Objects.requireNonNull(input, "input");
    List<String> lines = new ArrayList<>();

    lines.add(SEPARATOR);
    lines.add("phaseState: " + toJson(input.phaseState()));
    lines.add(SEPARATOR);
    lines.add("");
    lines.add(TITLE);
    lines.add("");
    lines.add("Generated: " + input.generatedAt());
    lines.add("Change Period: " + input.changePeriod());
    lines.add("Selected Sources:");
    input.selectedSources().forEach(source -> lines.add("- " + source));
    lines.add("");

    appendExecutiveSummary(lines, input);
    if (input.dependencySummary() != null && !input.dependencySummary().isEmpty()) {
      appendSeparator(lines);
      lines.add("## Dependency Summary");
      lines.add("");
      lines.add(input.dependencySummary().render());
      lines.add("");
    }
    appendChangesBySource(lines, input.evidence());
    appendChangesByType(lines, input.evidence());
    appendDetailedEvidence(lines, input.evidence());
    lines.add("");
    return String.join("\n", lines);
  }

  private void appendExecutiveSummary(List<String> lines, RenderInput input) {
    appendSeparator(lines);
    lines.add("## Executive Summary");
    lines.add("- Total Changes Analyzed: " + input.evidence().size());
    lines.add("- Primary Themes: " + joinOrNone(input.themes().themes()));
    lines.add("- Affected Workflows: " + joinOrNone(input.themes().workflows()));
    lines.add("");
  }

  private void appendChangesBySource(List<String> lines, List<EvidenceItem> evidence) {
    appendSeparator(lines);
    lines.add("## Changes by Source");
    Map<String, List<EvidenceItem>> bySource = new LinkedHashMap<>();
    for (EvidenceItem item : evidence) {
      bySource.computeIfAbsent(item.sourceName(), key -> new ArrayList<>()).add(item);
    }
    bySource.forEach(
        (source, items) -> {
          lines.add("");
          lines.add("### %s (%s)".formatted(source, items.get(0).sourceType().displayName()));
          lines.add("- Summary:");
          lines.add(
              "  - Added: %d | Modified: %d | Deleted: %d | Renamed: %d"
                  .formatted(
                      count(items, ChangeType.ADDED),
                      count(items, ChangeType.MODIFIED),
                      count(items, ChangeType.DELETED),
                      count(items, ChangeType.RENAMED)));
          lines.add("");
          lines.add("#### Evidence");
          for (EvidenceItem item : items) {
            lines.add(
                "- [%s] %s — %s @ %s"
                    .formatted(
                        item.id(),
                        item.changeType().token().toUpperCase(Locale.ROOT),
                        item.identifier(),
                        item.timestamp()));
            lines.add("");
            appendFenced(lines, "diff", item.snippet());
            lines.add("");
          }
        });
    lines.add("");
  }

  private void appendChangesByType(List<String> lines, List<EvidenceItem> evidence) {
    appendSeparator(lines);
    lines.add("## Changes by Type");
    Map<ChangeType, List<EvidenceItem>> byType = new EnumMap<>(ChangeType.class);
    for (EvidenceItem item : evidence) {
      byType.computeIfAbsent(item.changeType(), key -> new ArrayList<>()).add(item);
    }
    for (ChangeType type : ChangeType.values()) {
      lines.add("");
      lines.add("### " + capitalize(type.token()));
      for (EvidenceItem item : byType.getOrDefault(type, List.of())) {
        lines.add("- [%s] %s — %s".formatted(item.id(), item.sourceName(), item.identifier()));
      }
    }
    lines.add("");
  }

  private void appendDetailedEvidence(List<String> lines, List<EvidenceItem> evidence) {
    appendSeparator(lines);
    lines.add("## Detailed Evidence");
    for (EvidenceItem item : evidence) {
      lines.add("");
      lines.add("### [%s] %s — %s".formatted(item.id(), item.sourceName(), item.changeType().token()));
      lines.add("Metadata: " + toJson(item.metadata()));
      lines.add("Timestamp: " + item.timestamp());
      lines.add("");
      appendFenced(lines, "text", item.snippet());
    }
  }

  private static void appendSeparator(List<String> lines) {
    lines.add(SEPARATOR);
    lines.add("");
  }

  private static void appendFenced(List<String> lines, String language, String snippet) {
    String body = snippet == null ? "" : snippet;
    String fence = body.contains("```") ? "````" : "```";
    lines.add(fence + language);
    lines.add(body);
    lines.add(fence);
  }

  private static long count(List<EvidenceItem> items, ChangeType type) {
    return items.stream().filter(item -> item.changeType() == type).count();
  }

  private static String joinOrNone(List<String> values) {
    return values.isEmpty() ? "None" : String.join(", ", values);
  }

  private static String capitalize(String value) {
    return Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialize raw context metadata", ex);
    }
  }
}
