package com.knowledgeagent.backend.rawcontext;

import com.knowledgeagent.backend.config.KnowledgePipelineProperties;
import com.knowledgeagent.backend.evidence.ContentSizePolicy;
import com.knowledgeagent.backend.evidence.ContextMode;
import com.knowledgeagent.backend.evidence.ContextOption;
import com.knowledgeagent.backend.evidence.EvidenceFetcher;
import com.knowledgeagent.backend.evidence.EvidenceItem;
import com.knowledgeagent.backend.evidence.GitHubSource;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Collects evidence for every requested source and renders the raw context document. */
@Service
public class RawContextService {

  private static final Logger log = LoggerFactory.getLogger(RawContextService.class);

  private final EvidenceFetcher evidenceFetcher;
  private final RawContextRenderer renderer;
  private final ThemeInference themeInference;
  private final KnowledgePipelineProperties properties;

  public RawContextService(
      EvidenceFetcher evidenceFetcher,
      RawContextRenderer renderer,
      ThemeInference themeInference,
      KnowledgePipelineProperties properties) {
    this.evidenceFetcher = Objects.requireNonNull(evidenceFetcher, "evidenceFetcher");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.themeInference = Objects.requireNonNull(themeInference, "themeInference");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public RawContextDocument build(RawContextRequest request) {
    Objects.requireNonNull(request, "request");
    if (request.sources().isEmpty()) {
      throw new IllegalArgumentException("At least one source is required");
    }
    String generatedAt = Instant.now().toString();
    ContentSizePolicy defaults = properties.getGovernor().toPolicy();

    List<EvidenceItem> evidence = new ArrayList<>();
    List<String> selectedSources = new ArrayList<>();
    for (GitHubSource source : request.sources()) {
      evidence.addAll(evidenceFetcher.fetch(source, defaults.withOverrides(source.sizePolicy())));
      selectedSources.add(describe(source));
    }

    DependencySummary dependencySummary = DependencySummary.from(evidence);
    ThemeSummary themes = evidence.isEmpty() ? ThemeSummary.empty() : themeInference.infer(evidence);

    String fileName = fileName(request);
    String filePath = properties.getOutput().getRawContextDirectory() + "/" + fileName;
    PhaseState phaseState =
        PhaseState.awaitingApproval(
            request,
            List.of(new PhaseState.Artifact(fileName, "text", "Raw Context", filePath)),
            generatedAt);

    String content =
        renderer.render(
            new RenderInput(
                phaseState,
                generatedAt,
                changePeriod(request),
                selectedSources,
                evidence,
                themes,
                dependencySummary));
    log.info(
        "Rendered raw context {} with {} evidence items ({} chars)",
        fileName,
        evidence.size(),
        content.length());
    return new RawContextDocument(
        fileName, filePath, content, evidence.size(), themes.themes(), themes.workflows());
  }

  static String fileName(RawContextRequest request) {
    Set<String> modes = new LinkedHashSet<>();
    request.sources().forEach(source -> source.contextOptions().forEach(o -> modes.add(o.mode().token())));
    String dateSuffix =
        earliestSinceDate(request)
            .map(date -> date.format(DateTimeFormatter.BASIC_ISO_DATE))
            .orElse("NOW");
    return "raw-context-Github-%s-%s.md".formatted(String.join("-", modes), dateSuffix);
  }

  static String changePeriod(RawContextRequest request) {
    return earliestSinceDate(request)
        .map(date -> "since " + date)
        .orElse("selected files and commits");
  }

  private static Optional<LocalDate> earliestSinceDate(RawContextRequest request) {
    return request.sources().stream()
        .flatMap(source -> source.contextOptions().stream())
        .filter(option -> option.mode() == ContextMode.DATE_RANGE)
        .map(ContextOption::sinceDate)
        .filter(Objects::nonNull)
        .min(Comparator.naturalOrder());
  }

  private static String describe(GitHubSource source) {
    String modes =
        source.contextOptions().stream()
            .map(RawContextService::describe)
            .collect(Collectors.joining(", "));
    return "Github (organization): %s; repos: [%s]; branches: [%s]; modes: [%s]"
        .formatted(
            source.org(), String.join(", ", source.repos()), String.join(", ", source.branches()), modes);
  }

  private static String describe(ContextOption option) {
    return switch (option.mode()) {
      case DATE_RANGE -> "date-range since " + option.sinceDate();
      case FILE_SELECTION -> "file-selection (%d paths)".formatted(option.selectedPaths().size());
      case COMMIT_SELECTION -> "commit-selection (%d commits)".formatted(option.selectedCommits().size());
    };
  }
}
