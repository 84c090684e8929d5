package com.knowledgeagent.backend.evidence;

import com.knowledgeagent.backend.evidence.VersionControlClient.BranchHead;
import com.knowledgeagent.backend.evidence.VersionControlClient.ChangedFile;
import com.knowledgeagent.backend.evidence.VersionControlClient.CommitDetail;
import com.knowledgeagent.backend.evidence.VersionControlClient.CommitSummary;
import com.knowledgeagent.backend.evidence.VersionControlClient.RepositoryRef;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Walks repository history and produces one {@link EvidenceItem} per observed file change. Each
 * branch combines its date-range, commit-selection and file-selection options, in that order.
 */
@Service
public class EvidenceFetcher {

  private static final Logger log = LoggerFactory.getLogger(EvidenceFetcher.class);

  private final VersionControlClient client;
  private final ContentSizeGovernor governor;
  private final DiffRenderer diffRenderer;
  private final Timer fetchTimer;
  private final Counter itemCounter;
  private final Counter skippedFileCounter;

  public EvidenceFetcher(
      VersionControlClient client,
      ContentSizeGovernor governor,
      DiffRenderer diffRenderer,
      @Nullable MeterRegistry meterRegistry) {
    this.client = Objects.requireNonNull(client, "client");
    this.governor = Objects.requireNonNull(governor, "governor");
    this.diffRenderer = Objects.requireNonNull(diffRenderer, "diffRenderer");
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.fetchTimer = registry.timer("knowledge_evidence_fetch_duration");
    this.itemCounter = registry.counter("knowledge_evidence_items_total");
    this.skippedFileCounter = registry.counter("knowledge_evidence_file_skipped_total");
  }

  public List<EvidenceItem> fetch(GitHubSource source, ContentSizePolicy policy) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(policy, "policy");
    List<EvidenceItem> items = new ArrayList<>();
    Set<String> seenIds = new HashSet<>();
    for (String repo : resolveRepositories(source)) {
      RepositoryRef repository = new RepositoryRef(source.org(), repo);
      for (String branch : source.branches()) {
        Instant startedAt = Instant.now();
        BranchScope scope = new BranchScope(repository, branch, source, policy, seenIds);
        List<EvidenceItem> branchItems = fetchBranch(scope);
        fetchTimer.record(Duration.between(startedAt, Instant.now()));
        itemCounter.increment(branchItems.size());
        log.info(
            "Collected {} evidence items from {} ({})",
            branchItems.size(),
            repository.fullName(),
            branch);
        items.addAll(branchItems);
      }
    }
    return items;
  }

  List<String> resolveRepositories(GitHubSource source) {
    if (!source.repos().contains(GitHubSource.ALL_REPOSITORIES)) {
      return source.repos();
    }
    List<String> repositories = client.listRepositories(source.org());
    log.info("Expanded wildcard repository selection for {} to {} repos", source.org(), repositories.size());
    return repositories;
  }

  private List<EvidenceItem> fetchBranch(BranchScope scope) {
    List<EvidenceItem> items = new ArrayList<>();
    Set<String> processedCommits = new HashSet<>();
    for (ContextOption option : scope.source().contextOptions()) {
      if (option.mode() == ContextMode.DATE_RANGE) {
        items.addAll(fetchDateRange(scope, option, processedCommits));
      }
    }
    for (ContextOption option : scope.source().contextOptions()) {
      if (option.mode() == ContextMode.COMMIT_SELECTION) {
        items.addAll(fetchSelectedCommits(scope, option, processedCommits));
      }
    }
    BranchHead head = null;
    for (ContextOption option : scope.source().contextOptions()) {
      if (option.mode() == ContextMode.FILE_SELECTION) {
        if (head == null) {
          head = client.resolveHead(scope.repository(), scope.branch());
        }
        items.addAll(fetchSelectedFiles(scope, option, head));
      }
    }
    return items;
  }

  private List<EvidenceItem> fetchDateRange(
      BranchScope scope, ContextOption option, Set<String> processedCommits) {
    if (option.sinceDate() == null) {
      throw new IllegalArgumentException("date-range option requires sinceDate");
    }
    Instant since = option.sinceDate().atStartOfDay(ZoneOffset.UTC).toInstant();
    List<CommitSummary> commits = client.listCommits(scope.repository(), scope.branch(), since);
    log.debug(
        "Found {} commits on {} ({}) since {}",
        commits.size(),
        scope.repository().fullName(),
        scope.branch(),
        since);
    List<EvidenceItem> items = new ArrayList<>();
    for (CommitSummary commit : commits) {
      if (processedCommits.add(commit.sha())) {
        items.addAll(processCommit(scope, client.getCommit(scope.repository(), commit.sha())));
      }
    }
    return items;
  }

  private List<EvidenceItem> fetchSelectedCommits(
      BranchScope scope, ContextOption option, Set<String> processedCommits) {
    List<EvidenceItem> items = new ArrayList<>();
    for (String sha : option.selectedCommits()) {
      if (!StringUtils.hasText(sha) || !processedCommits.add(sha.trim())) {
        continue;
      }
      items.addAll(processCommit(scope, client.getCommit(scope.repository(), sha.trim())));
    }
    return items;
  }

  private List<EvidenceItem> processCommit(BranchScope scope, CommitDetail commit) {
    List<EvidenceItem> items = new ArrayList<>();
    String timestamp = isoTimestamp(commit.timestamp());
    for (ChangedFile file : commit.files()) {
      if (scope.source().isExcluded(file.filename())) {
        continue;
      }
      String id =
          "%s:%s:%s:%s"
              .formatted(scope.repository().fullName(), scope.branch(), commit.sha(), file.filename());
      if (!scope.seenIds().add(id)) {
        log.debug("Skipping duplicate evidence {}", id);
        continue;
      }
      ChangeType changeType = ChangeType.fromStatus(file.status());
      String newText =
          changeType == ChangeType.DELETED
              ? ""
              : readBlob(scope.repository(), file.filename(), commit.sha());
      String oldPath =
          StringUtils.hasText(file.previousFilename()) ? file.previousFilename() : file.filename();
      String oldText =
          changeType == ChangeType.ADDED || commit.parentSha() == null
              ? ""
              : readBlob(scope.repository(), oldPath, commit.parentSha());

      GovernedContent governed = governor.govern(file.filename(), newText, scope.policy());
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("commitSha", commit.sha());
      putIfPresent(metadata, "parentSha", commit.parentSha());
      putIfPresent(metadata, "status", file.status());
      putIfPresent(metadata, "previousFilename", file.previousFilename());
      metadata.put("additions", file.additions());
      metadata.put("deletions", file.deletions());
      metadata.put("changes", file.changes());
      putIfPresent(metadata, "commitUrl", commit.htmlUrl());
      putIfPresent(metadata, "message", commit.message());
      putIfPresent(metadata, "author", commit.author());
      putIfPresent(metadata, "committer", commit.committer());
      metadata.putAll(governed.metadata());

      String body = changeType == ChangeType.DELETED ? "" : governed.snippet();
      items.add(
          new EvidenceItem(
              id,
              SourceType.GITHUB,
              scope.sourceName(),
              changeType,
              file.filename(),
              timestamp,
              metadata,
              diffRenderer.render(file.filename(), oldText, body)));
    }
    return items;
  }

  private List<EvidenceItem> fetchSelectedFiles(
      BranchScope scope, ContextOption option, BranchHead head) {
    List<EvidenceItem> items = new ArrayList<>();
    String timestamp = isoTimestamp(head.timestamp());
    for (String path : option.selectedPaths()) {
      if (!StringUtils.hasText(path) || scope.source().isExcluded(path)) {
        continue;
      }
      String id =
          "%s:%s:file@%s:%s".formatted(scope.repository().fullName(), scope.branch(), head.sha(), path);
      if (scope.seenIds().contains(id)) {
        continue;
      }
      Optional<String> content;
      try {
        content = client.fetchFileContent(scope.repository(), path, head.sha());
      } catch (FileFetchException ex) {
        skippedFileCounter.increment();
        log.warn(
            "Skipping {} in {} ({}): {}",
            path,
            scope.repository().fullName(),
            scope.branch(),
            ex.getMessage());
        continue;
      }
      if (content.isEmpty()) {
        skippedFileCounter.increment();
        log.warn("Skipping {} in {} ({}): not found", path, scope.repository().fullName(), scope.branch());
        continue;
      }
      scope.seenIds().add(id);
      GovernedContent governed = governor.govern(path, content.get(), scope.policy());
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("headSha", head.sha());
      metadata.put("selection", ContextMode.FILE_SELECTION.token());
      metadata.putAll(governed.metadata());
      items.add(
          new EvidenceItem(
              id,
              SourceType.GITHUB,
              scope.sourceName(),
              ChangeType.OTHER,
              path,
              timestamp,
              metadata,
              diffRenderer.render(path, "", governed.snippet())));
    }
    return items;
  }

  private String readBlob(RepositoryRef repository, String path, String ref) {
    try {
      return client.fetchFileContent(repository, path, ref).orElse("");
    } catch (FileFetchException ex) {
      log.warn("Unable to read {}@{} in {}: {}", path, ref, repository.fullName(), ex.getMessage());
      return "";
    }
  }

  private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
    if (value != null) {
      metadata.put(key, value);
    }
  }

  private static String isoTimestamp(Instant instant) {
    return (instant != null ? instant : Instant.now()).toString();
  }

  private record BranchScope(
      RepositoryRef repository,
      String branch,
      GitHubSource source,
      ContentSizePolicy policy,
      Set<String> seenIds) {

    String sourceName() {
      return "%s (%s)".formatted(repository.fullName(), branch);
    }
  }
}
