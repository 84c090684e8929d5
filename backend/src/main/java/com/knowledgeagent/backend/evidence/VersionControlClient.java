package com.knowledgeagent.backend.evidence;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Read-only view of a version-control hosting API used by {@link EvidenceFetcher}. */
public interface VersionControlClient {

  /**
   * Lists commits reachable from {@code branch} since {@code since}, following pagination until a
   * short page.
   */
  List<CommitSummary> listCommits(RepositoryRef repository, String branch, Instant since);

  CommitDetail getCommit(RepositoryRef repository, String sha);

  BranchHead resolveHead(RepositoryRef repository, String branch);

  /**
   * Returns the decoded file content at {@code ref}, or empty when the path does not exist there.
   *
   * @throws FileFetchException if the path exists but is not a readable text file
   */
  Optional<String> fetchFileContent(RepositoryRef repository, String path, String ref);

  List<String> listRepositories(String organization);

  record RepositoryRef(String owner, String name) {

    public RepositoryRef {
      Objects.requireNonNull(owner, "owner");
      Objects.requireNonNull(name, "name");
    }

    public String fullName() {
      return owner + "/" + name;
    }
  }

  record CommitSummary(String sha, Instant timestamp) {}

  record BranchHead(String sha, Instant timestamp) {}

  record CommitDetail(
      String sha,
      String parentSha,
      String htmlUrl,
      String message,
      String author,
      String committer,
      Instant timestamp,
      List<ChangedFile> files) {

    public CommitDetail {
      files = files == null ? List.of() : List.copyOf(files);
    }
  }

  record ChangedFile(
      String filename,
      String status,
      String previousFilename,
      int additions,
      int deletions,
      int changes) {}
}
