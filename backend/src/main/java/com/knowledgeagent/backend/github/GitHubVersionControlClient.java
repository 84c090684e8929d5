package com.knowledgeagent.backend.github;

import com.knowledgeagent.backend.config.GitHubBackendProperties;
import com.knowledgeagent.backend.evidence.FileFetchException;
import com.knowledgeagent.backend.evidence.SourceFetchException;
import com.knowledgeagent.backend.evidence.VersionControlClient;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.kohsuke.github.GHBranch;
import org.kohsuke.github.GHCommit;
import org.kohsuke.github.GHContent;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** {@link VersionControlClient} backed by the GitHub REST API through {@code github-api}. */
@Component
class GitHubVersionControlClient implements VersionControlClient {

  private static final Logger log = LoggerFactory.getLogger(GitHubVersionControlClient.class);

  private final GitHubClientExecutor executor;
  private final GitHubBackendProperties properties;

  GitHubVersionControlClient(GitHubClientExecutor executor, GitHubBackendProperties properties) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public List<CommitSummary> listCommits(RepositoryRef repository, String branch, Instant since) {
    int pageSize = properties.getCommitPageSize() != null ? properties.getCommitPageSize() : 100;
    try {
      return executor.execute(
          github -> {
            GHRepository repo = github.getRepository(repository.fullName());
            List<CommitSummary> commits = new ArrayList<>();
            for (GHCommit commit :
                repo.queryCommits().from(branch).since(Date.from(since)).pageSize(pageSize).list()) {
              commits.add(new CommitSummary(commit.getSHA1(), toInstant(commit.getCommitDate())));
            }
            return commits;
          });
    } catch (GitHubClientException ex) {
      throw new SourceFetchException(
          repository.fullName(),
          "Failed to list commits for %s (%s)".formatted(repository.fullName(), branch),
          ex);
    }
  }

  @Override
  public CommitDetail getCommit(RepositoryRef repository, String sha) {
    try {
      return executor.execute(
          github -> {
            GHCommit commit = github.getRepository(repository.fullName()).getCommit(sha);
            List<String> parents = commit.getParentSHA1s();
            GHCommit.ShortInfo info = commit.getCommitShortInfo();
            List<ChangedFile> files = new ArrayList<>();
            for (GHCommit.File file : commit.getFiles()) {
              files.add(
                  new ChangedFile(
                      file.getFileName(),
                      file.getStatus(),
                      file.getPreviousFilename(),
                      file.getLinesAdded(),
                      file.getLinesDeleted(),
                      file.getLinesChanged()));
            }
            return new CommitDetail(
                commit.getSHA1(),
                parents == null || parents.isEmpty() ? null : parents.get(0),
                commit.getHtmlUrl() != null ? commit.getHtmlUrl().toString() : null,
                info != null ? info.getMessage() : null,
                info != null ? userName(info.getAuthor()) : null,
                info != null ? userName(info.getCommitter()) : null,
                toInstant(commit.getCommitDate()),
                files);
          });
    } catch (GitHubClientException ex) {
      throw new SourceFetchException(
          repository.fullName(),
          "Failed to fetch commit %s of %s".formatted(sha, repository.fullName()),
          ex);
    }
  }

  @Override
  public BranchHead resolveHead(RepositoryRef repository, String branch) {
    try {
      return executor.execute(
          github -> {
            GHRepository repo = github.getRepository(repository.fullName());
            GHBranch ghBranch = repo.getBranch(branch);
            String sha = ghBranch.getSHA1();
            return new BranchHead(sha, toInstant(repo.getCommit(sha).getCommitDate()));
          });
    } catch (GitHubClientException ex) {
      throw new SourceFetchException(
          repository.fullName(),
          "Failed to resolve branch %s of %s".formatted(branch, repository.fullName()),
          ex);
    }
  }

  @Override
  public Optional<String> fetchFileContent(RepositoryRef repository, String path, String ref) {
    try {
      return executor.execute(
          github -> {
            GHContent content;
            try {
              content = github.getRepository(repository.fullName()).getFileContent(path, ref);
            } catch (GHFileNotFoundException ex) {
              log.debug("{} not found at {} in {}", path, ref, repository.fullName());
              return Optional.empty();
            }
            if (content.isDirectory()) {
              throw new FileFetchException("%s is a directory".formatted(path));
            }
            String text = decodeUtf8(readContent(content));
            if (text == null) {
              throw new FileFetchException("%s is not valid UTF-8 text".formatted(path));
            }
            return Optional.of(text);
          });
    } catch (GitHubClientException ex) {
      throw new FileFetchException(
          "Failed to fetch %s@%s from %s".formatted(path, ref, repository.fullName()), ex);
    }
  }

  @Override
  public List<String> listRepositories(String organization) {
    try {
      return executor.execute(
          github -> {
            List<String> names = new ArrayList<>();
            for (GHRepository repo : github.getOrganization(organization).listRepositories(100)) {
              names.add(repo.getName());
            }
            names.sort(Comparator.naturalOrder());
            return names;
          });
    } catch (GitHubClientException ex) {
      throw new SourceFetchException(
          organization, "Failed to list repositories of %s".formatted(organization), ex);
    }
  }

  private byte[] readContent(GHContent content) throws IOException {
    try (var stream = content.read()) {
      byte[] bytes = stream.readAllBytes();
      if (bytes.length > 0) {
        return bytes;
      }
    }
    String payload = content.getContent();
    if (!StringUtils.hasText(payload)) {
      return new byte[0];
    }
    if ("base64".equalsIgnoreCase(content.getEncoding())) {
      return Base64.getMimeDecoder().decode(payload);
    }
    return payload.getBytes(StandardCharsets.UTF_8);
  }

  private String decodeUtf8(byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      return "";
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder();
    decoder.onMalformedInput(CodingErrorAction.REPORT);
    decoder.onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    } catch (CharacterCodingException ex) {
      log.debug("File content is not valid UTF-8: {}", ex.getMessage());
      return null;
    }
  }

  private static String userName(GitUser user) {
    if (user == null) {
      return null;
    }
    return StringUtils.hasText(user.getName()) ? user.getName() : user.getEmail();
  }

  private static Instant toInstant(Date date) {
    return date != null ? date.toInstant() : null;
  }
}
