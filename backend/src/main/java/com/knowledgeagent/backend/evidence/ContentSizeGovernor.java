package com.knowledgeagent.backend.evidence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides how much of a file body is retained in a raw context document. Manifest files always get
 * a structured summary; lockfiles and files over the configured limits are replaced by placeholders
 * or trimmed according to {@link LargeFileStrategy}.
 */
@Component
public class ContentSizeGovernor {

  private static final Logger log = LoggerFactory.getLogger(ContentSizeGovernor.class);

  public static final String PACKAGE_JSON_SUMMARY_KEY = "packageJsonSummary";
  public static final String LOCKFILE_SUMMARY_KEY = "lockfileSummary";

  static final String EXCLUDED_PLACEHOLDER = "[Content excluded due to size policy]";
  static final String LOCKFILE_PLACEHOLDER = "[Lockfile summarized — see metadata.lockfileSummary]";
  static final String MANIFEST_PLACEHOLDER =
      "[package.json summarized — see metadata.packageJsonSummary]";

  private static final Pattern LOCKFILE_PATTERN =
      Pattern.compile("(^|/)(yarn\\.lock|package-lock\\.json|pnpm-lock\\.yaml|bun\\.lockb)$");
  private static final String MANIFEST_SUFFIX = "package.json";

  private final ObjectMapper objectMapper;

  public ContentSizeGovernor(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public GovernedContent govern(String path, String content, ContentSizePolicy policy) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(policy, "policy");
    String text = content == null ? "" : content;
    Map<String, Object> metadata = new LinkedHashMap<>();

    boolean manifest = isManifest(path);
    PackageManifestSummary manifestSummary = manifest ? summarizeManifest(path, text) : null;
    if (manifestSummary != null) {
      metadata.put(PACKAGE_JSON_SUMMARY_KEY, manifestSummary);
    }

    int lines = countLines(text);
    long byteSize = text.getBytes(StandardCharsets.UTF_8).length;

    if (policy.summarizeLockfiles() && isLockfile(path)) {
      metadata.put(LOCKFILE_SUMMARY_KEY, new LockfileSummary(lines, byteSize));
      return new GovernedContent(LOCKFILE_PLACEHOLDER, metadata);
    }

    boolean exceeds = lines > policy.maxFileLines() || byteSize > policy.maxFileBytes();
    if (exceeds) {
      String snippet =
          switch (policy.largeFileStrategy()) {
            case EXCLUDE -> EXCLUDED_PLACEHOLDER;
            case HEAD_TAIL -> headTail(text, policy.headTailHeadLines(), policy.headTailTailLines());
            case SUMMARY ->
                manifestSummary != null
                    ? MANIFEST_PLACEHOLDER
                    : "[Large file summarized] Lines: %d, Size: %d bytes".formatted(lines, byteSize);
          };
      log.debug(
          "Applied {} strategy to {} ({} lines, {} bytes)",
          policy.largeFileStrategy().token(),
          path,
          lines,
          byteSize);
      return new GovernedContent(snippet, metadata);
    }

    if (manifestSummary != null && policy.summarizeLockfiles()) {
      return new GovernedContent(MANIFEST_PLACEHOLDER, metadata);
    }
    return new GovernedContent(text, metadata);
  }

  static boolean isManifest(String path) {
    return path.endsWith(MANIFEST_SUFFIX);
  }

  static boolean isLockfile(String path) {
    return LOCKFILE_PATTERN.matcher(path).find();
  }

  static int countLines(String text) {
    if (text.isEmpty()) {
      return 0;
    }
    return text.split("\n", -1).length;
  }

  static String headTail(String text, int headLines, int tailLines) {
    String[] lines = text.split("\n", -1);
    if (lines.length <= headLines + tailLines + 1) {
      return text;
    }
    int omitted = lines.length - headLines - tailLines;
    String head = String.join("\n", Arrays.copyOfRange(lines, 0, headLines));
    String tail = String.join("\n", Arrays.copyOfRange(lines, lines.length - tailLines, lines.length));
    return head + "\n\n... [" + omitted + " lines omitted] ...\n\n" + tail;
  }

  private PackageManifestSummary summarizeManifest(String path, String text) {
    if (text.isBlank()) {
      return null;
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(text);
    } catch (JsonProcessingException ex) {
      log.debug("Manifest {} is not valid JSON, summary skipped: {}", path, ex.getOriginalMessage());
      return null;
    }
    if (root == null || !root.isObject()) {
      return null;
    }
    return new PackageManifestSummary(
        textOrNull(root.get("name")),
        textOrNull(root.get("version")),
        stringMap(root.get("engines")),
        stringMap(root.get("scripts")),
        stringMap(root.get("dependencies")),
        stringMap(root.get("devDependencies")),
        stringMap(root.get("peerDependencies")),
        stringMap(root.get("optionalDependencies")),
        root.hasNonNull("workspaces")
            ? objectMapper.convertValue(root.get("workspaces"), Object.class)
            : null,
        textOrNull(root.get("packageManager")));
  }

  private static String textOrNull(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }

  private static Map<String, String> stringMap(JsonNode node) {
    if (node == null || !node.isObject()) {
      return null;
    }
    Map<String, String> values = new LinkedHashMap<>();
    node.fields().forEachRemaining(entry -> values.put(entry.getKey(), entry.getValue().asText()));
    return values;
  }
}
