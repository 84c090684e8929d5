package com.knowledgeagent.backend.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a document body into ordered slices that fit a token budget. The leading frontmatter is
 * held aside, excluded from the budget and attached to every chunk. Cuts that fall inside a word
 * move back to just after the nearest preceding space or newline, so concatenating the chunk
 * contents in order yields the original body.
 */
public class DocumentChunker {

  private static final Logger log = LoggerFactory.getLogger(DocumentChunker.class);

  private final TokenEstimator tokenEstimator;
  private final int maxTokensPerChunk;

  public DocumentChunker(TokenEstimator tokenEstimator, int maxTokensPerChunk) {
    this.tokenEstimator = Objects.requireNonNull(tokenEstimator, "tokenEstimator");
    if (maxTokensPerChunk <= 0) {
      throw new IllegalArgumentException("maxTokensPerChunk must be positive");
    }
    this.maxTokensPerChunk = maxTokensPerChunk;
  }

  public List<DocumentChunk> chunk(String document) {
    Frontmatter split = Frontmatter.split(document);
    String body = split.body();
    int tokens = tokenEstimator.estimate(body);
    if (tokens <= maxTokensPerChunk) {
      return List.of(new DocumentChunk(body, 0, 1, split.header()));
    }

    int estimatedChunks = (int) Math.ceil((double) tokens / maxTokensPerChunk);
    int targetSize = (int) Math.ceil((double) body.length() / estimatedChunks);
    if (body.length() <= targetSize) {
      return List.of(new DocumentChunk(body, 0, 1, split.header()));
    }

    List<String> slices = new ArrayList<>();
    int start = 0;
    while (start < body.length()) {
      int end = Math.min(start + targetSize, body.length());
      if (end < body.length() && !isBoundary(body.charAt(end - 1)) && !isBoundary(body.charAt(end))) {
        int boundary = lastBoundary(body, start, end);
        if (boundary >= start) {
          end = boundary + 1;
        } else if (Character.isHighSurrogate(body.charAt(end - 1)) && end - 1 > start) {
          end--;
        }
      }
      slices.add(body.substring(start, end));
      start = end;
    }

    List<DocumentChunk> chunks = new ArrayList<>(slices.size());
    for (int i = 0; i < slices.size(); i++) {
      chunks.add(new DocumentChunk(slices.get(i), i, slices.size(), split.header()));
    }
    log.info(
        "Split document of ~{} tokens into {} chunks (estimated {}, budget {} tokens)",
        tokens,
        chunks.size(),
        estimatedChunks,
        maxTokensPerChunk);
    return List.copyOf(chunks);
  }

  public int estimateTokens(String text) {
    return tokenEstimator.estimate(text);
  }

  private static boolean isBoundary(char c) {
    return c == ' ' || c == '\n';
  }

  private static int lastBoundary(String body, int start, int end) {
    for (int i = end - 1; i >= start; i--) {
      if (isBoundary(body.charAt(i))) {
        return i;
      }
    }
    return -1;
  }
}
