package com.knowledgeagent.backend.chunking;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Counts tokens with the cl100k_base encoding, falling back to the character ratio on failure. */
public class JtokkitTokenEstimator implements TokenEstimator {

  private static final Logger log = LoggerFactory.getLogger(JtokkitTokenEstimator.class);

  private final Encoding encoding;
  private final TokenEstimator fallback;

  public JtokkitTokenEstimator() {
    this(Encodings.newLazyEncodingRegistry(), new CharacterRatioTokenEstimator());
  }

  JtokkitTokenEstimator(EncodingRegistry registry, TokenEstimator fallback) {
    this.encoding = registry.getEncoding(EncodingType.CL100K_BASE);
    this.fallback = fallback;
  }

  @Override
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    try {
      return encoding.countTokensOrdinary(text);
    } catch (RuntimeException ex) {
      log.debug("Falling back to character ratio estimate due to {}", ex.getMessage());
      return fallback.estimate(text);
    }
  }
}
