package io.pagereach.engine.integration.secret;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/** Placeholder tokens for local runs, paired with the no-op transport. */
@Component
@ConditionalOnMissingBean(value = PageTokenProvider.class, ignored = NoOpPageTokenProvider.class)
public class NoOpPageTokenProvider implements PageTokenProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpPageTokenProvider.class);

  @Override
  public String accessToken(UUID pageId) {
    log.debug("NoOp page token issued for page {}", pageId);
    return "noop-token-" + pageId;
  }
}
