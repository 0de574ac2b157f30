package io.pagereach.engine.integration.secret;

import java.util.UUID;

public class PageTokenUnavailableException extends RuntimeException {

  public PageTokenUnavailableException(UUID pageId) {
    super("No access token available for page " + pageId);
  }
}
