package io.pagereach.engine.integration.secret;

import java.util.UUID;

/**
 * Supplies decrypted page access tokens. Storage and decryption belong to the implementation; the
 * engine only ever asks for one page's token right before a send.
 */
public interface PageTokenProvider {

  /**
   * @throws PageTokenUnavailableException if the page has no usable token
   */
  String accessToken(UUID pageId);
}
