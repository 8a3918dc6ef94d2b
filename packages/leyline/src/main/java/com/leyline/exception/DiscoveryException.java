package com.leyline.exception;

import java.util.List;
import java.util.Map;

/** A command cannot answer as asked, e.g. a missing category or an empty search query. */
public class DiscoveryException extends LeylineException {

  public DiscoveryException(String message, List<String> suggestions) {
    super(LeylineErrorCode.DISCOVERY_ERROR, message, null, Map.of(), suggestions);
  }
}
