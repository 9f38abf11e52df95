package com.slack.querier.session;

import com.slack.querier.IngesterQueryException;

/** The tenant issuing the query could not be determined. */
public class IdentityResolutionException extends IngesterQueryException {
  public IdentityResolutionException(String msg) {
    super(msg);
  }
}
