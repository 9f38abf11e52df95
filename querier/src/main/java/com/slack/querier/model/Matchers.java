package com.slack.querier.model;

import java.util.List;

public class Matchers {

  private Matchers() {}

  /** Renders matchers as a stream selector, {@code {}} when there are none. */
  public static String toSelector(List<LabelMatcher> matchers) {
    if (matchers == null) {
      return "{}";
    }
    StringBuilder out = new StringBuilder();
    out.append('{');
    for (int i = 0; i < matchers.size(); i++) {
      if (i > 0) {
        out.append(',');
      }
      out.append(matchers.get(i));
    }
    out.append('}');
    return out.toString();
  }
}
