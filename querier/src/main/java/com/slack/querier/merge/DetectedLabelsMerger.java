package com.slack.querier.merge;

import com.slack.querier.model.LabelToValuesResponse;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unions the values reported for each detected label. Values of a label come back sorted and
 * without duplicates.
 */
public class DetectedLabelsMerger implements ResponseMerger<LabelToValuesResponse> {
  private static final Logger LOG = LoggerFactory.getLogger(DetectedLabelsMerger.class);

  @Override
  public LabelToValuesResponse merge(List<LabelToValuesResponse> responses) {
    Map<String, TreeSet<String>> valuesByLabel = new HashMap<>();
    for (LabelToValuesResponse response : responses) {
      if (response == null) {
        continue;
      }
      if (response.labels() == null) {
        LOG.warn("Skipping malformed detected labels response {}", response);
        continue;
      }

      response
          .labels()
          .forEach(
              (label, values) -> {
                if (values == null) {
                  LOG.warn("Skipping detected label {} with no values", label);
                  return;
                }
                valuesByLabel.computeIfAbsent(label, (l) -> new TreeSet<>()).addAll(values);
              });
    }

    Map<String, List<String>> merged = new HashMap<>(valuesByLabel.size());
    valuesByLabel.forEach((label, values) -> merged.put(label, List.copyOf(values)));
    return new LabelToValuesResponse(merged);
  }
}
