package com.slack.querier.merge;

import com.slack.querier.model.IndexStats;
import java.util.List;

/** Sums every field of the index stats. The order of the responses does not matter. */
public class IndexStatsMerger implements ResponseMerger<IndexStats> {

  @Override
  public IndexStats merge(List<IndexStats> responses) {
    long streams = 0;
    long chunks = 0;
    long bytes = 0;
    long entries = 0;
    for (IndexStats stats : responses) {
      if (stats == null) {
        continue;
      }
      streams += stats.streams();
      chunks += stats.chunks();
      bytes += stats.bytes();
      entries += stats.entries();
    }
    return new IndexStats(streams, chunks, bytes, entries);
  }
}
