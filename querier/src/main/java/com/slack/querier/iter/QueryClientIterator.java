package com.slack.querier.iter;

import com.google.common.collect.AbstractIterator;
import com.slack.querier.model.Direction;
import com.slack.querier.model.Entry;
import com.slack.querier.model.LabeledEntry;
import com.slack.querier.model.QueryResponse;
import com.slack.querier.model.Stream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Lazily reads the log query stream of one ingester. A batch is only pulled from the ingester once
 * the entries of the previous one have been consumed, and the entries of a batch are returned in
 * the order requested by the query.
 */
public class QueryClientIterator extends AbstractIterator<LabeledEntry> {
  private static final Comparator<LabeledEntry> FORWARD =
      Comparator.comparing((LabeledEntry e) -> e.entry().timestamp())
          .thenComparing(LabeledEntry::labels);
  private static final Comparator<LabeledEntry> BACKWARD =
      Comparator.comparing((LabeledEntry e) -> e.entry().timestamp())
          .reversed()
          .thenComparing(LabeledEntry::labels);

  private final Iterator<QueryResponse> responses;
  private final Comparator<LabeledEntry> order;
  private Iterator<LabeledEntry> batch;

  public QueryClientIterator(Iterator<QueryResponse> responses, Direction direction) {
    this.responses = responses;
    this.order = direction == Direction.BACKWARD ? BACKWARD : FORWARD;
  }

  @Override
  protected LabeledEntry computeNext() {
    while (batch == null || !batch.hasNext()) {
      if (!responses.hasNext()) {
        return endOfData();
      }
      batch = toEntries(responses.next());
    }
    return batch.next();
  }

  private Iterator<LabeledEntry> toEntries(QueryResponse response) {
    if (response == null || response.streams() == null) {
      return List.<LabeledEntry>of().iterator();
    }
    List<LabeledEntry> entries = new ArrayList<>();
    for (Stream stream : response.streams()) {
      for (Entry entry : stream.entries()) {
        entries.add(new LabeledEntry(stream.labels(), entry));
      }
    }
    entries.sort(order);
    return entries.iterator();
  }
}
