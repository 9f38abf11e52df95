package com.slack.querier.iter;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableList;
import com.slack.querier.model.Direction;
import com.slack.querier.model.Entry;
import com.slack.querier.model.LabeledEntry;
import com.slack.querier.model.LabeledSample;
import com.slack.querier.model.QueryResponse;
import com.slack.querier.model.Sample;
import com.slack.querier.model.SampleQueryResponse;
import com.slack.querier.model.Series;
import com.slack.querier.model.Stream;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class QueryClientIteratorTest {

  private static Entry entry(long epochSecond, String line) {
    return new Entry(Instant.ofEpochSecond(epochSecond), line);
  }

  /** Counts how many batches were pulled from the underlying stream. */
  private static class CountingIterator<T> implements Iterator<T> {
    private final Iterator<T> delegate;
    private final AtomicInteger pulled = new AtomicInteger();

    CountingIterator(List<T> batches) {
      this.delegate = batches.iterator();
    }

    @Override
    public boolean hasNext() {
      return delegate.hasNext();
    }

    @Override
    public T next() {
      pulled.incrementAndGet();
      return delegate.next();
    }
  }

  @Test
  public void testForwardOrderWithinBatch() {
    QueryResponse batch =
        new QueryResponse(
            List.of(
                new Stream("{app=\"b\"}", List.of(entry(3, "b3"), entry(1, "b1"))),
                new Stream("{app=\"a\"}", List.of(entry(2, "a2"), entry(1, "a1")))));

    List<LabeledEntry> entries =
        ImmutableList.copyOf(
            new QueryClientIterator(List.of(batch).iterator(), Direction.FORWARD));

    assertThat(entries)
        .extracting((e) -> e.entry().line())
        .containsExactly("a1", "b1", "a2", "b3");
    assertThat(entries.get(0).labels()).isEqualTo("{app=\"a\"}");
  }

  @Test
  public void testBackwardOrderWithinBatch() {
    QueryResponse batch =
        new QueryResponse(
            List.of(new Stream("{app=\"a\"}", List.of(entry(1, "1"), entry(3, "3"), entry(2, "2")))));

    List<LabeledEntry> entries =
        ImmutableList.copyOf(
            new QueryClientIterator(List.of(batch).iterator(), Direction.BACKWARD));

    assertThat(entries).extracting((e) -> e.entry().line()).containsExactly("3", "2", "1");
  }

  @Test
  public void testPullsBatchesLazily() {
    CountingIterator<QueryResponse> batches =
        new CountingIterator<>(
            List.of(
                new QueryResponse(List.of(new Stream("{a=\"1\"}", List.of(entry(1, "first"))))),
                new QueryResponse(List.of()),
                new QueryResponse(List.of(new Stream("{a=\"1\"}", List.of(entry(2, "second")))))));

    QueryClientIterator iterator = new QueryClientIterator(batches, Direction.FORWARD);
    assertThat(batches.pulled.get()).isZero();

    assertThat(iterator.next().entry().line()).isEqualTo("first");
    assertThat(batches.pulled.get()).isEqualTo(1);

    // the empty batch is skipped over
    assertThat(iterator.next().entry().line()).isEqualTo("second");
    assertThat(batches.pulled.get()).isEqualTo(3);
    assertThat(iterator.hasNext()).isFalse();
  }

  @Test
  public void testSamplesAreOrderedByTimestamp() {
    SampleQueryResponse batch =
        new SampleQueryResponse(
            List.of(
                new Series(
                    "{app=\"a\"}",
                    List.of(
                        new Sample(Instant.ofEpochSecond(5), 2.0),
                        new Sample(Instant.ofEpochSecond(1), 1.0))),
                new Series("{app=\"b\"}", List.of(new Sample(Instant.ofEpochSecond(3), 4.0)))));

    List<LabeledSample> samples =
        ImmutableList.copyOf(new SampleQueryClientIterator(List.of(batch).iterator()));

    assertThat(samples).extracting((s) -> s.sample().value()).containsExactly(1.0, 4.0, 2.0);
    assertThat(samples.get(1).labels()).isEqualTo("{app=\"b\"}");
  }
}
