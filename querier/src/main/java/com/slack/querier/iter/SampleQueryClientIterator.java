package com.slack.querier.iter;

import com.google.common.collect.AbstractIterator;
import com.slack.querier.model.LabeledSample;
import com.slack.querier.model.Sample;
import com.slack.querier.model.SampleQueryResponse;
import com.slack.querier.model.Series;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/** Lazily reads the sample query stream of one ingester, one batch at a time. */
public class SampleQueryClientIterator extends AbstractIterator<LabeledSample> {
  private static final Comparator<LabeledSample> ORDER =
      Comparator.comparing((LabeledSample s) -> s.sample().timestamp())
          .thenComparing(LabeledSample::labels);

  private final Iterator<SampleQueryResponse> responses;
  private Iterator<LabeledSample> batch;

  public SampleQueryClientIterator(Iterator<SampleQueryResponse> responses) {
    this.responses = responses;
  }

  @Override
  protected LabeledSample computeNext() {
    while (batch == null || !batch.hasNext()) {
      if (!responses.hasNext()) {
        return endOfData();
      }
      batch = toSamples(responses.next());
    }
    return batch.next();
  }

  private static Iterator<LabeledSample> toSamples(SampleQueryResponse response) {
    if (response == null || response.series() == null) {
      return List.<LabeledSample>of().iterator();
    }
    List<LabeledSample> samples = new ArrayList<>();
    for (Series series : response.series()) {
      for (Sample sample : series.samples()) {
        samples.add(new LabeledSample(series.labels(), sample));
      }
    }
    samples.sort(ORDER);
    return samples.iterator();
  }
}
