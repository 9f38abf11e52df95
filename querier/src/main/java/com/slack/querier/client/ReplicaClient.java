package com.slack.querier.client;

import com.slack.querier.model.ChunkIdsRequest;
import com.slack.querier.model.ChunkIdsResponse;
import com.slack.querier.model.DetectedLabelsRequest;
import com.slack.querier.model.IndexStats;
import com.slack.querier.model.IndexStatsRequest;
import com.slack.querier.model.LabelRequest;
import com.slack.querier.model.LabelResponse;
import com.slack.querier.model.LabelToValuesResponse;
import com.slack.querier.model.QueryRequest;
import com.slack.querier.model.QueryResponse;
import com.slack.querier.model.SampleQueryRequest;
import com.slack.querier.model.SampleQueryResponse;
import com.slack.querier.model.SeriesRequest;
import com.slack.querier.model.SeriesResponse;
import com.slack.querier.model.TailRequest;
import com.slack.querier.model.TailResponse;
import com.slack.querier.model.VolumeRequest;
import com.slack.querier.model.VolumeResponse;
import java.io.Closeable;
import java.util.Iterator;

/**
 * Client for the read RPCs of a single ingester. Calls block until the ingester answers; remote
 * failures are reported as {@link io.grpc.StatusRuntimeException}. Streaming calls return an
 * iterator that pulls batches from the ingester as it is consumed.
 */
public interface ReplicaClient extends Closeable {

  Iterator<QueryResponse> query(QueryRequest request);

  Iterator<SampleQueryResponse> querySample(SampleQueryRequest request);

  LabelResponse label(LabelRequest request);

  Iterator<TailResponse> tail(TailRequest request);

  SeriesResponse series(SeriesRequest request);

  int tailersCount();

  ChunkIdsResponse getChunkIds(ChunkIdsRequest request);

  IndexStats getStats(IndexStatsRequest request);

  VolumeResponse getVolume(VolumeRequest request);

  LabelToValuesResponse getDetectedLabels(DetectedLabelsRequest request);
}
