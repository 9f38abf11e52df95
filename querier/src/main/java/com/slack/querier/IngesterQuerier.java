package com.slack.querier;

import static com.google.common.base.Preconditions.checkArgument;

import brave.ScopedSpan;
import brave.Tracer;
import brave.Tracing;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.slack.querier.client.ReplicaClient;
import com.slack.querier.client.ReplicaClientPool;
import com.slack.querier.config.QuerierConfigs;
import com.slack.querier.config.ShardCountLookup;
import com.slack.querier.iter.QueryClientIterator;
import com.slack.querier.iter.SampleQueryClientIterator;
import com.slack.querier.merge.DetectedLabelsMerger;
import com.slack.querier.merge.IndexStatsMerger;
import com.slack.querier.merge.VolumeMerger;
import com.slack.querier.model.ChunkIdsRequest;
import com.slack.querier.model.DetectedLabelsRequest;
import com.slack.querier.model.IndexStats;
import com.slack.querier.model.IndexStatsRequest;
import com.slack.querier.model.LabelMatcher;
import com.slack.querier.model.LabelRequest;
import com.slack.querier.model.LabelToValuesResponse;
import com.slack.querier.model.LabeledEntry;
import com.slack.querier.model.LabeledSample;
import com.slack.querier.model.Matchers;
import com.slack.querier.model.QueryRequest;
import com.slack.querier.model.QueryResponse;
import com.slack.querier.model.SampleQueryRequest;
import com.slack.querier.model.SampleQueryResponse;
import com.slack.querier.model.SeriesIdentifier;
import com.slack.querier.model.SeriesRequest;
import com.slack.querier.model.TailRequest;
import com.slack.querier.model.TailResponse;
import com.slack.querier.model.VolumeRequest;
import com.slack.querier.model.VolumeResponse;
import com.slack.querier.quorum.QuorumConfig;
import com.slack.querier.quorum.QuorumExecutor;
import com.slack.querier.quorum.ReplicaResponse;
import com.slack.querier.ring.ReplicaDescriptor;
import com.slack.querier.ring.ReplicaSet;
import com.slack.querier.ring.ReplicaTopology;
import com.slack.querier.session.PartitionContext;
import com.slack.querier.session.QueryContext;
import com.slack.querier.util.FutureUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans the read requests of a query out to the ingesters and merges their answers.
 *
 * <p>Reads go either to the replica set of the whole ring, or, when partition querying is enabled,
 * to one replica set per partition owned by the tenant's shuffle shard. In the latter case the
 * ingesters that answered are recorded in the query's {@link PartitionContext}, and the chunk id
 * lookup of the same query is sent to exactly those ingesters.
 */
public class IngesterQuerier implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(IngesterQuerier.class);

  public static final String QUERIER_REQUESTS = "ingester_querier_requests";
  public static final String QUERIER_FAILURES = "ingester_querier_failures";
  public static final String QUERIER_UNIMPLEMENTED_DOWNGRADES =
      "ingester_querier_unimplemented_downgrades";
  public static final String QUERIER_DURATION = "ingester_querier_duration";
  private static final String OPERATION_TAG = "operation";

  private final QuerierConfigs.QuerierConfig querierConfig;
  private final ReplicaTopology topology;
  private final ReplicaClientPool clientPool;
  private final ShardCountLookup shardCountLookup;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final ListeningExecutorService executorService;
  private final QuorumExecutor quorumExecutor;

  /** A call made against the client of a single ingester. */
  @FunctionalInterface
  public interface ReplicaCall<T> {
    T call(ReplicaClient client) throws Exception;
  }

  public IngesterQuerier(
      QuerierConfigs.QuerierConfig querierConfig,
      ReplicaTopology topology,
      ReplicaClientPool clientPool,
      ShardCountLookup shardCountLookup,
      MeterRegistry meterRegistry) {
    this(
        querierConfig,
        topology,
        clientPool,
        shardCountLookup,
        meterRegistry,
        Clock.systemUTC(),
        MoreExecutors.listeningDecorator(
            Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                    .setNameFormat("ingester-querier-%d")
                    .setDaemon(true)
                    .build())));
  }

  @VisibleForTesting
  IngesterQuerier(
      QuerierConfigs.QuerierConfig querierConfig,
      ReplicaTopology topology,
      ReplicaClientPool clientPool,
      ShardCountLookup shardCountLookup,
      MeterRegistry meterRegistry,
      Clock clock,
      ListeningExecutorService executorService) {
    this.querierConfig = querierConfig;
    this.topology = topology;
    this.clientPool = clientPool;
    this.shardCountLookup = shardCountLookup;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.executorService = executorService;
    this.quorumExecutor = new QuorumExecutor(executorService);
  }

  public List<Iterator<LabeledEntry>> selectLogs(QueryContext ctx, QueryRequest request) {
    return execute(
        "select_logs",
        () -> {
          List<ReplicaResponse<Iterator<QueryResponse>>> responses =
              await(
                  ctx,
                  queryAllReplicas(
                      ctx,
                      (client) -> {
                        ctx.stats().addIngesterReached(1);
                        return client.query(request);
                      }));

          List<Iterator<LabeledEntry>> iterators = new ArrayList<>(responses.size());
          for (ReplicaResponse<Iterator<QueryResponse>> response : responses) {
            iterators.add(new QueryClientIterator(response.response(), request.direction()));
          }
          return iterators;
        });
  }

  public List<Iterator<LabeledSample>> selectSamples(
      QueryContext ctx, SampleQueryRequest request) {
    return execute(
        "select_samples",
        () -> {
          List<ReplicaResponse<Iterator<SampleQueryResponse>>> responses =
              await(
                  ctx,
                  queryAllReplicas(
                      ctx,
                      (client) -> {
                        ctx.stats().addIngesterReached(1);
                        return client.querySample(request);
                      }));

          List<Iterator<LabeledSample>> iterators = new ArrayList<>(responses.size());
          for (ReplicaResponse<Iterator<SampleQueryResponse>> response : responses) {
            iterators.add(new SampleQueryClientIterator(response.response()));
          }
          return iterators;
        });
  }

  /** Returns the label names or values reported by each ingester, without de-duplicating them. */
  public List<List<String>> label(QueryContext ctx, LabelRequest request) {
    return execute(
        "label",
        () -> {
          List<List<String>> values = new ArrayList<>();
          for (ReplicaResponse<List<String>> response :
              await(ctx, queryAllReplicas(ctx, (client) -> client.label(request).values()))) {
            values.add(response.response());
          }
          return values;
        });
  }

  /** Opens a tail stream on the ingesters, keyed by ingester address. */
  public Map<String, Iterator<TailResponse>> tail(QueryContext ctx, TailRequest request) {
    return execute(
        "tail",
        () -> toTailClients(await(ctx, queryAllReplicas(ctx, (client) -> client.tail(request)))));
  }

  /**
   * Opens a tail stream on every active ingester of the ring that is not among the connected
   * ones. Returns an empty map without calling any ingester when there is nothing to reconnect.
   */
  public Map<String, Iterator<TailResponse>> tailDisconnectedIngesters(
      QueryContext ctx, TailRequest request, Collection<String> connectedAddresses) {
    return execute(
        "tail_disconnected",
        () -> {
          Set<String> connected = new HashSet<>(connectedAddresses);
          List<ReplicaDescriptor> reconnect = new ArrayList<>();
          for (ReplicaDescriptor replica : topology.replicasForRead().replicas) {
            if (connected.contains(replica.address)) {
              continue;
            }
            // joining and leaving ingesters are picked up once they turn active
            if (!replica.isActive()) {
              continue;
            }
            reconnect.add(replica);
          }

          if (reconnect.isEmpty()) {
            return Map.of();
          }
          LOG.debug("Reconnecting tail to {} ingesters", reconnect.size());
          return toTailClients(
              await(
                  ctx,
                  executeOnSet(
                      ctx,
                      ReplicaSet.allOf(reconnect),
                      QuorumConfig.defaultConfig(),
                      (client) -> client.tail(request))));
        });
  }

  public List<List<SeriesIdentifier>> series(QueryContext ctx, SeriesRequest request) {
    return execute(
        "series",
        () -> {
          List<List<SeriesIdentifier>> series = new ArrayList<>();
          for (ReplicaResponse<List<SeriesIdentifier>> response :
              await(ctx, queryAllReplicas(ctx, (client) -> client.series(request).series()))) {
            series.add(response.response());
          }
          return series;
        });
  }

  /**
   * Returns the number of tailers reported by every active ingester. Any failing ingester fails
   * the call.
   *
   * @throws NoHealthyReplicasException if there is no active ingester
   */
  public List<Integer> tailersCount(QueryContext ctx) {
    return execute(
        "tailers_count",
        () -> {
          ReplicaSet active =
              topology.allHealthyReplicasForRead().filter(ReplicaDescriptor::isActive, 0);
          if (active.isEmpty()) {
            throw new NoHealthyReplicasException("no active ingester found");
          }

          List<Integer> counts = new ArrayList<>(active.size());
          for (ReplicaResponse<Integer> response :
              await(
                  ctx,
                  executeOnSet(
                      ctx, active, QuorumConfig.defaultConfig(), ReplicaClient::tailersCount))) {
            counts.add(response.response());
          }
          return counts;
        });
  }

  /**
   * Returns the ids of the chunks matching the matchers, concatenated across ingesters. When an
   * earlier read of the query was partitioned, only the ingesters that answered it are asked.
   */
  public List<String> getChunkIds(
      QueryContext ctx, Instant from, Instant through, List<LabelMatcher> matchers) {
    return execute(
        "get_chunk_ids",
        () -> {
          ChunkIdsRequest request = new ChunkIdsRequest(Matchers.toSelector(matchers), from, through);
          ReplicaCall<List<String>> call = (client) -> client.getChunkIds(request).chunkIds();

          ListenableFuture<List<ReplicaResponse<List<String>>>> responses;
          if (ctx.partitionContext().isPartitioned()) {
            responses = replayOnUsedReplicas(ctx, call);
          } else {
            responses = queryAllReplicas(ctx, call);
          }

          List<String> chunkIds = new ArrayList<>();
          for (ReplicaResponse<List<String>> response : await(ctx, responses)) {
            chunkIds.addAll(response.response());
          }
          return chunkIds;
        });
  }

  /** Returns the index stats summed across ingesters. Older ingesters contribute nothing. */
  public IndexStats stats(
      QueryContext ctx, Instant from, Instant through, List<LabelMatcher> matchers) {
    return execute(
        "stats",
        () -> {
          IndexStatsRequest request =
              new IndexStatsRequest(from, through, Matchers.toSelector(matchers));
          List<ReplicaResponse<IndexStats>> responses;
          try {
            responses = await(ctx, queryAllReplicas(ctx, (client) -> client.getStats(request)));
          } catch (RuntimeException e) {
            if (UnimplementedCalls.isUnimplementedCallError(e)) {
              recordDowngrade("stats", e);
              return IndexStats.empty();
            }
            throw e;
          }
          return new IndexStatsMerger().merge(unwrap(responses));
        });
  }

  /**
   * Returns the largest volumes across ingesters, at most limit of them when limit is positive.
   * Older ingesters contribute nothing.
   */
  public VolumeResponse volume(
      QueryContext ctx,
      Instant from,
      Instant through,
      int limit,
      List<String> targetLabels,
      String aggregateBy,
      List<LabelMatcher> matchers) {
    return execute(
        "volume",
        () -> {
          VolumeRequest request =
              new VolumeRequest(
                  from, through, Matchers.toSelector(matchers), limit, targetLabels, aggregateBy);
          List<ReplicaResponse<VolumeResponse>> responses;
          try {
            responses = await(ctx, queryAllReplicas(ctx, (client) -> client.getVolume(request)));
          } catch (RuntimeException e) {
            if (UnimplementedCalls.isUnimplementedCallError(e)) {
              recordDowngrade("volume", e);
              return VolumeResponse.empty();
            }
            throw e;
          }
          return new VolumeMerger(limit).merge(unwrap(responses));
        });
  }

  public LabelToValuesResponse detectedLabels(QueryContext ctx, DetectedLabelsRequest request) {
    return execute(
        "detected_labels",
        () ->
            new DetectedLabelsMerger()
                .merge(
                    unwrap(
                        await(
                            ctx,
                            queryAllReplicas(
                                ctx, (client) -> client.getDetectedLabels(request))))));
  }

  /**
   * Runs the call against the replicas of the ring, or against the partitions of the tenant's
   * shuffle shard when partition querying is enabled, in which case the context is marked as
   * partitioned.
   */
  @VisibleForTesting
  <T> ListenableFuture<List<ReplicaResponse<T>>> queryAllReplicas(
      QueryContext ctx, ReplicaCall<T> call) {
    if (querierConfig.getQueryPartitionIngesters()) {
      ctx.partitionContext().setPartitioned(true);
      String tenantId = ctx.tenantId();
      int shardCount = shardCountLookup.shardCountForTenant(tenantId);
      checkArgument(
          shardCount > 0, "Shard count for tenant %s must be positive, got %s", tenantId, shardCount);

      List<ReplicaSet> partitions =
          topology.shardedPartitionReplicaSets(
              tenantId,
              shardCount,
              Duration.ofMillis(querierConfig.getQueryIngestersWithinMs()),
              clock.instant());
      LOG.debug("Querying {} partitions for tenant={}", partitions.size(), tenantId);
      return executeOnPartitions(ctx, partitions, call);
    }

    return executeOnSet(ctx, topology.replicasForRead(), QuorumConfig.defaultConfig(), call);
  }

  /**
   * Runs the call against every partition's replica set, asking as few replicas of each partition
   * as possible. Any partition failing fails the whole call.
   */
  @VisibleForTesting
  <T> ListenableFuture<List<ReplicaResponse<T>>> executeOnPartitions(
      QueryContext ctx, List<ReplicaSet> partitions, ReplicaCall<T> call) {
    return FutureUtils.forEachJobMergeResults(
        partitions,
        (partition) -> executeOnSet(ctx, partition, QuorumConfig.minimizingRequests(), call));
  }

  /**
   * Runs the call against the replica set until quorum is reached. An ingester is recorded in the
   * query's partition context once its answer is counted towards the quorum, and removed again if
   * that answer ends up unused. Answers of cancelled or late calls never get recorded.
   */
  @VisibleForTesting
  <T> ListenableFuture<List<ReplicaResponse<T>>> executeOnSet(
      QueryContext ctx, ReplicaSet replicaSet, QuorumConfig quorumConfig, ReplicaCall<T> call) {
    PartitionContext partitionContext = ctx.partitionContext();
    Map<String, ReplicaClient> clientsUsed = new ConcurrentHashMap<>();
    Set<String> recorded = ConcurrentHashMap.newKeySet();
    return quorumExecutor.doUntilQuorum(
        replicaSet,
        quorumConfig,
        (replica) -> {
          ReplicaClient client = clientPool.getClientFor(replica.address);
          clientsUsed.put(replica.address, client);
          return call.call(client);
        },
        (accepted) -> {
          partitionContext.addClient(clientsUsed.get(accepted.address()), accepted.address());
          recorded.add(accepted.address());
        },
        (unused) -> {
          if (recorded.remove(unused.address())) {
            partitionContext.removeClient(unused.address());
          }
        });
  }

  /** Runs the call against every ingester recorded in the partition context, with no quorum. */
  @VisibleForTesting
  <T> ListenableFuture<List<ReplicaResponse<T>>> replayOnUsedReplicas(
      QueryContext ctx, ReplicaCall<T> call) {
    return FutureUtils.forEachJobMergeResults(
        ctx.partitionContext().usedReplicas(),
        (used) ->
            Futures.transform(
                quorumExecutor.submit(() -> call.call(used.client())),
                (response) ->
                    Collections.<ReplicaResponse<T>>singletonList(
                        new ReplicaResponse<>(used.address(), response)),
                MoreExecutors.directExecutor()));
  }

  private <T> T await(QueryContext ctx, ListenableFuture<T> future) {
    Instant now = clock.instant();
    Instant deadline =
        ctx.deadline().orElseGet(() -> now.plusMillis(querierConfig.getDefaultQueryTimeoutMs()));
    return FutureUtils.await(future, Duration.between(now, deadline));
  }

  private <R> R execute(String operation, Supplier<R> body) {
    // no span when the application never set up tracing
    Tracer tracer = Tracing.currentTracer();
    ScopedSpan span =
        tracer == null ? null : tracer.startScopedSpan("IngesterQuerier." + operation);
    Timer.Sample sample = Timer.start(meterRegistry);
    meterRegistry.counter(QUERIER_REQUESTS, OPERATION_TAG, operation).increment();
    try {
      return body.get();
    } catch (RuntimeException e) {
      meterRegistry.counter(QUERIER_FAILURES, OPERATION_TAG, operation).increment();
      LOG.warn("Ingester {} request failed", operation, e);
      if (span != null) {
        span.error(e);
      }
      throw e;
    } finally {
      sample.stop(meterRegistry.timer(QUERIER_DURATION, OPERATION_TAG, operation));
      if (span != null) {
        span.finish();
      }
    }
  }

  private void recordDowngrade(String operation, RuntimeException e) {
    LOG.debug("Ingesters don't support {}, returning an empty result", operation, e);
    meterRegistry.counter(QUERIER_UNIMPLEMENTED_DOWNGRADES, OPERATION_TAG, operation).increment();
  }

  private static Map<String, Iterator<TailResponse>> toTailClients(
      List<ReplicaResponse<Iterator<TailResponse>>> responses) {
    Map<String, Iterator<TailResponse>> tailClients = new HashMap<>();
    for (ReplicaResponse<Iterator<TailResponse>> response : responses) {
      tailClients.put(response.address(), response.response());
    }
    return tailClients;
  }

  private static <T> List<T> unwrap(List<ReplicaResponse<T>> responses) {
    List<T> unwrapped = new ArrayList<>(responses.size());
    for (ReplicaResponse<T> response : responses) {
      unwrapped.add(response.response());
    }
    return unwrapped;
  }

  @Override
  public void close() {
    LOG.info("Shutting down ingester querier");
    MoreExecutors.shutdownAndAwaitTermination(executorService, Duration.ofSeconds(10));
  }
}
