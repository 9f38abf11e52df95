package com.slack.querier.quorum;

import brave.Tracing;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.slack.querier.ring.ReplicaDescriptor;
import com.slack.querier.ring.ReplicaSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a function against the replicas of a replica set until enough of them have succeeded.
 *
 * <p>Replicas are grouped for the quorum computation. In a zone aware set each zone is a group and
 * a group succeeds only once every replica in it has succeeded; otherwise every replica is its own
 * group. The read succeeds as soon as the required number of groups have succeeded, at which point
 * the remaining calls are cancelled. It fails as soon as too many groups have failed for the
 * quorum to be reachable, with the last error observed as the cause.
 *
 * <p>Every successful response that is not returned to the caller, because its group failed,
 * because quorum was reached by other groups, or because it arrived after the read finished, is
 * handed to the cleanup function.
 *
 * <p>The accept function sees every response at the moment it is counted towards its group, while
 * the read still holds its lock, so it must not block. Responses of calls that were cancelled, or
 * that arrive after the read finished, are never accepted.
 */
public class QuorumExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(QuorumExecutor.class);

  private final ListeningExecutorService executorService;

  public QuorumExecutor(ListeningExecutorService executorService) {
    this.executorService = executorService;
  }

  public <T> ListenableFuture<List<ReplicaResponse<T>>> doUntilQuorum(
      ReplicaSet replicaSet,
      QuorumConfig quorumConfig,
      ReplicaFunction<T> function,
      Consumer<ReplicaResponse<T>> cleanup) {
    return doUntilQuorum(replicaSet, quorumConfig, function, (accepted) -> {}, cleanup);
  }

  public <T> ListenableFuture<List<ReplicaResponse<T>>> doUntilQuorum(
      ReplicaSet replicaSet,
      QuorumConfig quorumConfig,
      ReplicaFunction<T> function,
      Consumer<ReplicaResponse<T>> accept,
      Consumer<ReplicaResponse<T>> cleanup) {
    if (replicaSet.isEmpty()) {
      return Futures.immediateFuture(List.of());
    }
    QuorumCall<T> call = new QuorumCall<>(replicaSet, quorumConfig, function, accept, cleanup);
    call.start();
    return call.result;
  }

  /** Submits a task, carrying over the current trace context. */
  public <T> ListenableFuture<T> submit(Callable<T> task) {
    Tracing tracing = Tracing.current();
    if (tracing != null) {
      return executorService.submit(tracing.currentTraceContext().wrap(task));
    }
    return executorService.submit(task);
  }

  private static List<List<ReplicaDescriptor>> toGroups(ReplicaSet replicaSet) {
    if (replicaSet.isZoneAware()) {
      return new ArrayList<>(replicaSet.replicasByZone().values());
    }
    List<List<ReplicaDescriptor>> groups = new ArrayList<>(replicaSet.size());
    for (ReplicaDescriptor replica : replicaSet.replicas) {
      groups.add(List.of(replica));
    }
    return groups;
  }

  private static int requiredGroups(ReplicaSet replicaSet, int groupCount) {
    if (replicaSet.isZoneAware()) {
      return Math.max(1, groupCount - replicaSet.maxUnavailableZones);
    }
    return groupCount - replicaSet.maxErrors;
  }

  private class QuorumCall<T> {
    private final List<List<ReplicaDescriptor>> groups;
    private final int required;
    private final boolean minimizeRequests;
    private final ReplicaFunction<T> function;
    private final Consumer<ReplicaResponse<T>> accept;
    private final Consumer<ReplicaResponse<T>> cleanup;
    private final SettableFuture<List<ReplicaResponse<T>>> result = SettableFuture.create();

    // all of the below are guarded by this
    private final int[] pending;
    private final boolean[] failed;
    private final List<List<ReplicaResponse<T>>> groupResponses;
    private final List<List<ListenableFuture<T>>> groupTasks;
    private final List<Integer> succeededGroups = new ArrayList<>();
    private int failedGroups = 0;
    private int startedGroups = 0;
    private Throwable lastError;
    private boolean finished = false;

    QuorumCall(
        ReplicaSet replicaSet,
        QuorumConfig quorumConfig,
        ReplicaFunction<T> function,
        Consumer<ReplicaResponse<T>> accept,
        Consumer<ReplicaResponse<T>> cleanup) {
      this.groups = toGroups(replicaSet);
      this.required = requiredGroups(replicaSet, groups.size());
      this.minimizeRequests = quorumConfig.minimizeRequests();
      this.function = function;
      this.accept = accept;
      this.cleanup = cleanup;
      if (minimizeRequests) {
        // spread the load when we only hit a subset of the replicas
        Collections.shuffle(groups, ThreadLocalRandom.current());
      }

      this.pending = new int[groups.size()];
      this.failed = new boolean[groups.size()];
      this.groupResponses = new ArrayList<>(groups.size());
      this.groupTasks = new ArrayList<>(groups.size());
      for (int i = 0; i < groups.size(); i++) {
        pending[i] = groups.get(i).size();
        groupResponses.add(new ArrayList<>());
        groupTasks.add(new ArrayList<>());
      }

      result.addListener(
          () -> {
            if (result.isCancelled()) {
              abort();
            }
          },
          MoreExecutors.directExecutor());
    }

    void start() {
      int initialGroups = minimizeRequests ? required : groups.size();
      synchronized (this) {
        while (!finished && startedGroups < groups.size() && startedGroups < initialGroups) {
          startNextGroup();
        }
      }
    }

    // must hold the lock
    private void startNextGroup() {
      int group = startedGroups++;
      for (ReplicaDescriptor replica : groups.get(group)) {
        ListenableFuture<T> task = submit(() -> function.apply(replica));
        groupTasks.get(group).add(task);
        Futures.addCallback(
            task,
            new FutureCallback<>() {
              @Override
              public void onSuccess(T response) {
                handleSuccess(group, new ReplicaResponse<>(replica.address, response));
              }

              @Override
              public void onFailure(Throwable t) {
                handleFailure(group, replica, t);
              }
            },
            MoreExecutors.directExecutor());
      }
    }

    private void handleSuccess(int group, ReplicaResponse<T> response) {
      List<ReplicaResponse<T>> unused = new ArrayList<>();
      List<ListenableFuture<T>> toCancel = new ArrayList<>();
      List<ReplicaResponse<T>> quorum = null;

      synchronized (this) {
        if (finished || failed[group]) {
          unused.add(response);
        } else {
          accept.accept(response);
          groupResponses.get(group).add(response);
          pending[group]--;
          if (pending[group] == 0) {
            succeededGroups.add(group);
          }
          if (succeededGroups.size() == required) {
            finished = true;
            quorum = new ArrayList<>();
            for (int i = 0; i < groups.size(); i++) {
              if (succeededGroups.contains(i)) {
                quorum.addAll(groupResponses.get(i));
              } else {
                unused.addAll(groupResponses.get(i));
              }
              groupResponses.get(i).clear();
              toCancel.addAll(groupTasks.get(i));
            }
          }
        }
      }

      if (quorum != null) {
        LOG.debug("Reached quorum with {} responses", quorum.size());
        cancel(toCancel);
        if (!result.set(quorum)) {
          // the caller gave up before we could hand the responses over
          unused.addAll(quorum);
        }
      }
      cleanup(unused);
    }

    private void handleFailure(int group, ReplicaDescriptor replica, Throwable t) {
      List<ReplicaResponse<T>> unused = new ArrayList<>();
      List<ListenableFuture<T>> toCancel = new ArrayList<>();
      QuorumNotReachedException error = null;

      synchronized (this) {
        if (finished) {
          LOG.trace("Ignoring failure from ingester={} after the read finished", replica.address);
          return;
        }
        if (failed[group]) {
          return;
        }
        LOG.debug("Call to ingester={} failed", replica.address, t);
        lastError = t;
        failed[group] = true;
        failedGroups++;
        unused.addAll(groupResponses.get(group));
        groupResponses.get(group).clear();
        toCancel.addAll(groupTasks.get(group));

        if (groups.size() - failedGroups < required) {
          finished = true;
          for (int i = 0; i < groups.size(); i++) {
            unused.addAll(groupResponses.get(i));
            groupResponses.get(i).clear();
            toCancel.addAll(groupTasks.get(i));
          }
          error =
              new QuorumNotReachedException(
                  String.format(
                      "Quorum not reached, %d of %d replica groups failed and %d are required",
                      failedGroups, groups.size(), required),
                  lastError);
        } else if (minimizeRequests && startedGroups < groups.size()) {
          startNextGroup();
        }
      }

      cancel(toCancel);
      cleanup(unused);
      if (error != null) {
        result.setException(error);
      }
    }

    private void abort() {
      List<ReplicaResponse<T>> unused = new ArrayList<>();
      List<ListenableFuture<T>> toCancel = new ArrayList<>();
      synchronized (this) {
        if (finished) {
          return;
        }
        finished = true;
        for (int i = 0; i < groups.size(); i++) {
          unused.addAll(groupResponses.get(i));
          groupResponses.get(i).clear();
          toCancel.addAll(groupTasks.get(i));
        }
      }
      LOG.debug("Read was cancelled before reaching quorum");
      cancel(toCancel);
      cleanup(unused);
    }

    private void cancel(List<ListenableFuture<T>> tasks) {
      for (ListenableFuture<T> task : tasks) {
        if (!task.isDone()) {
          task.cancel(true);
        }
      }
    }

    private void cleanup(List<ReplicaResponse<T>> unused) {
      for (ReplicaResponse<T> response : unused) {
        try {
          cleanup.accept(response);
        } catch (RuntimeException e) {
          LOG.warn("Cleanup of unused response from ingester={} failed", response.address(), e);
        }
      }
    }
  }
}
