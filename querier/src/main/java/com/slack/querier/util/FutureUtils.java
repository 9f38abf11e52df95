package com.slack.querier.util;

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import io.grpc.Status;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

public class FutureUtils {

  private FutureUtils() {}

  /**
   * Starts one job per element and concatenates their results in job order. If any job fails, the
   * returned future fails with the same error and the jobs still running are cancelled.
   */
  public static <J, R> ListenableFuture<List<R>> forEachJobMergeResults(
      List<J> jobs, Function<J, ListenableFuture<List<R>>> fn) {
    List<ListenableFuture<List<R>>> futures = new ArrayList<>(jobs.size());
    for (J job : jobs) {
      futures.add(fn.apply(job));
    }

    ListenableFuture<List<List<R>>> all = Futures.allAsList(futures);
    Futures.addCallback(
        all,
        new FutureCallback<>() {
          @Override
          public void onSuccess(List<List<R>> result) {}

          @Override
          public void onFailure(Throwable t) {
            futures.forEach((future) -> future.cancel(true));
          }
        },
        MoreExecutors.directExecutor());

    return Futures.transform(
        all,
        (results) -> {
          List<R> merged = new ArrayList<>();
          for (List<R> result : results) {
            merged.addAll(result);
          }
          return merged;
        },
        MoreExecutors.directExecutor());
  }

  /**
   * Waits for the future for at most the given time. The future is cancelled when the time runs
   * out or the waiting thread is interrupted, and the failure is reported as the matching gRPC
   * status. Unchecked failures of the future are rethrown as is.
   */
  public static <T> T await(ListenableFuture<T> future, Duration timeout) {
    try {
      return future.get(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw Status.DEADLINE_EXCEEDED
          .withDescription("Deadline exceeded waiting for the ingesters")
          .withCause(e)
          .asRuntimeException();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw Status.CANCELLED
          .withDescription("Interrupted while waiting for the ingesters")
          .withCause(e)
          .asRuntimeException();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new RuntimeException(cause);
    }
  }
}
