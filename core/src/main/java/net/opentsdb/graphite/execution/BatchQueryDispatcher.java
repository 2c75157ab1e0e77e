/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.opentsdb.graphite.execution;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import net.opentsdb.graphite.GraphiteException;
import net.opentsdb.graphite.query.RenderRequest;
import net.opentsdb.graphite.query.RenderResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for render queries. Small queries, up to the shard size, go to
 * the executor as a single call and its result is returned untouched. Larger
 * queries are split by a {@link ShardPlanner}, run on a fixed pool of
 * {@link ShardWorker}s and merged by a {@link ResultAggregator}. Any shard
 * failure fails the whole query with that shard's exception.
 *
 * <p>Queries with no targets return {@link RenderResponse#EMPTY} without
 * calling the executor.
 */
public class BatchQueryDispatcher implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(BatchQueryDispatcher.class);

  private static final long SHUTDOWN_WAIT_MS = 5_000;

  private final RenderExecutor executor;
  private final DispatcherConfig config;
  private final ExecutorService workers;
  private volatile boolean closed;

  public BatchQueryDispatcher(final RenderExecutor executor,
                              final DispatcherConfig config) {
    this(executor, config, Executors.newFixedThreadPool(config.workers(),
        new ThreadFactoryBuilder()
            .setNameFormat("graphite-render-%d")
            .setDaemon(true)
            .build()));
  }

  @VisibleForTesting
  BatchQueryDispatcher(final RenderExecutor executor,
                       final DispatcherConfig config,
                       final ExecutorService workers) {
    this.executor = Preconditions.checkNotNull(executor, "Executor cannot be null.");
    this.config = Preconditions.checkNotNull(config, "Config cannot be null.");
    this.workers = Preconditions.checkNotNull(workers, "Worker pool cannot be null.");
  }

  /**
   * Runs the query.
   *
   * @param request The non-null request.
   * @return The complete response. Never a partial one.
   * @throws GraphiteException The executor's exception for the failed call,
   * unwrapped.
   * @throws IllegalStateException If the dispatcher was closed.
   */
  public RenderResponse query(final RenderRequest request) throws GraphiteException {
    Preconditions.checkNotNull(request, "Request cannot be null.");
    Preconditions.checkState(!closed, "Dispatcher has been closed.");

    final int targets = request.targets().size();
    if (targets == 0) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("No targets in request, returning an empty response.");
      }
      return RenderResponse.EMPTY;
    }
    if (targets <= config.shardSize()) {
      return executor.render(request);
    }
    return fanOut(request);
  }

  private RenderResponse fanOut(final RenderRequest request) throws GraphiteException {
    final long start = System.nanoTime();
    final ShardPlanner planner = new ShardPlanner(request, config.shardSize());
    final ResultAggregator aggregator = new ResultAggregator(planner);
    final int numWorkers = Math.min(config.workers(), planner.shardCount());
    if (LOG.isDebugEnabled()) {
      LOG.debug("Splitting {} targets into {} shards across {} workers.",
          request.targets().size(), planner.shardCount(), numWorkers);
    }

    for (int i = 0; i < numWorkers; i++) {
      try {
        workers.execute(new ShardWorker(planner, executor, aggregator::publish));
      } catch (RejectedExecutionException e) {
        if (i == 0) {
          planner.cancel();
          throw new IllegalStateException("Dispatcher worker pool rejected the query.", e);
        }
        // the workers already running will drain the plan.
        LOG.warn("Only started {} of {} workers for the query.", i, numWorkers, e);
        break;
      }
    }

    final RenderResponse response = aggregator.aggregate();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Merged {} series from {} shards in {}ms",
          response.size(), planner.shardCount(),
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
    return response;
  }

  @VisibleForTesting
  DispatcherConfig config() {
    return config;
  }

  /**
   * Stops the worker pool. Queries in flight are allowed to finish for a few
   * seconds before the workers are interrupted.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    workers.shutdown();
    try {
      if (!workers.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
        LOG.warn("Render workers did not stop within " + SHUTDOWN_WAIT_MS
            + "ms, interrupting them.");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
