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

import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import net.opentsdb.graphite.GraphiteException;
import net.opentsdb.graphite.query.RenderResponse;
import net.opentsdb.graphite.query.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Collects shard results for one fan-out query and doubles as its
 * cancellation controller. The first failure cancels the planner, after which
 * the aggregator waits only for the shards that already went out, then
 * rethrows that failure as-is. Successful series are dropped in that case so
 * a caller never gets a partial response.
 *
 * <p>Workers publish into an unbounded queue so {@link #publish(ShardResult)}
 * never blocks, even after the aggregator has given up.
 */
public class ResultAggregator {
  private static final Logger LOG = LoggerFactory.getLogger(ResultAggregator.class);

  private final ShardPlanner planner;
  private final BlockingQueue<ShardResult> results;

  public ResultAggregator(final ShardPlanner planner) {
    this.planner = planner;
    this.results = new LinkedBlockingQueue<ShardResult>();
  }

  /** Called by the workers, once per shard. */
  public void publish(final ShardResult result) {
    results.add(result);
  }

  /**
   * Blocks until every dispatched shard has reported.
   *
   * @return The merged series in completion order.
   * @throws GraphiteException The first shard failure if it was one, or a
   * wrapper if the thread was interrupted.
   */
  public RenderResponse aggregate() throws GraphiteException {
    final List<Series> merged = Lists.newArrayList();
    Throwable first = null;
    int received = 0;
    try {
      while (received < expected()) {
        final ShardResult result = results.take();
        received++;
        if (result.failed()) {
          if (first == null) {
            first = result.error();
            planner.cancel();
            merged.clear();
            LOG.error("Shard of " + result.shard().targets().size()
                + " targets failed, cancelling the remaining "
                + (planner.shardCount() - planner.dispatched()) + " shards.", first);
          } else if (LOG.isDebugEnabled()) {
            LOG.debug("Ignoring additional shard failure", result.error());
          }
        } else if (first == null) {
          merged.addAll(result.response().series());
        }
      }
    } catch (InterruptedException e) {
      planner.cancel();
      Thread.currentThread().interrupt();
      throw new GraphiteException("Interrupted while waiting on shard results", e);
    }

    if (first != null) {
      Throwables.throwIfInstanceOf(first, GraphiteException.class);
      Throwables.throwIfUnchecked(first);
      throw new GraphiteException(first);
    }
    if (received < planner.shardCount()) {
      throw new GraphiteException("Query was cancelled after " + received
          + " of " + planner.shardCount() + " shards.");
    }
    return new RenderResponse(merged);
  }

  /**
   * Once cancelled the planner's dispatch count is final, otherwise every
   * shard will eventually be dispatched.
   */
  private int expected() {
    return planner.isCancelled() ? planner.dispatched() : planner.shardCount();
  }
}
