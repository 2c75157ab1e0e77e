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

import net.opentsdb.graphite.query.RenderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Pulls shards off the planner until it runs dry, calling the executor for
 * each and publishing exactly one result per shard taken. A cancelled plan
 * simply looks dry, so a worker finishes its current call and exits.
 */
public class ShardWorker implements Runnable {
  private static final Logger LOG = LoggerFactory.getLogger(ShardWorker.class);

  private final ShardPlanner planner;
  private final RenderExecutor executor;
  private final Consumer<ShardResult> sink;

  public ShardWorker(final ShardPlanner planner,
                     final RenderExecutor executor,
                     final Consumer<ShardResult> sink) {
    this.planner = planner;
    this.executor = executor;
    this.sink = sink;
  }

  @Override
  public void run() {
    int completed = 0;
    RenderRequest shard;
    while ((shard = planner.next()) != null) {
      ShardResult result;
      try {
        result = ShardResult.success(shard, executor.render(shard));
      } catch (Throwable t) {
        // anything, even an Error, has to reach the aggregator or it waits
        // forever on this shard.
        result = ShardResult.failure(shard, t);
      }
      sink.accept(result);
      completed++;
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("Worker " + Thread.currentThread().getName() + " exiting after "
          + completed + " shards.");
    }
  }
}
