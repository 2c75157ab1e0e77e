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

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import net.opentsdb.graphite.query.RenderRequest;

import java.util.List;

/**
 * Hands out the targets of a request in contiguous shards of at most
 * {@code shardSize} targets, in order. Shards are materialized only when a
 * worker asks for one so a cancelled plan never builds the rest.
 *
 * <p>INVARIANTS:
 * <ul>
 * <li>Concatenating the emitted shards gives back the original targets.</li>
 * <li>Once {@link #cancel()} returns, {@link #next()} returns null and
 * {@link #dispatched()} no longer changes.</li>
 * </ul>
 * Thread safe.
 */
public class ShardPlanner {

  private final RenderRequest request;
  private final List<List<String>> shards;

  private int nextShard;
  private boolean cancelled;

  public ShardPlanner(final RenderRequest request, final int shardSize) {
    Preconditions.checkNotNull(request, "Request cannot be null.");
    Preconditions.checkArgument(shardSize > 0,
        "Shard size must be greater than zero: " + shardSize);
    this.request = request;
    // a view, nothing is copied here.
    this.shards = Lists.partition(request.targets(), shardSize);
  }

  /**
   * @return The next shard bound to the request's time range or null if the
   * targets are exhausted or the plan was cancelled.
   */
  public synchronized RenderRequest next() {
    if (cancelled || nextShard >= shards.size()) {
      return null;
    }
    return request.withTargets(shards.get(nextShard++));
  }

  /**
   * Stops the plan. Never blocks and may be called any number of times,
   * including after the last shard went out.
   *
   * @return True if this call cancelled the plan, false if it was already
   * cancelled.
   */
  public synchronized boolean cancel() {
    if (cancelled) {
      return false;
    }
    cancelled = true;
    return true;
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  /** @return How many shards were handed out so far. */
  public synchronized int dispatched() {
    return nextShard;
  }

  /** @return The total number of shards in the plan. */
  public int shardCount() {
    return shards.size();
  }
}
