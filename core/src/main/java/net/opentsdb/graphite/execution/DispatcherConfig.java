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

/**
 * Sizing for the {@link BatchQueryDispatcher}. The shard size doubles as the
 * threshold below which a query goes out as one call.
 */
public class DispatcherConfig {

  public static final int DEFAULT_SHARD_SIZE = 20;
  public static final int DEFAULT_WORKERS = 10;

  private final int shardSize;
  private final int workers;

  protected DispatcherConfig(final Builder builder) {
    Preconditions.checkArgument(builder.shardSize > 0,
        "Shard size must be greater than zero: " + builder.shardSize);
    Preconditions.checkArgument(builder.workers > 0,
        "Worker count must be greater than zero: " + builder.workers);
    shardSize = builder.shardSize;
    workers = builder.workers;
  }

  /** @return The maximum number of targets per backend call. */
  public int shardSize() {
    return shardSize;
  }

  /** @return The number of concurrent workers. */
  public int workers() {
    return workers;
  }

  @Override
  public String toString() {
    return "DispatcherConfig {shardSize=" + shardSize + ", workers=" + workers + "}";
  }

  public static DispatcherConfig defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private int shardSize = DEFAULT_SHARD_SIZE;
    private int workers = DEFAULT_WORKERS;

    public Builder setShardSize(final int shardSize) {
      this.shardSize = shardSize;
      return this;
    }

    public Builder setWorkers(final int workers) {
      this.workers = workers;
      return this;
    }

    public DispatcherConfig build() {
      return new DispatcherConfig(this);
    }
  }
}
