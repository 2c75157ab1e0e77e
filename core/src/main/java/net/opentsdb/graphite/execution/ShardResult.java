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
import net.opentsdb.graphite.query.RenderRequest;
import net.opentsdb.graphite.query.RenderResponse;

/** The outcome of one shard: either a response or the error, never both. */
public class ShardResult {

  private final RenderRequest shard;
  private final RenderResponse response;
  private final Throwable error;

  private ShardResult(final RenderRequest shard,
                      final RenderResponse response,
                      final Throwable error) {
    this.shard = shard;
    this.response = response;
    this.error = error;
  }

  public static ShardResult success(final RenderRequest shard,
                                    final RenderResponse response) {
    return new ShardResult(shard,
        Preconditions.checkNotNull(response, "Executor returned a null response."),
        null);
  }

  public static ShardResult failure(final RenderRequest shard, final Throwable error) {
    return new ShardResult(shard, null,
        Preconditions.checkNotNull(error, "Error cannot be null."));
  }

  public boolean failed() {
    return error != null;
  }

  public RenderRequest shard() {
    return shard;
  }

  /** @return The response, null if the shard failed. */
  public RenderResponse response() {
    return response;
  }

  /** @return The error, null if the shard succeeded. */
  public Throwable error() {
    return error;
  }
}
