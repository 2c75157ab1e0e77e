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
package net.opentsdb.graphite.query;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A render query: an optional absolute time range and the ordered list of
 * targets to fetch. Only absolute times are supported. Targets are kept in
 * the order given and duplicates are not collapsed.
 *
 * <p>Instances are immutable and safe to share between the dispatcher
 * threads.
 */
public class RenderRequest {

  private final Instant start;
  private final Instant end;
  private final List<String> targets;

  protected RenderRequest(final Builder builder) {
    this(builder.start, builder.end, builder.targets);
  }

  private RenderRequest(final Instant start,
                        final Instant end,
                        final List<String> targets) {
    this.start = start;
    this.end = end;
    this.targets = ImmutableList.copyOf(targets);
  }

  /** @return The start of the range, null if unbounded. */
  public Instant start() {
    return start;
  }

  /** @return The end of the range, null if unbounded. */
  public Instant end() {
    return end;
  }

  /** @return The immutable, ordered list of targets. */
  public List<String> targets() {
    return targets;
  }

  /**
   * Builds a request over the same time range with a different target list.
   * Used to turn a shard of targets into the request handed to an executor.
   *
   * @param targets The non-null targets for the new request.
   * @return A new request.
   */
  public RenderRequest withTargets(final List<String> targets) {
    Preconditions.checkNotNull(targets, "Targets cannot be null.");
    return new RenderRequest(start, end, targets);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RenderRequest)) {
      return false;
    }
    final RenderRequest other = (RenderRequest) o;
    return Objects.equals(start, other.start)
        && Objects.equals(end, other.end)
        && targets.equals(other.targets);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end, targets);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append(", targets=")
        .append(targets.size())
        .toString();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static class Builder {
    private Instant start;
    private Instant end;
    private List<String> targets = Lists.newArrayList();

    public Builder setStart(final Instant start) {
      this.start = start;
      return this;
    }

    public Builder setEnd(final Instant end) {
      this.end = end;
      return this;
    }

    public Builder setTargets(final List<String> targets) {
      Preconditions.checkNotNull(targets, "Targets cannot be null.");
      this.targets = Lists.newArrayList(targets);
      return this;
    }

    public Builder addTarget(final String target) {
      targets.add(Preconditions.checkNotNull(target, "Target cannot be null."));
      return this;
    }

    public RenderRequest build() {
      if (start != null && end != null) {
        Preconditions.checkArgument(!end.isBefore(start),
            "End " + end + " is before start " + start);
      }
      return new RenderRequest(this);
    }
  }
}
