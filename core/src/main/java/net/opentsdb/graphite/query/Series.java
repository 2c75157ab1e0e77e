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

import java.util.List;
import java.util.Objects;

/** The data for a single target. */
public class Series {

  private final String target;
  private final List<DataPoint> datapoints;

  public Series(final String target, final List<DataPoint> datapoints) {
    this.target = Preconditions.checkNotNull(target, "Target cannot be null.");
    this.datapoints = ImmutableList.copyOf(
        Preconditions.checkNotNull(datapoints, "Datapoints cannot be null."));
  }

  public String target() {
    return target;
  }

  public List<DataPoint> datapoints() {
    return datapoints;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Series)) {
      return false;
    }
    final Series other = (Series) o;
    return target.equals(other.target) && datapoints.equals(other.datapoints);
  }

  @Override
  public int hashCode() {
    return Objects.hash(target, datapoints);
  }

  @Override
  public String toString() {
    return "Series {target=" + target + ", datapoints=" + datapoints.size() + "}";
  }
}
