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

import java.util.Objects;

/** One sample of a series. Graphite reports gaps as a null value. */
public class DataPoint {

  private final Double value;
  private final long timestamp;

  public DataPoint(final Double value, final long timestamp) {
    this.value = value;
    this.timestamp = timestamp;
  }

  /** @return The value or null if the backend had no data for the slot. */
  public Double value() {
    return value;
  }

  /** @return The unix epoch timestamp in seconds. */
  public long timestamp() {
    return timestamp;
  }

  public boolean hasValue() {
    return value != null;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataPoint)) {
      return false;
    }
    final DataPoint other = (DataPoint) o;
    return timestamp == other.timestamp && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, timestamp);
  }

  @Override
  public String toString() {
    return "[" + value + ", " + timestamp + "]";
  }
}
