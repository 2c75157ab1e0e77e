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

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

/**
 * The series returned for a render query. When a query was dispatched in
 * shards the order across shards is the order in which they completed.
 */
public class RenderResponse implements Iterable<Series> {

  public static final RenderResponse EMPTY = new RenderResponse(ImmutableList.of());

  private final List<Series> series;

  public RenderResponse(final List<Series> series) {
    this.series = ImmutableList.copyOf(series);
  }

  public List<Series> series() {
    return series;
  }

  public int size() {
    return series.size();
  }

  public boolean isEmpty() {
    return series.isEmpty();
  }

  @Override
  public Iterator<Series> iterator() {
    return series.iterator();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RenderResponse)) {
      return false;
    }
    return series.equals(((RenderResponse) o).series);
  }

  @Override
  public int hashCode() {
    return series.hashCode();
  }

  @Override
  public String toString() {
    return "RenderResponse {series=" + series.size() + "}";
  }
}
