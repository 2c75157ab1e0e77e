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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import net.opentsdb.graphite.GraphiteException;
import net.opentsdb.graphite.query.DataPoint;
import net.opentsdb.graphite.query.RenderRequest;
import net.opentsdb.graphite.query.RenderResponse;
import net.opentsdb.graphite.query.Series;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test executor that answers each target with a single series and can be told
 * to fail calls whose first target matches, or to hold each call for a while.
 */
public class MockRenderExecutor implements RenderExecutor {

  final ConcurrentLinkedQueue<RenderRequest> calls = new ConcurrentLinkedQueue<>();
  final Map<String, Exception> failures = new ConcurrentHashMap<>();
  final AtomicInteger inFlight = new AtomicInteger();
  final AtomicInteger maxInFlight = new AtomicInteger();
  volatile long delayMs;

  MockRenderExecutor failOn(final String firstTarget, final Exception e) {
    failures.put(firstTarget, e);
    return this;
  }

  MockRenderExecutor delay(final long delayMs) {
    this.delayMs = delayMs;
    return this;
  }

  @Override
  public RenderResponse render(final RenderRequest request) throws GraphiteException {
    calls.add(request);
    final int current = inFlight.incrementAndGet();
    maxInFlight.accumulateAndGet(current, Math::max);
    try {
      if (delayMs > 0) {
        try {
          Thread.sleep(delayMs);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new GraphiteException("Interrupted", e);
        }
      }
      final Exception e = failures.get(request.targets().get(0));
      if (e instanceof GraphiteException) {
        throw (GraphiteException) e;
      } else if (e instanceof RuntimeException) {
        throw (RuntimeException) e;
      }

      final List<Series> series = Lists.newArrayList();
      for (final String target : request.targets()) {
        series.add(new Series(target, ImmutableList.of(new DataPoint(1.0, 1617235200L))));
      }
      return new RenderResponse(series);
    } finally {
      inFlight.decrementAndGet();
    }
  }

  List<Integer> callSizes() {
    final List<Integer> sizes = Lists.newArrayList();
    for (final RenderRequest call : calls) {
      sizes.add(call.targets().size());
    }
    return sizes;
  }

  static List<String> targets(final int count) {
    final List<String> targets = Lists.newArrayListWithCapacity(count);
    for (int i = 0; i < count; i++) {
      targets.add("sys.cpu.user.t" + i);
    }
    return targets;
  }
}
