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

package net.opentsdb.graphite.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import net.opentsdb.graphite.DecodeException;
import net.opentsdb.graphite.GraphiteException;
import net.opentsdb.graphite.TransportException;
import net.opentsdb.graphite.query.DataPoint;
import net.opentsdb.graphite.query.RenderResponse;
import net.opentsdb.graphite.query.Series;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Decodes the JSON bodies Graphite returns. A render body looks like:
 * <pre>
 * [{"target": "sys.cpu.user", "datapoints": [[1.5, 1617235200], [null, 1617235260]]}]
 * </pre>
 * and a metrics index body is a flat array of metric names. Anything else is
 * a {@link DecodeException}.
 */
public class RenderResponseParser {

  private final ObjectMapper mapper;

  public RenderResponseParser() {
    this(new ObjectMapper());
  }

  public RenderResponseParser(final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public RenderResponse parseRender(final InputStream stream) throws GraphiteException {
    final JsonNode root = read(stream);
    if (!root.isArray()) {
      throw new DecodeException("Expected an array of series but got: "
          + root.getNodeType());
    }
    if (root.size() == 0) {
      return RenderResponse.EMPTY;
    }

    final List<Series> series = Lists.newArrayListWithCapacity(root.size());
    for (int i = 0; i < root.size(); i++) {
      series.add(parseSeries(root.get(i), i));
    }
    return new RenderResponse(series);
  }

  public List<String> parseMetrics(final InputStream stream) throws GraphiteException {
    final JsonNode root = read(stream);
    if (!root.isArray()) {
      throw new DecodeException("Expected an array of metric names but got: "
          + root.getNodeType());
    }
    final ImmutableList.Builder<String> metrics = ImmutableList.builder();
    for (int i = 0; i < root.size(); i++) {
      final JsonNode node = root.get(i);
      if (!node.isTextual()) {
        throw new DecodeException("Metric name at index " + i
            + " is not a string: " + node);
      }
      metrics.add(node.asText());
    }
    return metrics.build();
  }

  Series parseSeries(final JsonNode node, final int index) throws DecodeException {
    if (!node.isObject()) {
      throw new DecodeException("Series at index " + index
          + " is not an object: " + node.getNodeType());
    }
    final JsonNode target = node.get("target");
    if (target == null || !target.isTextual()) {
      throw new DecodeException("Series at index " + index
          + " is missing a string target.");
    }

    final JsonNode datapoints = node.get("datapoints");
    if (datapoints == null || datapoints.isNull()) {
      return new Series(target.asText(), ImmutableList.of());
    }
    if (!datapoints.isArray()) {
      throw new DecodeException("Datapoints for " + target.asText()
          + " are not an array: " + datapoints.getNodeType());
    }

    final List<DataPoint> points = Lists.newArrayListWithCapacity(datapoints.size());
    for (final JsonNode pair : datapoints) {
      if (!pair.isArray() || pair.size() != 2) {
        throw new DecodeException("Datapoint for " + target.asText()
            + " is not a [value, timestamp] pair: " + pair);
      }
      final JsonNode value = pair.get(0);
      final JsonNode timestamp = pair.get(1);
      if (!value.isNull() && !value.isNumber()) {
        throw new DecodeException("Datapoint value for " + target.asText()
            + " is not a number: " + value);
      }
      if (!timestamp.isNumber() || !timestamp.canConvertToLong()) {
        throw new DecodeException("Datapoint timestamp for " + target.asText()
            + " is not an integer: " + timestamp);
      }
      points.add(new DataPoint(value.isNull() ? null : value.doubleValue(),
          timestamp.longValue()));
    }
    return new Series(target.asText(), points);
  }

  private JsonNode read(final InputStream stream) throws GraphiteException {
    final JsonNode root;
    try {
      root = mapper.readTree(stream);
    } catch (JsonProcessingException e) {
      throw new DecodeException("Failed to parse the response body", e);
    } catch (IOException e) {
      throw new TransportException("Failed to read the response body", e);
    }
    if (root == null || root.isMissingNode()) {
      throw new DecodeException("Empty response body");
    }
    return root;
  }
}
