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

import com.google.common.annotations.VisibleForTesting;
import net.opentsdb.graphite.GraphiteException;
import net.opentsdb.graphite.execution.BatchQueryDispatcher;
import net.opentsdb.graphite.query.RenderRequest;
import net.opentsdb.graphite.query.RenderResponse;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.impl.nio.client.HttpAsyncClients;
import org.apache.http.impl.nio.reactor.IOReactorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Entry point for querying a Graphite backend. Render queries are sharded and
 * run concurrently by a {@link BatchQueryDispatcher}; the metrics listing is a
 * single call. Close the client to release the worker pool and connections.
 */
public class GraphiteClient implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(GraphiteClient.class);

  private final GraphiteClientConfig config;
  private final CloseableHttpAsyncClient client;
  private final HttpRenderExecutor executor;
  private final BatchQueryDispatcher dispatcher;
  private volatile boolean closed;

  public GraphiteClient(final GraphiteClientConfig config) {
    this(config, newHttpClient(config));
    client.start();
    LOG.info("Started Graphite client: " + config);
  }

  @VisibleForTesting
  GraphiteClient(final GraphiteClientConfig config,
                 final CloseableHttpAsyncClient client) {
    this.config = config;
    this.client = client;
    executor = new HttpRenderExecutor(client, config);
    dispatcher = new BatchQueryDispatcher(executor, config.toDispatcherConfig());
  }

  public static GraphiteClient fromUrl(final String url) {
    return new GraphiteClient(GraphiteClientConfig.fromUrl(url));
  }

  /**
   * Fetches the series for every target in the request.
   * @param request The non-null request.
   * @return The series from all shards, or {@link RenderResponse#EMPTY} when
   * the request has no targets.
   * @throws GraphiteException the first failure from any shard.
   */
  public RenderResponse query(final RenderRequest request) throws GraphiteException {
    return dispatcher.query(request);
  }

  /** @return Every metric name the backend knows about. */
  public List<String> metrics() throws GraphiteException {
    return executor.metrics();
  }

  public GraphiteClientConfig config() {
    return config;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    dispatcher.close();
    try {
      client.close();
    } catch (IOException e) {
      LOG.error("Failed to close HttpClient", e);
    }
  }

  static CloseableHttpAsyncClient newHttpClient(final GraphiteClientConfig config) {
    return HttpAsyncClients.custom()
        .setDefaultIOReactorConfig(IOReactorConfig.custom()
            .setIoThreadCount(config.ioThreads())
            .setConnectTimeout(config.connectTimeoutMs())
            .setSoKeepAlive(true)
            .setTcpNoDelay(true)
            .setSoTimeout(config.socketTimeoutMs())
            .build())
        .setDefaultRequestConfig(RequestConfig.custom()
            .setConnectTimeout(config.connectTimeoutMs())
            .setSocketTimeout(config.socketTimeoutMs())
            .build())
        .setMaxConnTotal(config.maxConnections())
        .setMaxConnPerRoute(config.maxConnections())
        .build();
  }
}
