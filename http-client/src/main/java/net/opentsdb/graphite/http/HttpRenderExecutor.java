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
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import net.opentsdb.graphite.DecodeException;
import net.opentsdb.graphite.GraphiteException;
import net.opentsdb.graphite.StatusException;
import net.opentsdb.graphite.TransportException;
import net.opentsdb.graphite.execution.RenderExecutor;
import net.opentsdb.graphite.query.RenderRequest;
import net.opentsdb.graphite.query.RenderResponse;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.NameValuePair;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Issues render calls against a Graphite {@code /render} endpoint. Small
 * target lists go out as a GET, lists at or over the post threshold are form
 * encoded in a POST body so the URL stays within server limits.
 * <p>
 * Each call blocks the calling thread for at most the configured request
 * timeout. The HTTP client is shared and owned by the caller.
 */
public class HttpRenderExecutor implements RenderExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(HttpRenderExecutor.class);

  public static final String RENDER_ENDPOINT = "/render";
  public static final String METRICS_ENDPOINT = "/metrics/index.json";

  private final CloseableHttpAsyncClient client;
  private final GraphiteClientConfig config;
  private final RenderResponseParser parser;

  public HttpRenderExecutor(final CloseableHttpAsyncClient client,
                            final GraphiteClientConfig config) {
    this(client, config, new RenderResponseParser());
  }

  public HttpRenderExecutor(final CloseableHttpAsyncClient client,
                            final GraphiteClientConfig config,
                            final RenderResponseParser parser) {
    this.client = Preconditions.checkNotNull(client, "Client cannot be null.");
    this.config = Preconditions.checkNotNull(config, "Config cannot be null.");
    this.parser = Preconditions.checkNotNull(parser, "Parser cannot be null.");
  }

  @Override
  public RenderResponse render(final RenderRequest request) throws GraphiteException {
    final HttpUriRequest http = buildRenderRequest(request);
    final HttpEntity entity = call(http);
    try (final InputStream stream = entity.getContent()) {
      final RenderResponse response = parser.parseRender(stream);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Render call [" + http.getMethod() + " " + http.getURI() + "] for "
            + request.targets().size() + " targets returned "
            + response.size() + " series.");
      }
      return response;
    } catch (IOException e) {
      throw new TransportException("Failed to read the body from " + http.getURI(), e);
    }
  }

  /**
   * Lists every metric name the backend knows about.
   * @return The metric names, possibly empty.
   * @throws GraphiteException if the call or decoding failed.
   */
  public List<String> metrics() throws GraphiteException {
    final HttpGet http = new HttpGet(config.url() + METRICS_ENDPOINT);
    final HttpEntity entity = call(http);
    try (final InputStream stream = entity.getContent()) {
      return parser.parseMetrics(stream);
    } catch (IOException e) {
      throw new TransportException("Failed to read the body from " + http.getURI(), e);
    }
  }

  @VisibleForTesting
  HttpUriRequest buildRenderRequest(final RenderRequest request) {
    final List<NameValuePair> params =
        Lists.newArrayListWithCapacity(request.targets().size() + 3);
    params.add(new BasicNameValuePair("format", "json"));
    for (final String target : request.targets()) {
      params.add(new BasicNameValuePair("target", target));
    }
    if (request.start() != null) {
      params.add(new BasicNameValuePair("from",
          Long.toString(request.start().getEpochSecond())));
    }
    if (request.end() != null) {
      params.add(new BasicNameValuePair("until",
          Long.toString(request.end().getEpochSecond())));
    }

    final String uri = config.url() + RENDER_ENDPOINT;
    if (request.targets().size() < config.postThreshold()) {
      try {
        return new HttpGet(new URIBuilder(uri).addParameters(params).build());
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException("Unable to build a render URI from: " + uri, e);
      }
    }
    final HttpPost post = new HttpPost(uri);
    post.setEntity(new UrlEncodedFormEntity(params, StandardCharsets.UTF_8));
    return post;
  }

  /**
   * Sends the request and waits for it. Only a 200 with a body returns, every
   * other outcome is mapped to one of the {@link GraphiteException}s.
   */
  @VisibleForTesting
  HttpEntity call(final HttpUriRequest request) throws GraphiteException {
    final Future<HttpResponse> future = client.execute(request, null);
    final HttpResponse response;
    try {
      response = future.get(config.requestTimeoutMs(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted waiting on " + request.getURI(), e);
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause() == null ? e : e.getCause();
      LOG.warn("Failed calling " + request.getMethod() + " " + request.getURI()
          + ": " + cause.getMessage());
      throw new TransportException("Failed calling " + request.getURI(), cause);
    } catch (TimeoutException e) {
      future.cancel(true);
      LOG.warn("Timed out after " + config.requestTimeoutMs() + "ms calling "
          + request.getURI());
      throw new TransportException("Timed out after " + config.requestTimeoutMs()
          + "ms calling " + request.getURI(), e);
    }

    final int status = response.getStatusLine().getStatusCode();
    if (status != HttpStatus.SC_OK) {
      if (LOG.isTraceEnabled()) {
        LOG.trace("Non-200 status code [" + status + "] for: " + request.getURI());
      }
      EntityUtils.consumeQuietly(response.getEntity());
      throw new StatusException(status, response.getStatusLine().getReasonPhrase());
    }
    if (response.getEntity() == null) {
      throw new DecodeException("No body in the response from " + request.getURI());
    }
    return response.getEntity();
  }
}
