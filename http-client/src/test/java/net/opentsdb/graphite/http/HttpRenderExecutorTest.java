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

import com.google.common.collect.ImmutableList;
import net.opentsdb.graphite.DecodeException;
import net.opentsdb.graphite.StatusException;
import net.opentsdb.graphite.TransportException;
import net.opentsdb.graphite.query.RenderRequest;
import net.opentsdb.graphite.query.RenderResponse;
import org.apache.http.HttpResponse;
import org.apache.http.NameValuePair;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.ConnectException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static net.opentsdb.graphite.http.HttpFixtures.fail;
import static net.opentsdb.graphite.http.HttpFixtures.ok;
import static net.opentsdb.graphite.http.HttpFixtures.params;
import static net.opentsdb.graphite.http.HttpFixtures.respond;
import static net.opentsdb.graphite.http.HttpFixtures.values;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class HttpRenderExecutorTest {

  private static final Instant START = Instant.ofEpochSecond(1617235200L);
  private static final Instant END = Instant.ofEpochSecond(1617238800L);

  @Mock
  private CloseableHttpAsyncClient client;

  private GraphiteClientConfig config;
  private HttpRenderExecutor executor;

  @BeforeEach
  public void before() {
    config = GraphiteClientConfig.newBuilder()
        .setUrl("graphite.example.com:8080/graphite")
        .setRequestTimeoutMs(200)
        .build();
    executor = new HttpRenderExecutor(client, config);
  }

  @Test
  public void smallRenderIsGet() throws Exception {
    final RenderRequest request = RenderRequest.newBuilder()
        .setStart(START)
        .setEnd(END)
        .addTarget("sys.cpu.user")
        .addTarget("sys.if.in{host=web01}")
        .build();

    final HttpUriRequest http = executor.buildRenderRequest(request);
    assertEquals("GET", http.getMethod());
    assertEquals("/graphite/render", http.getURI().getPath());
    assertEquals("graphite.example.com", http.getURI().getHost());
    assertEquals(8080, http.getURI().getPort());

    final List<NameValuePair> params = params(http);
    assertEquals(ImmutableList.of("json"), values(params, "format"));
    assertEquals(ImmutableList.of("sys.cpu.user", "sys.if.in{host=web01}"),
        values(params, "target"));
    assertEquals(ImmutableList.of("1617235200"), values(params, "from"));
    assertEquals(ImmutableList.of("1617238800"), values(params, "until"));
  }

  @Test
  public void openRangeOmitsFromAndUntil() {
    final HttpUriRequest http = executor.buildRenderRequest(
        RenderRequest.newBuilder().addTarget("a").build());
    final List<NameValuePair> params = params(http);
    assertTrue(values(params, "from").isEmpty());
    assertTrue(values(params, "until").isEmpty());
    assertEquals(ImmutableList.of("a"), values(params, "target"));
  }

  @Test
  public void postThresholdSwitchesToPost() {
    assertEquals("GET", executor.buildRenderRequest(request(29)).getMethod());

    final HttpUriRequest post = executor.buildRenderRequest(request(30));
    assertEquals("POST", post.getMethod());
    assertEquals("/graphite/render", post.getURI().getPath());
    assertEquals(null, post.getURI().getQuery());
    final List<NameValuePair> params = params(post);
    assertEquals(30, values(params, "target").size());
    assertEquals("t0", values(params, "target").get(0));
    assertEquals("t29", values(params, "target").get(29));
    assertEquals(ImmutableList.of("json"), values(params, "format"));
    assertEquals(ImmutableList.of("1617235200"), values(params, "from"));
  }

  @Test
  public void renderDecodesBody() throws Exception {
    when(client.execute(any(HttpUriRequest.class), isNull())).thenReturn(ok(
        "[{\"target\": \"t0\", \"datapoints\": [[1.0, 1617235200], [null, 1617235260]]}]"));

    final RenderResponse response = executor.render(request(1));
    assertEquals(1, response.size());
    assertEquals("t0", response.series().get(0).target());
    assertEquals(2, response.series().get(0).datapoints().size());
  }

  @Test
  public void renderSendsBuiltRequest() throws Exception {
    when(client.execute(any(HttpUriRequest.class), isNull())).thenReturn(ok("[]"));

    executor.render(request(31));
    final ArgumentCaptor<HttpUriRequest> captor =
        ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(client).execute(captor.capture(), isNull());
    assertEquals("POST", captor.getValue().getMethod());
    assertEquals(31, values(params(captor.getValue()), "target").size());
  }

  @Test
  public void non200IsStatusException() {
    when(client.execute(any(HttpUriRequest.class), isNull()))
        .thenReturn(respond(404, "Not Found", "<html>nope</html>"));

    final StatusException e = assertThrows(StatusException.class,
        () -> executor.render(request(1)));
    assertEquals(404, e.statusCode());
    assertEquals("404 Not Found", e.statusText());
    assertEquals("404 Not Found", e.getMessage());
  }

  @Test
  public void badBodyIsDecodeException() {
    when(client.execute(any(HttpUriRequest.class), isNull()))
        .thenReturn(ok("{\"error\": \"not a series list\"}"));
    assertThrows(DecodeException.class, () -> executor.render(request(1)));
  }

  @Test
  public void missingBodyIsDecodeException() {
    when(client.execute(any(HttpUriRequest.class), isNull()))
        .thenReturn(respond(200, "OK", null));
    assertThrows(DecodeException.class, () -> executor.render(request(1)));
  }

  @Test
  public void connectionFailureIsTransportException() {
    final ConnectException refused = new ConnectException("Connection refused");
    when(client.execute(any(HttpUriRequest.class), isNull())).thenReturn(fail(refused));

    final TransportException e = assertThrows(TransportException.class,
        () -> executor.render(request(1)));
    assertSame(refused, e.getCause());
  }

  @Test
  public void timeoutIsTransportException() {
    final CompletableFuture<HttpResponse> never = new CompletableFuture<>();
    when(client.execute(any(HttpUriRequest.class), isNull())).thenReturn(never);

    assertThrows(TransportException.class, () -> executor.render(request(1)));
    assertTrue(never.isCancelled());
  }

  @Test
  public void interruptIsTransportExceptionAndRestoresFlag() {
    final CompletableFuture<HttpResponse> never = new CompletableFuture<>();
    when(client.execute(any(HttpUriRequest.class), isNull())).thenReturn(never);

    Thread.currentThread().interrupt();
    try {
      assertThrows(TransportException.class, () -> executor.render(request(1)));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  public void metricsListing() throws Exception {
    when(client.execute(any(HttpUriRequest.class), isNull()))
        .thenReturn(ok("[\"sys.cpu.user\", \"sys.cpu.idle\"]"));

    assertEquals(ImmutableList.of("sys.cpu.user", "sys.cpu.idle"), executor.metrics());
    final ArgumentCaptor<HttpUriRequest> captor =
        ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(client).execute(captor.capture(), isNull());
    assertEquals("GET", captor.getValue().getMethod());
    assertEquals("http://graphite.example.com:8080/graphite/metrics/index.json",
        captor.getValue().getURI().toString());
  }

  @Test
  public void metricsStatusError() {
    when(client.execute(any(HttpUriRequest.class), isNull()))
        .thenReturn(respond(500, "Internal Server Error", null));
    final StatusException e = assertThrows(StatusException.class, () -> executor.metrics());
    assertEquals(500, e.statusCode());
  }

  private static RenderRequest request(final int targets) {
    final RenderRequest.Builder builder = RenderRequest.newBuilder()
        .setStart(START)
        .setEnd(END);
    for (int i = 0; i < targets; i++) {
      builder.addTarget("t" + i);
    }
    return builder.build();
  }
}
