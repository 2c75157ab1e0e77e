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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import net.opentsdb.graphite.execution.DispatcherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

/**
 * Settings for a {@link GraphiteClient}. Can be built in code or loaded from
 * YAML (or JSON) where unknown keys are ignored, e.g.
 * <pre>
 * url: graphite.example.com:8080
 * shardSize: 20
 * workers: 10
 * </pre>
 * Only the {@code url} is required. A URL without a scheme is treated as
 * {@code http}.
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = GraphiteClientConfig.Builder.class)
public class GraphiteClientConfig {
  private static final Logger LOG = LoggerFactory.getLogger(GraphiteClientConfig.class);

  public static final String DEFAULT_SCHEME = "http";
  public static final int DEFAULT_POST_THRESHOLD = 30;
  public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;
  public static final int DEFAULT_SOCKET_TIMEOUT_MS = 30_000;
  public static final int DEFAULT_REQUEST_TIMEOUT_MS = 60_000;
  public static final int DEFAULT_IO_THREADS = 4;
  public static final int DEFAULT_MAX_CONNECTIONS = 32;

  private final String url;
  private final int postThreshold;
  private final int shardSize;
  private final int workers;
  private final int connectTimeoutMs;
  private final int socketTimeoutMs;
  private final int requestTimeoutMs;
  private final int ioThreads;
  private final int maxConnections;

  protected GraphiteClientConfig(final Builder builder) {
    url = normalize(builder.url);
    postThreshold = positive("postThreshold", builder.postThreshold);
    shardSize = positive("shardSize", builder.shardSize);
    workers = positive("workers", builder.workers);
    connectTimeoutMs = positive("connectTimeoutMs", builder.connectTimeoutMs);
    socketTimeoutMs = positive("socketTimeoutMs", builder.socketTimeoutMs);
    requestTimeoutMs = positive("requestTimeoutMs", builder.requestTimeoutMs);
    ioThreads = positive("ioThreads", builder.ioThreads);
    maxConnections = positive("maxConnections", builder.maxConnections);
  }

  /** @return The base URL with a scheme and without a trailing slash. */
  public String url() {
    return url;
  }

  public int postThreshold() {
    return postThreshold;
  }

  public int shardSize() {
    return shardSize;
  }

  public int workers() {
    return workers;
  }

  public int connectTimeoutMs() {
    return connectTimeoutMs;
  }

  public int socketTimeoutMs() {
    return socketTimeoutMs;
  }

  public int requestTimeoutMs() {
    return requestTimeoutMs;
  }

  public int ioThreads() {
    return ioThreads;
  }

  public int maxConnections() {
    return maxConnections;
  }

  public DispatcherConfig toDispatcherConfig() {
    return DispatcherConfig.newBuilder()
        .setShardSize(shardSize)
        .setWorkers(workers)
        .build();
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("GraphiteClientConfig {url=")
        .append(url)
        .append(", postThreshold=")
        .append(postThreshold)
        .append(", shardSize=")
        .append(shardSize)
        .append(", workers=")
        .append(workers)
        .append(", connectTimeoutMs=")
        .append(connectTimeoutMs)
        .append(", socketTimeoutMs=")
        .append(socketTimeoutMs)
        .append(", requestTimeoutMs=")
        .append(requestTimeoutMs)
        .append(", ioThreads=")
        .append(ioThreads)
        .append(", maxConnections=")
        .append(maxConnections)
        .append("}")
        .toString();
  }

  /**
   * A config with defaults for everything but the URL.
   * @param url The base URL, with or without a scheme.
   * @return The config.
   * @throws IllegalArgumentException if the URL is null, empty or malformed.
   */
  public static GraphiteClientConfig fromUrl(final String url) {
    return newBuilder().setUrl(url).build();
  }

  /**
   * Builds the base URL from its parts.
   * @param scheme The scheme, {@code http} when null or empty.
   * @param host The host with an optional port.
   * @param path An optional path prefix such as {@code /graphite}.
   * @return The config.
   */
  public static GraphiteClientConfig fromParts(final String scheme,
                                               final String host,
                                               final String path) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(host),
        "Host cannot be null or empty.");
    final StringBuilder buf = new StringBuilder()
        .append(Strings.isNullOrEmpty(scheme) ? DEFAULT_SCHEME : scheme)
        .append("://")
        .append(host);
    if (!Strings.isNullOrEmpty(path)) {
      if (!path.startsWith("/")) {
        buf.append("/");
      }
      buf.append(path);
    }
    return fromUrl(buf.toString());
  }

  /**
   * Loads the config from a YAML file.
   * @param file The file to read.
   * @return The config.
   * @throws IOException if the file couldn't be read or parsed.
   */
  public static GraphiteClientConfig load(final File file) throws IOException {
    LOG.info("Loading Graphite client config from: " + file);
    return mapper().readValue(file, GraphiteClientConfig.class);
  }

  /**
   * Parses the config from a YAML or JSON stream. The stream is not closed.
   * @param stream The stream to read.
   * @return The config.
   * @throws IOException if the stream couldn't be read or parsed.
   */
  public static GraphiteClientConfig parse(final InputStream stream) throws IOException {
    return mapper().readValue(stream, GraphiteClientConfig.class);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  static ObjectMapper mapper() {
    return new ObjectMapper(new YAMLFactory());
  }

  static String normalize(final String raw) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(raw),
        "The Graphite URL cannot be null or empty.");
    String url = raw.trim();
    if (!url.contains("://")) {
      url = DEFAULT_SCHEME + "://" + url;
    }
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }

    final URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid Graphite URL: " + raw, e);
    }
    if (Strings.isNullOrEmpty(uri.getHost())) {
      throw new IllegalArgumentException("Graphite URL is missing a host: " + raw);
    }
    if (uri.getQuery() != null || uri.getFragment() != null) {
      throw new IllegalArgumentException("Graphite URL cannot have a query "
          + "or fragment: " + raw);
    }
    return url;
  }

  private static int positive(final String key, final int value) {
    Preconditions.checkArgument(value > 0,
        key + " must be greater than zero: " + value);
    return value;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private String url;
    @JsonProperty
    private int postThreshold = DEFAULT_POST_THRESHOLD;
    @JsonProperty
    private int shardSize = DispatcherConfig.DEFAULT_SHARD_SIZE;
    @JsonProperty
    private int workers = DispatcherConfig.DEFAULT_WORKERS;
    @JsonProperty
    private int connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
    @JsonProperty
    private int socketTimeoutMs = DEFAULT_SOCKET_TIMEOUT_MS;
    @JsonProperty
    private int requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    @JsonProperty
    private int ioThreads = DEFAULT_IO_THREADS;
    @JsonProperty
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;

    public Builder setUrl(final String url) {
      this.url = url;
      return this;
    }

    public Builder setPostThreshold(final int postThreshold) {
      this.postThreshold = postThreshold;
      return this;
    }

    public Builder setShardSize(final int shardSize) {
      this.shardSize = shardSize;
      return this;
    }

    public Builder setWorkers(final int workers) {
      this.workers = workers;
      return this;
    }

    public Builder setConnectTimeoutMs(final int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
      return this;
    }

    public Builder setSocketTimeoutMs(final int socketTimeoutMs) {
      this.socketTimeoutMs = socketTimeoutMs;
      return this;
    }

    public Builder setRequestTimeoutMs(final int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    public Builder setIoThreads(final int ioThreads) {
      this.ioThreads = ioThreads;
      return this;
    }

    public Builder setMaxConnections(final int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    public GraphiteClientConfig build() {
      return new GraphiteClientConfig(this);
    }
  }
}
