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

package net.opentsdb.graphite;

/**
 * The backend answered with something other than a 200. The message is the
 * status line text, e.g. {@code "404 Not Found"}.
 */
public class StatusException extends GraphiteException {

  private final int statusCode;
  private final String statusText;

  public StatusException(final int statusCode, final String reason) {
    super(statusCode + (reason == null || reason.isEmpty() ? "" : " " + reason));
    this.statusCode = statusCode;
    this.statusText = getMessage();
  }

  public int statusCode() {
    return statusCode;
  }

  public String statusText() {
    return statusText;
  }
}
