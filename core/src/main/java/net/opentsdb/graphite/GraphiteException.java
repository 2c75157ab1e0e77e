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
 * Root of the checked exceptions raised while talking to a Graphite backend.
 * The batch dispatcher never wraps these: whatever the executor threw for the
 * first failed shard is what the caller sees.
 */
public class GraphiteException extends Exception {

  public GraphiteException(final String message) {
    super(message);
  }

  public GraphiteException(final String message, final Throwable cause) {
    super(message, cause);
  }

  public GraphiteException(final Throwable cause) {
    super(cause);
  }
}
