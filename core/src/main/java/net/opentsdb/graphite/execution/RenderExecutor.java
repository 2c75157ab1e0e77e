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

import net.opentsdb.graphite.GraphiteException;
import net.opentsdb.graphite.query.RenderRequest;
import net.opentsdb.graphite.query.RenderResponse;

/**
 * Performs one blocking round trip to the backend for the given request. The
 * dispatcher calls this from several threads at once so implementations must
 * be thread safe.
 */
public interface RenderExecutor {

  /**
   * @param request The non-null request, at most one shard of targets when
   * called by the dispatcher's fan-out path.
   * @return The decoded series, never null.
   * @throws GraphiteException If the call or the decoding failed.
   */
  RenderResponse render(RenderRequest request) throws GraphiteException;

}
