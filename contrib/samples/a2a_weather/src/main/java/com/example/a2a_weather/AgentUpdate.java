/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.example.a2a_weather;

import com.google.auto.value.AutoValue;

/** One item of a streamed agent run. */
@AutoValue
public abstract class AgentUpdate {

  public abstract boolean isTaskComplete();

  public abstract boolean requireUserInput();

  public abstract String content();

  /** A progress update; more updates follow. */
  public static AgentUpdate working(String content) {
    return new AutoValue_AgentUpdate(false, false, content);
  }

  /** The last update of a run. */
  public static AgentUpdate completed(String content) {
    return new AutoValue_AgentUpdate(true, false, content);
  }
}
