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
package com.example.a2a.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.time.Instant;
import javax.annotation.Nullable;

/** State of a task at a point in time, optionally with the message that accompanied it. */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TaskStatus {

  @JsonProperty("state")
  public abstract TaskState state();

  @Nullable
  @JsonProperty("message")
  public abstract Message message();

  /** ISO-8601 instant at which the status was recorded. */
  @JsonProperty("timestamp")
  public abstract String timestamp();

  public static TaskStatus of(TaskState state) {
    return of(state, null);
  }

  public static TaskStatus of(TaskState state, @Nullable Message message) {
    return new AutoValue_TaskStatus(state, message, Instant.now().toString());
  }

  @JsonCreator
  static TaskStatus fromJson(
      @JsonProperty("state") TaskState state,
      @JsonProperty("message") @Nullable Message message,
      @JsonProperty("timestamp") @Nullable String timestamp) {
    return new AutoValue_TaskStatus(
        state, message, timestamp != null ? timestamp : Instant.now().toString());
  }
}
