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
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Status change of a task. {@link #finalEvent()} tells the subscriber that no further events follow
 * for this task.
 */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TaskStatusUpdateEvent implements TaskUpdateEvent {

  @Override
  @JsonProperty("id")
  public abstract String id();

  @JsonProperty("status")
  public abstract TaskStatus status();

  @JsonProperty("final")
  public abstract boolean finalEvent();

  @Nullable
  @JsonProperty("metadata")
  public abstract Map<String, Object> metadata();

  @JsonCreator
  public static TaskStatusUpdateEvent create(
      @JsonProperty("id") String id,
      @JsonProperty("status") TaskStatus status,
      @JsonProperty("final") boolean finalEvent,
      @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {
    return new AutoValue_TaskStatusUpdateEvent(id, status, finalEvent, metadata);
  }

  public static TaskStatusUpdateEvent create(String id, TaskStatus status, boolean finalEvent) {
    return create(id, status, finalEvent, null);
  }
}
