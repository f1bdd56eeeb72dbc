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

/** An artifact, or a chunk of one, produced while a task runs. */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TaskArtifactUpdateEvent implements TaskUpdateEvent {

  @Override
  @JsonProperty("id")
  public abstract String id();

  @JsonProperty("artifact")
  public abstract Artifact artifact();

  @Nullable
  @JsonProperty("metadata")
  public abstract Map<String, Object> metadata();

  @JsonCreator
  public static TaskArtifactUpdateEvent create(
      @JsonProperty("id") String id,
      @JsonProperty("artifact") Artifact artifact,
      @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {
    return new AutoValue_TaskArtifactUpdateEvent(id, artifact, metadata);
  }
}
