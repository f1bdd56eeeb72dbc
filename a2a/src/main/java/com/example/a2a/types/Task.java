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
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** A unit of work tracked by id, with its current status, outputs and message history. */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = Task.Builder.class)
public abstract class Task {

  @JsonProperty("id")
  public abstract String id();

  @Nullable
  @JsonProperty("sessionId")
  public abstract String sessionId();

  @JsonProperty("status")
  public abstract TaskStatus status();

  @JsonProperty("artifacts")
  public abstract ImmutableList<Artifact> artifacts();

  @JsonProperty("history")
  public abstract ImmutableList<Message> history();

  @Nullable
  @JsonProperty("metadata")
  public abstract Map<String, Object> metadata();

  /** Returns a copy of this task carrying {@code status}. */
  public Task withStatus(TaskStatus status) {
    return toBuilder().status(status).build();
  }

  /** Returns a copy of this task with {@code artifacts} appended after the existing ones. */
  public Task withArtifactsAppended(List<Artifact> newArtifacts) {
    return toBuilder()
        .artifacts(
            ImmutableList.<Artifact>builder().addAll(artifacts()).addAll(newArtifacts).build())
        .build();
  }

  /** Returns a copy of this task with {@code message} appended to its history. */
  public Task withMessageAppended(Message message) {
    return toBuilder()
        .history(ImmutableList.<Message>builder().addAll(history()).add(message).build())
        .build();
  }

  /**
   * Returns a copy keeping only the last {@code historyLength} history messages. A null or
   * non-positive length drops the history entirely.
   */
  public Task withHistoryLimit(@Nullable Integer historyLength) {
    if (historyLength == null || historyLength <= 0) {
      return toBuilder().history(ImmutableList.of()).build();
    }
    if (historyLength >= history().size()) {
      return this;
    }
    return toBuilder()
        .history(history().subList(history().size() - historyLength, history().size()))
        .build();
  }

  public static Builder builder() {
    return new AutoValue_Task.Builder()
        .artifacts(ImmutableList.of())
        .history(ImmutableList.of());
  }

  public abstract Builder toBuilder();

  /** Builder for {@link Task}. */
  @AutoValue.Builder
  @JsonIgnoreProperties(ignoreUnknown = true)
  public abstract static class Builder {
    @CanIgnoreReturnValue
    @JsonProperty("id")
    public abstract Builder id(String id);

    @CanIgnoreReturnValue
    @JsonProperty("sessionId")
    public abstract Builder sessionId(@Nullable String sessionId);

    @CanIgnoreReturnValue
    @JsonProperty("status")
    public abstract Builder status(TaskStatus status);

    @CanIgnoreReturnValue
    @JsonProperty("artifacts")
    public abstract Builder artifacts(List<Artifact> artifacts);

    @CanIgnoreReturnValue
    @JsonProperty("history")
    public abstract Builder history(List<Message> history);

    @CanIgnoreReturnValue
    @JsonProperty("metadata")
    public abstract Builder metadata(@Nullable Map<String, Object> metadata);

    @JsonCreator
    private static Builder create() {
      return Task.builder();
    }

    public abstract Task build();
  }
}
