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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import javax.annotation.Nullable;

/** Parameters of {@code tasks/send} and {@code tasks/sendSubscribe}. */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = TaskSendParams.Builder.class)
public abstract class TaskSendParams {

  @JsonProperty("id")
  public abstract String id();

  @JsonProperty("sessionId")
  public abstract String sessionId();

  @JsonProperty("message")
  public abstract Message message();

  /** Output modes the client can consume; null means any. */
  @Nullable
  @JsonProperty("acceptedOutputModes")
  public abstract List<String> acceptedOutputModes();

  @Nullable
  @JsonProperty("historyLength")
  public abstract Integer historyLength();

  @Nullable
  @JsonProperty("metadata")
  public abstract Map<String, Object> metadata();

  public static Builder builder() {
    return new AutoValue_TaskSendParams.Builder()
        .sessionId(UUID.randomUUID().toString().replace("-", ""));
  }

  public abstract Builder toBuilder();

  /** Builder for {@link TaskSendParams}. */
  @AutoValue.Builder
  @JsonIgnoreProperties(ignoreUnknown = true)
  public abstract static class Builder {
    @CanIgnoreReturnValue
    @JsonProperty("id")
    public abstract Builder id(String id);

    @CanIgnoreReturnValue
    @JsonProperty("sessionId")
    public abstract Builder sessionId(String sessionId);

    @CanIgnoreReturnValue
    @JsonProperty("message")
    public abstract Builder message(Message message);

    @CanIgnoreReturnValue
    @JsonProperty("acceptedOutputModes")
    public abstract Builder acceptedOutputModes(@Nullable List<String> acceptedOutputModes);

    @CanIgnoreReturnValue
    @JsonProperty("historyLength")
    public abstract Builder historyLength(@Nullable Integer historyLength);

    @CanIgnoreReturnValue
    @JsonProperty("metadata")
    public abstract Builder metadata(@Nullable Map<String, Object> metadata);

    @JsonCreator
    private static Builder create() {
      return TaskSendParams.builder();
    }

    public abstract TaskSendParams build();
  }
}
