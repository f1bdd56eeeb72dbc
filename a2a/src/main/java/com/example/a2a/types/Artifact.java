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

/**
 * Output produced by an agent for a task.
 *
 * <p>Streaming producers may split one artifact into chunks: {@link #append()} marks a chunk that
 * extends the artifact at {@link #index()}, {@link #lastChunk()} marks the final one.
 */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = Artifact.Builder.class)
public abstract class Artifact {

  @Nullable
  @JsonProperty("name")
  public abstract String name();

  @Nullable
  @JsonProperty("description")
  public abstract String description();

  @JsonProperty("parts")
  public abstract ImmutableList<Part> parts();

  @JsonProperty("index")
  public abstract int index();

  @Nullable
  @JsonProperty("append")
  public abstract Boolean append();

  @Nullable
  @JsonProperty("lastChunk")
  public abstract Boolean lastChunk();

  @Nullable
  @JsonProperty("metadata")
  public abstract Map<String, Object> metadata();

  /** Creates an artifact at index 0 holding a single text part. */
  public static Artifact ofText(String text) {
    return builder().parts(ImmutableList.of(new TextPart(text))).build();
  }

  public static Builder builder() {
    return new AutoValue_Artifact.Builder().parts(ImmutableList.of()).index(0);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link Artifact}. */
  @AutoValue.Builder
  @JsonIgnoreProperties(ignoreUnknown = true)
  public abstract static class Builder {
    @CanIgnoreReturnValue
    @JsonProperty("name")
    public abstract Builder name(@Nullable String name);

    @CanIgnoreReturnValue
    @JsonProperty("description")
    public abstract Builder description(@Nullable String description);

    @CanIgnoreReturnValue
    @JsonProperty("parts")
    public abstract Builder parts(List<Part> parts);

    @CanIgnoreReturnValue
    @JsonProperty("index")
    public abstract Builder index(int index);

    @CanIgnoreReturnValue
    @JsonProperty("append")
    public abstract Builder append(@Nullable Boolean append);

    @CanIgnoreReturnValue
    @JsonProperty("lastChunk")
    public abstract Builder lastChunk(@Nullable Boolean lastChunk);

    @CanIgnoreReturnValue
    @JsonProperty("metadata")
    public abstract Builder metadata(@Nullable Map<String, Object> metadata);

    @JsonCreator
    private static Builder create() {
      return Artifact.builder();
    }

    public abstract Artifact build();
  }
}
