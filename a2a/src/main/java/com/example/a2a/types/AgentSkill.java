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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import javax.annotation.Nullable;

/** A capability an agent advertises in its {@link AgentCard}. */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class AgentSkill {

  @JsonProperty("id")
  public abstract String id();

  @JsonProperty("name")
  public abstract String name();

  @Nullable
  @JsonProperty("description")
  public abstract String description();

  @JsonProperty("tags")
  public abstract ImmutableList<String> tags();

  @JsonProperty("examples")
  public abstract ImmutableList<String> examples();

  @Nullable
  @JsonProperty("inputModes")
  public abstract ImmutableList<String> inputModes();

  @Nullable
  @JsonProperty("outputModes")
  public abstract ImmutableList<String> outputModes();

  public static Builder builder() {
    return new AutoValue_AgentSkill.Builder().tags(ImmutableList.of()).examples(ImmutableList.of());
  }

  /** Builder for {@link AgentSkill}. */
  @AutoValue.Builder
  public abstract static class Builder {
    @CanIgnoreReturnValue
    public abstract Builder id(String id);

    @CanIgnoreReturnValue
    public abstract Builder name(String name);

    @CanIgnoreReturnValue
    public abstract Builder description(@Nullable String description);

    @CanIgnoreReturnValue
    public abstract Builder tags(List<String> tags);

    @CanIgnoreReturnValue
    public abstract Builder examples(List<String> examples);

    @CanIgnoreReturnValue
    public abstract Builder inputModes(@Nullable ImmutableList<String> inputModes);

    @CanIgnoreReturnValue
    public abstract Builder outputModes(@Nullable ImmutableList<String> outputModes);

    public abstract AgentSkill build();
  }
}
