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

/** Discovery document served at {@code /.well-known/agent.json}. */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class AgentCard {

  @JsonProperty("name")
  public abstract String name();

  @Nullable
  @JsonProperty("description")
  public abstract String description();

  @JsonProperty("url")
  public abstract String url();

  @JsonProperty("version")
  public abstract String version();

  @Nullable
  @JsonProperty("documentationUrl")
  public abstract String documentationUrl();

  @JsonProperty("capabilities")
  public abstract AgentCapabilities capabilities();

  @JsonProperty("defaultInputModes")
  public abstract ImmutableList<String> defaultInputModes();

  @JsonProperty("defaultOutputModes")
  public abstract ImmutableList<String> defaultOutputModes();

  @JsonProperty("skills")
  public abstract ImmutableList<AgentSkill> skills();

  public static Builder builder() {
    return new AutoValue_AgentCard.Builder()
        .capabilities(AgentCapabilities.create(false, false, false))
        .defaultInputModes(ImmutableList.of("text"))
        .defaultOutputModes(ImmutableList.of("text"))
        .skills(ImmutableList.of());
  }

  /** Builder for {@link AgentCard}. */
  @AutoValue.Builder
  public abstract static class Builder {
    @CanIgnoreReturnValue
    public abstract Builder name(String name);

    @CanIgnoreReturnValue
    public abstract Builder description(@Nullable String description);

    @CanIgnoreReturnValue
    public abstract Builder url(String url);

    @CanIgnoreReturnValue
    public abstract Builder version(String version);

    @CanIgnoreReturnValue
    public abstract Builder documentationUrl(@Nullable String documentationUrl);

    @CanIgnoreReturnValue
    public abstract Builder capabilities(AgentCapabilities capabilities);

    @CanIgnoreReturnValue
    public abstract Builder defaultInputModes(List<String> defaultInputModes);

    @CanIgnoreReturnValue
    public abstract Builder defaultOutputModes(List<String> defaultOutputModes);

    @CanIgnoreReturnValue
    public abstract Builder skills(List<AgentSkill> skills);

    public abstract AgentCard build();
  }
}
