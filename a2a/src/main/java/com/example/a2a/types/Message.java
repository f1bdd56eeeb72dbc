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
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** A single turn of communication between a client and an agent. */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = Message.Builder.class)
public abstract class Message {

  /** Author of a message. */
  public enum Role {
    USER("user"),
    AGENT("agent");

    private final String value;

    Role(String value) {
      this.value = value;
    }

    @JsonValue
    public String value() {
      return value;
    }

    @JsonCreator
    public static Role fromValue(String value) {
      for (Role role : values()) {
        if (role.value.equals(value)) {
          return role;
        }
      }
      throw new IllegalArgumentException("Unknown message role: " + value);
    }
  }

  @JsonProperty("role")
  public abstract Role role();

  @JsonProperty("parts")
  public abstract ImmutableList<Part> parts();

  @Nullable
  @JsonProperty("metadata")
  public abstract Map<String, Object> metadata();

  /** Creates an agent-authored message holding a single text part. */
  public static Message agentText(String text) {
    return builder().role(Role.AGENT).parts(ImmutableList.of(new TextPart(text))).build();
  }

  public static Builder builder() {
    return new AutoValue_Message.Builder().parts(ImmutableList.of());
  }

  public abstract Builder toBuilder();

  /** Builder for {@link Message}. */
  @AutoValue.Builder
  @JsonIgnoreProperties(ignoreUnknown = true)
  public abstract static class Builder {
    @CanIgnoreReturnValue
    @JsonProperty("role")
    public abstract Builder role(Role role);

    @CanIgnoreReturnValue
    @JsonProperty("parts")
    public abstract Builder parts(List<Part> parts);

    @CanIgnoreReturnValue
    @JsonProperty("metadata")
    public abstract Builder metadata(@Nullable Map<String, Object> metadata);

    @JsonCreator
    private static Builder create() {
      return Message.builder();
    }

    public abstract Message build();
  }
}
