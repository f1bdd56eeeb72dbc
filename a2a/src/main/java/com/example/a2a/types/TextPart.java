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

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/** Plain text content. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TextPart implements Part {

  private final String text;
  @Nullable private final Map<String, Object> metadata;

  public TextPart(String text) {
    this(text, null);
  }

  @JsonCreator
  public TextPart(
      @JsonProperty("text") String text,
      @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {
    this.text = checkNotNull(text, "text");
    this.metadata = metadata;
  }

  @JsonProperty("text")
  public String text() {
    return text;
  }

  @Override
  @Nullable
  @JsonProperty("metadata")
  public Map<String, Object> metadata() {
    return metadata;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TextPart other)) {
      return false;
    }
    return text.equals(other.text) && Objects.equals(metadata, other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, metadata);
  }

  @Override
  public String toString() {
    return "TextPart{text=" + text + "}";
  }
}
