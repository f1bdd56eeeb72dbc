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

/** Structured JSON content. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DataPart implements Part {

  private final Map<String, Object> data;
  @Nullable private final Map<String, Object> metadata;

  @JsonCreator
  public DataPart(
      @JsonProperty("data") Map<String, Object> data,
      @JsonProperty("metadata") @Nullable Map<String, Object> metadata) {
    this.data = checkNotNull(data, "data");
    this.metadata = metadata;
  }

  @JsonProperty("data")
  public Map<String, Object> data() {
    return data;
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
    if (!(o instanceof DataPart other)) {
      return false;
    }
    return data.equals(other.data) && Objects.equals(metadata, other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(data, metadata);
  }
}
