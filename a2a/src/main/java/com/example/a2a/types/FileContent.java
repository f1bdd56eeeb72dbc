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
import java.util.Objects;
import javax.annotation.Nullable;

/** File payload of a {@link FilePart}: either inline base64 bytes or a URI, never both. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FileContent {

  @Nullable private final String name;
  @Nullable private final String mimeType;
  @Nullable private final String bytes;
  @Nullable private final String uri;

  @JsonCreator
  public FileContent(
      @JsonProperty("name") @Nullable String name,
      @JsonProperty("mimeType") @Nullable String mimeType,
      @JsonProperty("bytes") @Nullable String bytes,
      @JsonProperty("uri") @Nullable String uri) {
    if ((bytes == null) == (uri == null)) {
      throw new IllegalArgumentException("Exactly one of 'bytes' or 'uri' must be present");
    }
    this.name = name;
    this.mimeType = mimeType;
    this.bytes = bytes;
    this.uri = uri;
  }

  @Nullable
  @JsonProperty("name")
  public String name() {
    return name;
  }

  @Nullable
  @JsonProperty("mimeType")
  public String mimeType() {
    return mimeType;
  }

  @Nullable
  @JsonProperty("bytes")
  public String bytes() {
    return bytes;
  }

  @Nullable
  @JsonProperty("uri")
  public String uri() {
    return uri;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FileContent other)) {
      return false;
    }
    return Objects.equals(name, other.name)
        && Objects.equals(mimeType, other.mimeType)
        && Objects.equals(bytes, other.bytes)
        && Objects.equals(uri, other.uri);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, mimeType, bytes, uri);
  }
}
