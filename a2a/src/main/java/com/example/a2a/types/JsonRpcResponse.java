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
import javax.annotation.Nullable;

/**
 * A JSON-RPC response carrying either a result or an error.
 *
 * @param <T> the result type
 */
@AutoValue
public abstract class JsonRpcResponse<T> {

  public static final String JSONRPC_VERSION = "2.0";

  @JsonProperty("jsonrpc")
  public String jsonrpc() {
    return JSONRPC_VERSION;
  }

  @Nullable
  @JsonProperty("id")
  public abstract Object id();

  @Nullable
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonProperty("result")
  public abstract T result();

  @Nullable
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonProperty("error")
  public abstract JsonRpcError error();

  public boolean hasError() {
    return error() != null;
  }

  public static <T> JsonRpcResponse<T> success(@Nullable Object id, T result) {
    return new AutoValue_JsonRpcResponse<>(id, result, null);
  }

  public static <T> JsonRpcResponse<T> error(@Nullable Object id, JsonRpcError error) {
    return new AutoValue_JsonRpcResponse<>(id, null, error);
  }
}
