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
import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;

/** Error member of a JSON-RPC response, including the A2A task-specific error codes. */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class JsonRpcError {

  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int INTERNAL_ERROR = -32603;
  public static final int TASK_NOT_FOUND = -32001;
  public static final int TASK_NOT_CANCELABLE = -32002;
  public static final int PUSH_NOTIFICATION_NOT_SUPPORTED = -32003;
  public static final int UNSUPPORTED_OPERATION = -32004;
  public static final int CONTENT_TYPE_NOT_SUPPORTED = -32005;

  @JsonProperty("code")
  public abstract int code();

  @JsonProperty("message")
  public abstract String message();

  @Nullable
  @JsonProperty("data")
  public abstract Object data();

  @JsonCreator
  public static JsonRpcError create(
      @JsonProperty("code") int code,
      @JsonProperty("message") String message,
      @JsonProperty("data") @Nullable Object data) {
    return new AutoValue_JsonRpcError(code, message, data);
  }

  public static JsonRpcError parseError() {
    return create(PARSE_ERROR, "Invalid JSON payload", null);
  }

  public static JsonRpcError invalidRequest(@Nullable Object data) {
    return create(INVALID_REQUEST, "Request payload validation error", data);
  }

  public static JsonRpcError methodNotFound() {
    return create(METHOD_NOT_FOUND, "Method not found", null);
  }

  public static JsonRpcError invalidParams(String message) {
    return create(INVALID_PARAMS, message, null);
  }

  public static JsonRpcError internalError(String message) {
    return create(INTERNAL_ERROR, message, null);
  }

  public static JsonRpcError taskNotFound() {
    return create(TASK_NOT_FOUND, "Task not found", null);
  }

  public static JsonRpcError taskNotCancelable() {
    return create(TASK_NOT_CANCELABLE, "Task cannot be canceled", null);
  }

  public static JsonRpcError pushNotificationNotSupported() {
    return create(PUSH_NOTIFICATION_NOT_SUPPORTED, "Push Notification is not supported", null);
  }

  public static JsonRpcError unsupportedOperation() {
    return create(UNSUPPORTED_OPERATION, "This operation is not supported", null);
  }

  public static JsonRpcError contentTypeNotSupported() {
    return create(CONTENT_TYPE_NOT_SUPPORTED, "Incompatible content types", null);
  }
}
