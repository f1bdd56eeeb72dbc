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
 * A decoded JSON-RPC request whose params have already been bound to {@code P}.
 *
 * @param <P> the params type of the method
 */
@AutoValue
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class JsonRpcRequest<P> {

  public static final String TASKS_SEND = "tasks/send";
  public static final String TASKS_SEND_SUBSCRIBE = "tasks/sendSubscribe";
  public static final String TASKS_GET = "tasks/get";
  public static final String TASKS_CANCEL = "tasks/cancel";
  public static final String TASKS_RESUBSCRIBE = "tasks/resubscribe";
  public static final String TASKS_PUSH_NOTIFICATION_SET = "tasks/pushNotification/set";
  public static final String TASKS_PUSH_NOTIFICATION_GET = "tasks/pushNotification/get";

  @JsonProperty("jsonrpc")
  public String jsonrpc() {
    return JsonRpcResponse.JSONRPC_VERSION;
  }

  /** Request id as sent by the client: a string, a number, or null. */
  @Nullable
  @JsonProperty("id")
  public abstract Object id();

  @JsonProperty("method")
  public abstract String method();

  @JsonProperty("params")
  public abstract P params();

  public static <P> JsonRpcRequest<P> create(@Nullable Object id, String method, P params) {
    return new AutoValue_JsonRpcRequest<>(id, method, params);
  }
}
