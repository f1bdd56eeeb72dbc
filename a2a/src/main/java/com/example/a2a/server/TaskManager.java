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
package com.example.a2a.server;

import com.example.a2a.types.JsonRpcRequest;
import com.example.a2a.types.JsonRpcResponse;
import com.example.a2a.types.Task;
import com.example.a2a.types.TaskIdParams;
import com.example.a2a.types.TaskQueryParams;
import com.example.a2a.types.TaskSendParams;
import com.example.a2a.types.TaskUpdateEvent;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;

/**
 * Handles the task methods of the A2A protocol.
 *
 * <p>Implementations report protocol failures as error responses rather than as errors on the
 * returned {@link Single} or {@link Flowable}.
 */
public interface TaskManager {

  Single<JsonRpcResponse<Task>> onGetTask(JsonRpcRequest<TaskQueryParams> request);

  Single<JsonRpcResponse<Task>> onCancelTask(JsonRpcRequest<TaskIdParams> request);

  Single<JsonRpcResponse<Task>> onSendTask(JsonRpcRequest<TaskSendParams> request);

  /**
   * Starts a task and streams its progress. The last event of a successful run is a status update
   * with {@code final} set.
   */
  Flowable<JsonRpcResponse<TaskUpdateEvent>> onSendTaskSubscribe(
      JsonRpcRequest<TaskSendParams> request);

  Flowable<JsonRpcResponse<TaskUpdateEvent>> onResubscribeToTask(
      JsonRpcRequest<TaskQueryParams> request);

  Single<JsonRpcResponse<Object>> onSetTaskPushNotification(JsonRpcRequest<Object> request);

  Single<JsonRpcResponse<Object>> onGetTaskPushNotification(JsonRpcRequest<TaskIdParams> request);
}
