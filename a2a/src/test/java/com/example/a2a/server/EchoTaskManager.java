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

import com.example.a2a.types.Artifact;
import com.example.a2a.types.JsonRpcRequest;
import com.example.a2a.types.JsonRpcResponse;
import com.example.a2a.types.Message;
import com.example.a2a.types.Task;
import com.example.a2a.types.TaskSendParams;
import com.example.a2a.types.TaskState;
import com.example.a2a.types.TaskStatus;
import com.example.a2a.types.TaskStatusUpdateEvent;
import com.example.a2a.types.TaskUpdateEvent;
import com.example.a2a.types.TextPart;
import com.google.common.collect.ImmutableList;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;

/** Completes every task with the text it was sent. */
class EchoTaskManager extends InMemoryTaskManager {

  private static final ImmutableList<String> OUTPUT_MODES = ImmutableList.of("text");

  @Override
  public Single<JsonRpcResponse<Task>> onSendTask(JsonRpcRequest<TaskSendParams> request) {
    return Single.fromCallable(
        () -> {
          TaskSendParams params = request.params();
          upsertTask(params);
          String text = echo(params);
          Task task =
              updateStore(
                  params.id(),
                  TaskStatus.of(TaskState.COMPLETED, Message.agentText(text)),
                  ImmutableList.of(Artifact.ofText(text)));
          return JsonRpcResponse.success(request.id(), task);
        });
  }

  @Override
  public Flowable<JsonRpcResponse<TaskUpdateEvent>> onSendTaskSubscribe(
      JsonRpcRequest<TaskSendParams> request) {
    return Flowable.defer(
        () -> {
          TaskSendParams params = request.params();
          if (!ServerUtils.areModalitiesCompatible(OUTPUT_MODES, params.acceptedOutputModes())) {
            return Flowable.just(
                ServerUtils.<TaskUpdateEvent>newIncompatibleTypesError(request.id()));
          }
          upsertTask(params);
          TaskStatus working = TaskStatus.of(TaskState.WORKING);
          updateStore(params.id(), working);
          TaskStatus completed =
              TaskStatus.of(TaskState.COMPLETED, Message.agentText(echo(params)));
          updateStore(params.id(), completed);
          return Flowable.just(
              JsonRpcResponse.<TaskUpdateEvent>success(
                  request.id(), TaskStatusUpdateEvent.create(params.id(), working, false)),
              JsonRpcResponse.<TaskUpdateEvent>success(
                  request.id(), TaskStatusUpdateEvent.create(params.id(), completed, true)));
        });
  }

  private static String echo(TaskSendParams params) {
    return "echo: " + ((TextPart) params.message().parts().get(0)).text();
  }
}
