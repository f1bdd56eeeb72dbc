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
package com.example.a2a_weather;

import com.example.a2a.server.InMemoryTaskManager;
import com.example.a2a.server.ServerUtils;
import com.example.a2a.server.TaskNotFoundException;
import com.example.a2a.types.Artifact;
import com.example.a2a.types.JsonRpcError;
import com.example.a2a.types.JsonRpcRequest;
import com.example.a2a.types.JsonRpcResponse;
import com.example.a2a.types.Message;
import com.example.a2a.types.Part;
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
import java.util.List;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Serves A2A task requests by handing the user's text to a {@link ChatAgent}. */
public class WeatherTaskManager extends InMemoryTaskManager {

  private static final Logger logger = LoggerFactory.getLogger(WeatherTaskManager.class);

  static final String STREAMING_ERROR_MESSAGE = "An error occurred while streaming the response";

  private final ChatAgent agent;

  public WeatherTaskManager(ChatAgent agent) {
    this.agent = agent;
  }

  @Override
  public Single<JsonRpcResponse<Task>> onSendTask(JsonRpcRequest<TaskSendParams> request) {
    return Single.defer(
        () -> {
          JsonRpcResponse<Task> error = validateRequest(request);
          if (error != null) {
            return Single.just(error);
          }
          String query;
          try {
            query = getUserQuery(request.params());
          } catch (IllegalArgumentException e) {
            logger.warn("Rejecting task {}: {}", request.params().id(), e.getMessage());
            return Single.just(
                JsonRpcResponse.error(request.id(), JsonRpcError.invalidParams(e.getMessage())));
          }
          upsertTask(request.params());
          return invoke(request, query);
        });
  }

  @Override
  public Flowable<JsonRpcResponse<TaskUpdateEvent>> onSendTaskSubscribe(
      JsonRpcRequest<TaskSendParams> request) {
    return Flowable.defer(
        () -> {
          JsonRpcResponse<TaskUpdateEvent> error = validateRequest(request);
          if (error != null) {
            return Flowable.just(error);
          }
          String query;
          try {
            query = getUserQuery(request.params());
          } catch (IllegalArgumentException e) {
            logger.warn("Rejecting task {}: {}", request.params().id(), e.getMessage());
            return Flowable.just(
                JsonRpcResponse.<TaskUpdateEvent>error(
                    request.id(), JsonRpcError.invalidParams(e.getMessage())));
          }
          upsertTask(request.params());
          return streamUpdates(request, query);
        });
  }

  /** Returns an error response when the client accepts none of the agent's output modes. */
  @Nullable
  <T> JsonRpcResponse<T> validateRequest(JsonRpcRequest<TaskSendParams> request) {
    List<String> acceptedOutputModes = request.params().acceptedOutputModes();
    if (!ServerUtils.areModalitiesCompatible(
        WeatherAgent.SUPPORTED_CONTENT_TYPES, acceptedOutputModes)) {
      logger.warn(
          "Unsupported output mode. Received {}, Support {}",
          acceptedOutputModes,
          WeatherAgent.SUPPORTED_CONTENT_TYPES);
      return ServerUtils.newIncompatibleTypesError(request.id());
    }
    return null;
  }

  /**
   * Returns the text of the first part of the inbound message.
   *
   * @throws IllegalArgumentException if the message does not start with a text part
   */
  static String getUserQuery(TaskSendParams params) {
    List<Part> parts = params.message().parts();
    if (parts.isEmpty() || !(parts.get(0) instanceof TextPart textPart)) {
      throw new IllegalArgumentException("Only text parts are supported");
    }
    return textPart.text();
  }

  private Single<JsonRpcResponse<Task>> invoke(
      JsonRpcRequest<TaskSendParams> request, String query) {
    TaskSendParams params = request.params();
    return Single.defer(
            () -> {
              updateStore(params.id(), TaskStatus.of(TaskState.WORKING));
              return agent.invoke(query, params.sessionId());
            })
        .map(
            response -> {
              Task task =
                  updateStore(
                      params.id(),
                      TaskStatus.of(TaskState.COMPLETED, Message.agentText(response)),
                      ImmutableList.of(Artifact.ofText(response)));
              return JsonRpcResponse.success(request.id(), task);
            })
        .onErrorResumeNext(
            error -> {
              if (error instanceof TaskNotFoundException) {
                return Single.error(error);
              }
              logger.error("Error invoking agent for task {}", params.id(), error);
              String message = "Error invoking agent: " + error.getMessage();
              return Single.fromCallable(
                  () -> {
                    markFailed(params.id(), message);
                    return JsonRpcResponse.<Task>error(
                        request.id(), JsonRpcError.internalError(message));
                  });
            });
  }

  private Flowable<JsonRpcResponse<TaskUpdateEvent>> streamUpdates(
      JsonRpcRequest<TaskSendParams> request, String query) {
    TaskSendParams params = request.params();
    return agent
        .stream(query, params.sessionId())
        .takeUntil(AgentUpdate::isTaskComplete)
        .map(
            update -> {
              Message message = Message.agentText(update.content());
              TaskStatus status;
              if (update.isTaskComplete()) {
                status = TaskStatus.of(TaskState.COMPLETED, message);
                Artifact artifact =
                    Artifact.ofText(update.content()).toBuilder().append(false).build();
                updateStore(params.id(), status, ImmutableList.of(artifact));
              } else {
                status = TaskStatus.of(TaskState.WORKING, message);
                updateStore(params.id(), status);
              }
              return JsonRpcResponse.<TaskUpdateEvent>success(
                  request.id(),
                  TaskStatusUpdateEvent.create(params.id(), status, update.isTaskComplete()));
            })
        .onErrorResumeNext(
            error -> {
              if (error instanceof TaskNotFoundException) {
                return Flowable.error(error);
              }
              logger.error("{} for task {}", STREAMING_ERROR_MESSAGE, params.id(), error);
              return Flowable.fromCallable(
                  () -> {
                    markFailed(params.id(), STREAMING_ERROR_MESSAGE + ": " + error.getMessage());
                    return JsonRpcResponse.<TaskUpdateEvent>error(
                        request.id(), JsonRpcError.internalError(STREAMING_ERROR_MESSAGE));
                  });
            });
  }

  /**
   * Records a terminal failed status so the task does not stay in {@code working}.
   *
   * @throws TaskNotFoundException if the task was never stored
   */
  private void markFailed(String taskId, String reason) {
    updateStore(taskId, TaskStatus.of(TaskState.FAILED, Message.agentText(reason)));
  }
}
