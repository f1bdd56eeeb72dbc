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
import com.example.a2a.types.JsonRpcError;
import com.example.a2a.types.JsonRpcRequest;
import com.example.a2a.types.JsonRpcResponse;
import com.example.a2a.types.Task;
import com.example.a2a.types.TaskIdParams;
import com.example.a2a.types.TaskQueryParams;
import com.example.a2a.types.TaskSendParams;
import com.example.a2a.types.TaskState;
import com.example.a2a.types.TaskStatus;
import com.example.a2a.types.TaskUpdateEvent;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskManager} keeping tasks in process memory for the lifetime of the server.
 *
 * <p>Tasks are immutable snapshots; every change replaces the stored snapshot through an atomic
 * per-key compute on the backing map. Updates to the same task are therefore applied one at a
 * time, while updates to different tasks never wait on each other.
 *
 * <p>Subclasses implement {@code tasks/send} and {@code tasks/sendSubscribe}.
 */
public abstract class InMemoryTaskManager implements TaskManager {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryTaskManager.class);

  private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();

  @Override
  public Single<JsonRpcResponse<Task>> onGetTask(JsonRpcRequest<TaskQueryParams> request) {
    return Single.fromCallable(
        () -> {
          TaskQueryParams params = request.params();
          logger.info("Getting task {}", params.id());
          Task task = tasks.get(params.id());
          if (task == null) {
            return JsonRpcResponse.error(request.id(), JsonRpcError.taskNotFound());
          }
          return JsonRpcResponse.success(
              request.id(), task.withHistoryLimit(params.historyLength()));
        });
  }

  @Override
  public Single<JsonRpcResponse<Task>> onCancelTask(JsonRpcRequest<TaskIdParams> request) {
    return Single.fromCallable(
        () -> {
          String taskId = request.params().id();
          logger.info("Cancelling task {}", taskId);
          if (!tasks.containsKey(taskId)) {
            return JsonRpcResponse.error(request.id(), JsonRpcError.taskNotFound());
          }
          return JsonRpcResponse.error(request.id(), JsonRpcError.taskNotCancelable());
        });
  }

  @Override
  public Flowable<JsonRpcResponse<TaskUpdateEvent>> onResubscribeToTask(
      JsonRpcRequest<TaskQueryParams> request) {
    return Flowable.just(ServerUtils.newNotImplementedError(request.id()));
  }

  @Override
  public Single<JsonRpcResponse<Object>> onSetTaskPushNotification(JsonRpcRequest<Object> request) {
    return Single.just(
        JsonRpcResponse.error(request.id(), JsonRpcError.pushNotificationNotSupported()));
  }

  @Override
  public Single<JsonRpcResponse<Object>> onGetTaskPushNotification(
      JsonRpcRequest<TaskIdParams> request) {
    return Single.just(
        JsonRpcResponse.error(request.id(), JsonRpcError.pushNotificationNotSupported()));
  }

  /**
   * Stores a new {@link TaskState#SUBMITTED} task for {@code params}, or appends the incoming
   * message to the history of the task already stored under the same id.
   */
  @CanIgnoreReturnValue
  protected Task upsertTask(TaskSendParams params) {
    logger.info("Upserting task {}", params.id());
    return tasks.compute(
        params.id(),
        (id, existing) -> {
          if (existing == null) {
            return Task.builder()
                .id(id)
                .sessionId(params.sessionId())
                .status(TaskStatus.of(TaskState.SUBMITTED))
                .history(ImmutableList.of(params.message()))
                .build();
          }
          return existing.withMessageAppended(params.message());
        });
  }

  /**
   * Replaces the status of a stored task and appends {@code artifacts}, when given.
   *
   * @throws TaskNotFoundException if no task is stored under {@code taskId}; the store is left
   *     unchanged
   */
  @CanIgnoreReturnValue
  protected Task updateStore(
      String taskId, TaskStatus status, @Nullable List<Artifact> artifacts) {
    Task updated =
        tasks.computeIfPresent(
            taskId,
            (id, task) -> {
              Task withStatus = task.withStatus(status);
              return artifacts == null ? withStatus : withStatus.withArtifactsAppended(artifacts);
            });
    if (updated == null) {
      logger.error("Task {} not found for updating the task", taskId);
      throw new TaskNotFoundException(taskId);
    }
    return updated;
  }

  @CanIgnoreReturnValue
  protected Task updateStore(String taskId, TaskStatus status) {
    return updateStore(taskId, status, null);
  }

  /** Returns the stored snapshot of a task. */
  public Optional<Task> getTask(String taskId) {
    return Optional.ofNullable(tasks.get(taskId));
  }
}
