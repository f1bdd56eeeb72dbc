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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.example.a2a.types.Artifact;
import com.example.a2a.types.JsonRpcError;
import com.example.a2a.types.JsonRpcRequest;
import com.example.a2a.types.JsonRpcResponse;
import com.example.a2a.types.Message;
import com.example.a2a.types.Task;
import com.example.a2a.types.TaskIdParams;
import com.example.a2a.types.TaskQueryParams;
import com.example.a2a.types.TaskSendParams;
import com.example.a2a.types.TaskState;
import com.example.a2a.types.TaskStatus;
import com.example.a2a.types.TaskUpdateEvent;
import com.example.a2a.types.TextPart;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class InMemoryTaskManagerTest {

  private EchoTaskManager taskManager;

  @Before
  public void setUp() {
    taskManager = new EchoTaskManager();
  }

  private static Message userMessage(String text) {
    return Message.builder()
        .role(Message.Role.USER)
        .parts(ImmutableList.of(new TextPart(text)))
        .build();
  }

  private static TaskSendParams sendParams(String taskId, String text) {
    return TaskSendParams.builder()
        .id(taskId)
        .sessionId("session-1")
        .message(userMessage(text))
        .build();
  }

  @Test
  public void upsertTask_newTask_isSubmittedWithMessageInHistory() {
    Task task = taskManager.upsertTask(sendParams("task-1", "hello"));

    assertThat(task.id()).isEqualTo("task-1");
    assertThat(task.sessionId()).isEqualTo("session-1");
    assertThat(task.status().state()).isEqualTo(TaskState.SUBMITTED);
    assertThat(task.history()).containsExactly(userMessage("hello"));
    assertThat(task.artifacts()).isEmpty();
  }

  @Test
  public void upsertTask_existingTask_appendsMessageAndKeepsStatus() {
    taskManager.upsertTask(sendParams("task-1", "first"));
    taskManager.updateStore("task-1", TaskStatus.of(TaskState.WORKING));

    Task task = taskManager.upsertTask(sendParams("task-1", "second"));

    assertThat(task.status().state()).isEqualTo(TaskState.WORKING);
    assertThat(task.history())
        .containsExactly(userMessage("first"), userMessage("second"))
        .inOrder();
  }

  @Test
  public void updateStore_replacesStatusAndAppendsArtifacts() {
    taskManager.upsertTask(sendParams("task-1", "hello"));
    taskManager.updateStore(
        "task-1", TaskStatus.of(TaskState.WORKING), ImmutableList.of(Artifact.ofText("a")));

    Task task =
        taskManager.updateStore(
            "task-1",
            TaskStatus.of(TaskState.COMPLETED, Message.agentText("done")),
            ImmutableList.of(Artifact.ofText("b")));

    assertThat(task.status().state()).isEqualTo(TaskState.COMPLETED);
    assertThat(task.status().message()).isEqualTo(Message.agentText("done"));
    assertThat(task.artifacts())
        .containsExactly(Artifact.ofText("a"), Artifact.ofText("b"))
        .inOrder();
    assertThat(taskManager.getTask("task-1")).hasValue(task);
  }

  @Test
  public void updateStore_withoutArtifacts_leavesArtifactsUntouched() {
    taskManager.upsertTask(sendParams("task-1", "hello"));
    taskManager.updateStore(
        "task-1", TaskStatus.of(TaskState.WORKING), ImmutableList.of(Artifact.ofText("a")));

    Task task = taskManager.updateStore("task-1", TaskStatus.of(TaskState.FAILED));

    assertThat(task.artifacts()).containsExactly(Artifact.ofText("a"));
  }

  @Test
  public void updateStore_unknownTask_throwsAndCreatesNothing() {
    TaskNotFoundException e =
        assertThrows(
            TaskNotFoundException.class,
            () -> taskManager.updateStore("missing", TaskStatus.of(TaskState.WORKING)));

    assertThat(e.getTaskId()).isEqualTo("missing");
    assertThat(taskManager.getTask("missing")).isEmpty();
  }

  @Test
  public void onGetTask_unknownTask_returnsTaskNotFound() {
    JsonRpcResponse<Task> response =
        taskManager
            .onGetTask(
                JsonRpcRequest.create(
                    1, JsonRpcRequest.TASKS_GET, TaskQueryParams.create("missing", null, null)))
            .blockingGet();

    assertThat(response.id()).isEqualTo(1);
    assertThat(response.result()).isNull();
    assertThat(response.error().code()).isEqualTo(JsonRpcError.TASK_NOT_FOUND);
  }

  @Test
  public void onGetTask_withHistoryLength_returnsMostRecentMessages() {
    taskManager.upsertTask(sendParams("task-1", "one"));
    taskManager.upsertTask(sendParams("task-1", "two"));
    taskManager.upsertTask(sendParams("task-1", "three"));

    JsonRpcResponse<Task> response =
        taskManager
            .onGetTask(
                JsonRpcRequest.create(
                    "req", JsonRpcRequest.TASKS_GET, TaskQueryParams.create("task-1", 2, null)))
            .blockingGet();

    assertThat(response.hasError()).isFalse();
    assertThat(response.result().history())
        .containsExactly(userMessage("two"), userMessage("three"))
        .inOrder();
    assertThat(taskManager.getTask("task-1").get().history()).hasSize(3);
  }

  @Test
  public void onGetTask_withoutHistoryLength_omitsHistory() {
    taskManager.upsertTask(sendParams("task-1", "one"));

    JsonRpcResponse<Task> response =
        taskManager
            .onGetTask(
                JsonRpcRequest.create(
                    "req", JsonRpcRequest.TASKS_GET, TaskQueryParams.create("task-1", null, null)))
            .blockingGet();

    assertThat(response.result().history()).isEmpty();
  }

  @Test
  public void onCancelTask_knownTask_returnsNotCancelable() {
    taskManager.upsertTask(sendParams("task-1", "hello"));

    JsonRpcResponse<Task> response =
        taskManager
            .onCancelTask(
                JsonRpcRequest.create(
                    1, JsonRpcRequest.TASKS_CANCEL, TaskIdParams.create("task-1", null)))
            .blockingGet();

    assertThat(response.error().code()).isEqualTo(JsonRpcError.TASK_NOT_CANCELABLE);
    assertThat(taskManager.getTask("task-1").get().status().state())
        .isEqualTo(TaskState.SUBMITTED);
  }

  @Test
  public void onCancelTask_unknownTask_returnsTaskNotFound() {
    JsonRpcResponse<Task> response =
        taskManager
            .onCancelTask(
                JsonRpcRequest.create(
                    1, JsonRpcRequest.TASKS_CANCEL, TaskIdParams.create("missing", null)))
            .blockingGet();

    assertThat(response.error().code()).isEqualTo(JsonRpcError.TASK_NOT_FOUND);
  }

  @Test
  public void onResubscribeToTask_returnsUnsupportedOperation() {
    List<JsonRpcResponse<TaskUpdateEvent>> responses =
        taskManager
            .onResubscribeToTask(
                JsonRpcRequest.create(
                    7, JsonRpcRequest.TASKS_RESUBSCRIBE, TaskQueryParams.create("t", null, null)))
            .toList()
            .blockingGet();

    assertThat(responses).hasSize(1);
    assertThat(responses.get(0).id()).isEqualTo(7);
    assertThat(responses.get(0).error().code()).isEqualTo(JsonRpcError.UNSUPPORTED_OPERATION);
  }

  @Test
  public void pushNotificationMethods_areNotSupported() {
    JsonRpcResponse<Object> set =
        taskManager
            .onSetTaskPushNotification(
                JsonRpcRequest.create(1, JsonRpcRequest.TASKS_PUSH_NOTIFICATION_SET, new Object()))
            .blockingGet();
    JsonRpcResponse<Object> get =
        taskManager
            .onGetTaskPushNotification(
                JsonRpcRequest.create(
                    2, JsonRpcRequest.TASKS_PUSH_NOTIFICATION_GET, TaskIdParams.create("t", null)))
            .blockingGet();

    assertThat(set.error().code()).isEqualTo(JsonRpcError.PUSH_NOTIFICATION_NOT_SUPPORTED);
    assertThat(get.error().code()).isEqualTo(JsonRpcError.PUSH_NOTIFICATION_NOT_SUPPORTED);
  }

  @Test
  public void updateStore_concurrentUpdatesToOneTask_areAllApplied() throws Exception {
    int threads = 8;
    int updatesPerThread = 100;
    taskManager.upsertTask(sendParams("task-1", "hello"));
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        int thread = t;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < updatesPerThread; i++) {
                    taskManager.updateStore(
                        "task-1",
                        TaskStatus.of(TaskState.WORKING),
                        ImmutableList.of(Artifact.ofText(thread + "-" + i)));
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(taskManager.getTask("task-1").get().artifacts()).hasSize(threads * updatesPerThread);
  }
}
