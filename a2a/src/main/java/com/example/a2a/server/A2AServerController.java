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

import com.example.a2a.types.AgentCard;
import com.example.a2a.types.JsonRpcError;
import com.example.a2a.types.JsonRpcRequest;
import com.example.a2a.types.JsonRpcResponse;
import com.example.a2a.types.TaskIdParams;
import com.example.a2a.types.TaskQueryParams;
import com.example.a2a.types.TaskSendParams;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.flowables.ConnectableFlowable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.io.IOException;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * JSON-RPC endpoint of the A2A task protocol.
 *
 * <p>Every request is answered with HTTP 200; protocol failures travel in the JSON-RPC {@code
 * error} member. Streaming methods answer with Server-Sent Events, one JSON-RPC response per
 * event, unless the stream opens with an error, which is answered as plain JSON.
 */
@RestController
public class A2AServerController {

  private static final Logger logger = LoggerFactory.getLogger(A2AServerController.class);

  private final TaskManager taskManager;
  private final AgentCard agentCard;
  private final ObjectMapper objectMapper;
  private final long sseTimeoutMillis;

  public A2AServerController(
      TaskManager taskManager,
      AgentCard agentCard,
      ObjectMapper objectMapper,
      @Value("${a2a.server.sseTimeoutMillis:3600000}") long sseTimeoutMillis) {
    this.taskManager = taskManager;
    this.agentCard = agentCard;
    this.objectMapper = objectMapper;
    this.sseTimeoutMillis = sseTimeoutMillis;
  }

  @GetMapping(path = "/.well-known/agent.json", produces = MediaType.APPLICATION_JSON_VALUE)
  public AgentCard getAgentCard() {
    return agentCard;
  }

  /**
   * Dispatches a JSON-RPC request to the {@link TaskManager}.
   *
   * @return a {@link JsonRpcResponse}, or an {@link SseEmitter} for streaming methods
   */
  @PostMapping(path = "/", consumes = MediaType.APPLICATION_JSON_VALUE)
  public Object processRequest(@RequestBody String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      logger.warn("Rejecting request with malformed JSON: {}", e.getOriginalMessage());
      return JsonRpcResponse.error(null, JsonRpcError.parseError());
    }
    if (root == null || !root.isObject()) {
      logger.warn("Rejecting request that is not a JSON object");
      return JsonRpcResponse.error(null, JsonRpcError.invalidRequest(null));
    }

    Object requestId = readId(root.get("id"));
    JsonNode method = root.get("method");
    if (!JsonRpcResponse.JSONRPC_VERSION.equals(root.path("jsonrpc").asText())
        || method == null
        || !method.isTextual()) {
      logger.warn("Rejecting request {} without jsonrpc version or method", requestId);
      return JsonRpcResponse.error(
          requestId, JsonRpcError.invalidRequest("jsonrpc must be \"2.0\" and method is required"));
    }

    logger.debug("Received {} request {}", method.asText(), requestId);
    try {
      return dispatch(requestId, method.asText(), root.get("params"));
    } catch (InvalidParamsException e) {
      logger.warn("Rejecting {} request {}: {}", method.asText(), requestId, e.getMessage());
      return JsonRpcResponse.error(requestId, JsonRpcError.invalidParams(e.getMessage()));
    } catch (RuntimeException e) {
      logger.error("Unhandled error processing {} request {}", method.asText(), requestId, e);
      return JsonRpcResponse.error(
          requestId, JsonRpcError.internalError("Internal error: " + e.getMessage()));
    }
  }

  private Object dispatch(@Nullable Object requestId, String method, @Nullable JsonNode params) {
    switch (method) {
      case JsonRpcRequest.TASKS_SEND:
        return taskManager
            .onSendTask(bind(requestId, method, params, TaskSendParams.class))
            .blockingGet();
      case JsonRpcRequest.TASKS_SEND_SUBSCRIBE:
        return stream(
            requestId,
            taskManager.onSendTaskSubscribe(bind(requestId, method, params, TaskSendParams.class)));
      case JsonRpcRequest.TASKS_GET:
        return taskManager
            .onGetTask(bind(requestId, method, params, TaskQueryParams.class))
            .blockingGet();
      case JsonRpcRequest.TASKS_CANCEL:
        return taskManager
            .onCancelTask(bind(requestId, method, params, TaskIdParams.class))
            .blockingGet();
      case JsonRpcRequest.TASKS_RESUBSCRIBE:
        return stream(
            requestId,
            taskManager.onResubscribeToTask(
                bind(requestId, method, params, TaskQueryParams.class)));
      case JsonRpcRequest.TASKS_PUSH_NOTIFICATION_SET:
        return taskManager
            .onSetTaskPushNotification(bind(requestId, method, params, Object.class))
            .blockingGet();
      case JsonRpcRequest.TASKS_PUSH_NOTIFICATION_GET:
        return taskManager
            .onGetTaskPushNotification(bind(requestId, method, params, TaskIdParams.class))
            .blockingGet();
      default:
        logger.warn("Unknown method {} in request {}", method, requestId);
        return JsonRpcResponse.error(requestId, JsonRpcError.methodNotFound());
    }
  }

  private <P> JsonRpcRequest<P> bind(
      @Nullable Object requestId, String method, @Nullable JsonNode params, Class<P> paramsType) {
    if (params == null || params.isNull()) {
      throw new InvalidParamsException("Request params are missing");
    }
    try {
      return JsonRpcRequest.create(requestId, method, objectMapper.treeToValue(params, paramsType));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new InvalidParamsException("Invalid params for " + method + ": " + e.getMessage());
    }
  }

  /**
   * Answers a streaming method. A stream that opens with an error, such as a rejected request, is
   * answered with that single JSON-RPC response; any other stream is relayed as Server-Sent Events.
   */
  private Object stream(
      @Nullable Object requestId, Flowable<? extends JsonRpcResponse<?>> responses) {
    ConnectableFlowable<? extends JsonRpcResponse<?>> replayed =
        responses.subscribeOn(Schedulers.io()).replay();
    Disposable connection = replayed.connect();
    JsonRpcResponse<?> first;
    try {
      first = replayed.firstElement().blockingGet();
    } catch (RuntimeException e) {
      connection.dispose();
      throw e;
    }
    if (first != null && first.hasError()) {
      logger.debug("Answering request {} without a stream: {}", requestId, first.error());
      connection.dispose();
      return first;
    }

    SseEmitter emitter = new SseEmitter(sseTimeoutMillis);
    Disposable subscription =
        replayed.subscribe(
            response -> {
              logger.debug("SseEmitter: sending response for request {}", requestId);
              emitter.send(SseEmitter.event().data(objectMapper.writeValueAsString(response)));
            },
            error -> {
              logger.error("SseEmitter: stream error for request {}", requestId, error);
              try {
                JsonRpcResponse<Object> errorResponse =
                    JsonRpcResponse.error(
                        requestId,
                        JsonRpcError.internalError("Internal error: " + error.getMessage()));
                emitter.send(
                    SseEmitter.event().data(objectMapper.writeValueAsString(errorResponse)));
                emitter.complete();
              } catch (IOException | IllegalStateException e) {
                logger.warn(
                    "SseEmitter: could not report stream error for request {}: {}",
                    requestId,
                    e.getMessage());
                emitter.completeWithError(error);
              }
            },
            () -> {
              logger.debug("SseEmitter: stream completed for request {}", requestId);
              emitter.complete();
            });
    Disposable disposable = new CompositeDisposable(subscription, connection);
    emitter.onCompletion(disposable::dispose);
    emitter.onError(unused -> disposable.dispose());
    emitter.onTimeout(
        () -> {
          logger.debug("SseEmitter: timed out for request {}, disposing subscription", requestId);
          disposable.dispose();
          emitter.complete();
        });
    return emitter;
  }

  @Nullable
  private static Object readId(@Nullable JsonNode id) {
    if (id == null || id.isNull()) {
      return null;
    }
    if (id.isNumber()) {
      return id.numberValue();
    }
    return id.asText();
  }

  private static final class InvalidParamsException extends RuntimeException {
    InvalidParamsException(String message) {
      super(message);
    }
  }
}
