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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.adk.agents.BaseAgent;
import com.google.adk.agents.LlmAgent;
import com.google.adk.agents.RunConfig;
import com.google.adk.artifacts.InMemoryArtifactService;
import com.google.adk.events.Event;
import com.google.adk.memory.InMemoryMemoryService;
import com.google.adk.runner.Runner;
import com.google.adk.sessions.InMemorySessionService;
import com.google.adk.tools.FunctionTool;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.genai.types.Content;
import com.google.genai.types.Part;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the weather assistant as a turn-taking conversation that ends on a {@link
 * TerminationCondition}.
 *
 * <p>Every call runs in a fresh ADK session that is deleted when the run ends, so nothing is
 * remembered between calls; the caller's session id only names the ADK user. When the termination
 * condition fires the upstream run is cancelled.
 */
public final class WeatherAgent implements ChatAgent {

  private static final Logger logger = LoggerFactory.getLogger(WeatherAgent.class);

  public static final ImmutableList<String> SUPPORTED_CONTENT_TYPES =
      ImmutableList.of("text", "text/plain");

  public static final String STOP_PHRASE = "TERMINATE";
  public static final int DEFAULT_MAX_MESSAGES = 5;

  static final String PROCESSING_MESSAGE = "Processing your weather request...";
  static final String FALLBACK_RESPONSE = "I couldn't process your weather request.";
  static final String RUN_COMPLETED_REASON = "Agent run completed";

  private static final String INSTRUCTION =
      """
      You are a helpful weather assistant that can provide weather information.
      Use the getWeather tool to look up current weather. Pass 'celsius' as the unit unless the \
      user asks for fahrenheit.
      If the user asks about anything other than weather, respond to them very briefly but also \
      politely let them know that you can only provide weather information.
      Once you have responded to the user, end with 'TERMINATE'.
      """;

  private static final RunConfig RUN_CONFIG =
      RunConfig.builder().setStreamingMode(RunConfig.StreamingMode.NONE).setMaxLlmCalls(20).build();

  private final InMemorySessionService sessionService;
  private final Runner runner;
  private final String appName;
  private final TerminationCondition terminationCondition;
  private final Duration timeout;

  public WeatherAgent(
      BaseAgent assistant,
      String appName,
      TerminationCondition terminationCondition,
      Duration timeout) {
    this.sessionService = new InMemorySessionService();
    this.runner =
        new Runner(
            assistant,
            appName,
            new InMemoryArtifactService(),
            sessionService,
            new InMemoryMemoryService());
    this.appName = appName;
    this.terminationCondition = terminationCondition;
    this.timeout = timeout;
  }

  /** Builds the LLM assistant that owns the weather tool. */
  public static LlmAgent createAssistant(String model) {
    return LlmAgent.builder()
        .name("weather_assistant")
        .description("A helpful weather assistant that can provide weather information.")
        .model(model)
        .instruction(INSTRUCTION)
        .tools(FunctionTool.create(WeatherTool.class, "getWeather"))
        .build();
  }

  /** Stops on the stop phrase or after {@code maxMessages} messages, whichever comes first. */
  public static TerminationCondition defaultTermination(int maxMessages) {
    return TerminationCondition.textMention(STOP_PHRASE)
        .or(TerminationCondition.maxMessages(maxMessages));
  }

  @Override
  public Single<String> invoke(String query, String sessionId) {
    return conversation(query, sessionId, new AtomicReference<>())
        .filter(message -> !message.partial)
        .toList()
        .map(
            messages -> {
              if (messages.isEmpty()) {
                logger.warn("Agent produced no message for session {}", sessionId);
                return FALLBACK_RESPONSE;
              }
              return messages.get(messages.size() - 1).text;
            })
        .timeout(timeout.toMillis(), MILLISECONDS);
  }

  @Override
  public Flowable<AgentUpdate> stream(String query, String sessionId) {
    return Flowable.defer(
        () -> {
          AtomicReference<String> stopReason = new AtomicReference<>(RUN_COMPLETED_REASON);
          Flowable<AgentUpdate> messages =
              conversation(query, sessionId, stopReason)
                  .map(message -> AgentUpdate.working(message.text))
                  .timeout(timeout.toMillis(), MILLISECONDS);
          return Flowable.just(AgentUpdate.working(PROCESSING_MESSAGE))
              .concatWith(messages)
              .concatWith(
                  Flowable.fromCallable(
                      () ->
                          AgentUpdate.completed(
                              "Task completed successfully. Reason: " + stopReason.get())));
        });
  }

  /**
   * Emits the messages of one run until the termination condition fires or the runner completes.
   * Partial messages are passed through but do not count towards the termination condition.
   */
  private Flowable<ChatMessage> conversation(
      String query, String sessionId, AtomicReference<String> stopReason) {
    return Flowable.defer(
        () -> {
          String userId = "user-" + sessionId;
          List<String> transcript = new ArrayList<>();
          transcript.add(query);
          return sessionService
              .createSession(
                  appName, userId, new ConcurrentHashMap<>(), UUID.randomUUID().toString())
              .flatMapPublisher(
                  session -> {
                    logger.debug(
                        "Starting weather conversation {} for session {}", session.id(), sessionId);
                    // Eager disposal removes the session before the run's terminal signal.
                    return Flowable.using(
                        () -> session,
                        s -> runner.runAsync(userId, s.id(), userContent(query), RUN_CONFIG),
                        s -> deleteSession(userId, s.id()));
                  })
              .map(WeatherAgent::toChatMessage)
              .filter(message -> !message.text.isEmpty())
              .takeUntil(
                  message -> {
                    if (message.partial) {
                      return false;
                    }
                    transcript.add(message.text);
                    Optional<String> reason = terminationCondition.check(transcript);
                    if (reason.isPresent()) {
                      logger.debug(
                          "Conversation for session {} stopped: {}", sessionId, reason.get());
                      stopReason.set(reason.get());
                      return true;
                    }
                    return false;
                  });
        });
  }

  private void deleteSession(String userId, String adkSessionId) {
    sessionService
        .deleteSession(appName, userId, adkSessionId)
        .subscribe(
            () -> logger.debug("Deleted weather conversation {}", adkSessionId),
            error ->
                logger.warn("Could not delete weather conversation {}", adkSessionId, error));
  }

  @VisibleForTesting
  InMemorySessionService sessionService() {
    return sessionService;
  }

  private static Content userContent(String query) {
    return Content.builder()
        .role("user")
        .parts(ImmutableList.of(Part.builder().text(query).build()))
        .build();
  }

  /** Renders an event as text: text parts verbatim, tool calls and tool results summarized. */
  static ChatMessage toChatMessage(Event event) {
    List<Part> parts = event.content().flatMap(Content::parts).orElse(ImmutableList.of());
    List<String> pieces = new ArrayList<>();
    for (Part part : parts) {
      part.text().ifPresent(pieces::add);
      part.functionCall()
          .ifPresent(
              call ->
                  pieces.add(call.name().orElse("") + "(" + call.args().orElse(Map.of()) + ")"));
      part.functionResponse()
          .ifPresent(response -> pieces.add(String.valueOf(response.response().orElse(Map.of()))));
    }
    return new ChatMessage(String.join("\n", pieces), event.partial().orElse(false));
  }

  /** Text of one conversation message. */
  static final class ChatMessage {
    final String text;
    final boolean partial;

    ChatMessage(String text, boolean partial) {
      this.text = text;
      this.partial = partial;
    }
  }
}
