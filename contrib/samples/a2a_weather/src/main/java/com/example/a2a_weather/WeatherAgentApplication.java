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

import com.example.a2a.server.A2AServerConfiguration;
import com.example.a2a.server.TaskManager;
import com.example.a2a.types.AgentCapabilities;
import com.example.a2a.types.AgentCard;
import com.example.a2a.types.AgentSkill;
import com.google.adk.agents.BaseAgent;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/** Spring Boot entry point that serves the weather assistant over A2A. */
@SpringBootApplication
@Import(A2AServerConfiguration.class)
public class WeatherAgentApplication {

  private static final Logger log = LoggerFactory.getLogger(WeatherAgentApplication.class);

  static final String API_KEY_ENV = "GOOGLE_API_KEY";

  public static void main(String[] args) {
    if (Strings.isNullOrEmpty(System.getenv(API_KEY_ENV))) {
      log.error("Error: {} environment variable not set.", API_KEY_ENV);
      System.exit(1);
    }
    try {
      SpringApplication.run(WeatherAgentApplication.class, args);
    } catch (RuntimeException e) {
      log.error("An error occurred during server startup: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  @Bean
  public BaseAgent weatherAssistant(@Value("${weather.agent.model}") String model) {
    log.info("Using model {} for the weather assistant", model);
    return WeatherAgent.createAssistant(model);
  }

  @Bean
  public ChatAgent weatherAgent(
      BaseAgent weatherAssistant,
      @Value("${weather.agent.appName}") String appName,
      @Value("${weather.agent.maxMessages}") int maxMessages,
      @Value("${weather.agent.timeoutSeconds}") long timeoutSeconds) {
    return new WeatherAgent(
        weatherAssistant,
        appName,
        WeatherAgent.defaultTermination(maxMessages),
        Duration.ofSeconds(timeoutSeconds));
  }

  @Bean
  public TaskManager taskManager(ChatAgent weatherAgent) {
    return new WeatherTaskManager(weatherAgent);
  }

  @Bean
  public AgentCard agentCard(
      @Value("${server.address:localhost}") String host,
      @Value("${server.port:10000}") int port) {
    return AgentCard.builder()
        .name("Weather Assistant")
        .description("A helpful assistant that provides current weather information for cities.")
        .url(String.format("http://%s:%d/", host, port))
        .version("1.0.0")
        .capabilities(AgentCapabilities.create(true, false, false))
        .defaultInputModes(WeatherAgent.SUPPORTED_CONTENT_TYPES)
        .defaultOutputModes(WeatherAgent.SUPPORTED_CONTENT_TYPES)
        .skills(
            ImmutableList.of(
                AgentSkill.builder()
                    .id("weather_information")
                    .name("Weather Information")
                    .description("Provides current weather conditions for cities around the world")
                    .tags(ImmutableList.of("weather", "forecast"))
                    .examples(
                        ImmutableList.of(
                            "What's the weather like in New York?",
                            "Is it raining in London?",
                            "Temperature in Tokyo",
                            "How's the weather in Paris?",
                            "What's the humidity in Sydney?"))
                    .build()))
        .build();
  }
}
