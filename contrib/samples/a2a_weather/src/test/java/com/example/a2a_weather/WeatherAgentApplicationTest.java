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

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.a2a.types.JsonRpcError;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/** Boots the weather agent application without calling the model. */
@SpringBootTest
@AutoConfigureMockMvc
public class WeatherAgentApplicationTest {

  @Autowired private MockMvc mockMvc;

  @Test
  public void agentCard_describesWeatherSkill() throws Exception {
    mockMvc
        .perform(get("/.well-known/agent.json"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name", Matchers.is("Weather Assistant")))
        .andExpect(jsonPath("$.url", Matchers.is("http://localhost:10000/")))
        .andExpect(jsonPath("$.version", Matchers.is("1.0.0")))
        .andExpect(jsonPath("$.capabilities.streaming", Matchers.is(true)))
        .andExpect(jsonPath("$.defaultInputModes", Matchers.contains("text", "text/plain")))
        .andExpect(jsonPath("$.skills[0].id", Matchers.is("weather_information")))
        .andExpect(jsonPath("$.skills[0].tags", Matchers.contains("weather", "forecast")))
        .andExpect(jsonPath("$.skills[0].examples.length()", Matchers.is(5)));
  }

  @Test
  public void tasksSend_incompatibleOutputMode_isRejectedBeforeModelCall() throws Exception {
    String body =
        "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tasks/send\",\"params\":{\"id\":\"t-1\","
            + "\"acceptedOutputModes\":[\"image/png\"],\"message\":{\"role\":\"user\","
            + "\"parts\":[{\"type\":\"text\",\"text\":\"Weather in Tokyo?\"}]}}}";

    mockMvc
        .perform(post("/").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id", Matchers.is(1)))
        .andExpect(
            jsonPath("$.error.code", Matchers.is(JsonRpcError.CONTENT_TYPE_NOT_SUPPORTED)));
  }

  @Test
  public void tasksCancel_unknownTask_isTaskNotFound() throws Exception {
    String body =
        "{\"jsonrpc\":\"2.0\",\"id\":\"c\",\"method\":\"tasks/cancel\",\"params\":{\"id\":\"x\"}}";

    mockMvc
        .perform(post("/").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(jsonPath("$.error.code", Matchers.is(JsonRpcError.TASK_NOT_FOUND)));
  }
}
