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

import com.example.a2a.types.AgentCapabilities;
import com.example.a2a.types.AgentCard;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/** Boots the A2A endpoint around an {@link EchoTaskManager}. */
@SpringBootApplication
public class TestA2AApplication {

  @Bean
  public TaskManager taskManager() {
    return new EchoTaskManager();
  }

  @Bean
  public AgentCard agentCard() {
    return AgentCard.builder()
        .name("Echo Agent")
        .url("http://localhost:10000/")
        .version("1.0.0")
        .capabilities(AgentCapabilities.create(true, false, false))
        .build();
  }
}
