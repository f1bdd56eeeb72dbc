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

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the A2A JSON-RPC endpoint.
 *
 * <p>Importers must supply a {@link TaskManager} bean and a {@link com.example.a2a.types.AgentCard}
 * bean. The agent behind the task manager stays opaque to this module.
 */
@Configuration
@ComponentScan(basePackages = "com.example.a2a.server")
public class A2AServerConfiguration {}
