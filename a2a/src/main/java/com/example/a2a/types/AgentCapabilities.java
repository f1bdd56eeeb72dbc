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
package com.example.a2a.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;

/** Optional protocol features an agent supports. */
@AutoValue
public abstract class AgentCapabilities {

  @JsonProperty("streaming")
  public abstract boolean streaming();

  @JsonProperty("pushNotifications")
  public abstract boolean pushNotifications();

  @JsonProperty("stateTransitionHistory")
  public abstract boolean stateTransitionHistory();

  public static AgentCapabilities create(
      boolean streaming, boolean pushNotifications, boolean stateTransitionHistory) {
    return new AutoValue_AgentCapabilities(streaming, pushNotifications, stateTransitionHistory);
  }
}
