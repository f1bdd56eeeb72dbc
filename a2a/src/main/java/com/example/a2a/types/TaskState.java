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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle states of an A2A task. */
public enum TaskState {
  SUBMITTED("submitted"),
  WORKING("working"),
  INPUT_REQUIRED("input-required"),
  COMPLETED("completed"),
  CANCELED("canceled"),
  FAILED("failed"),
  UNKNOWN("unknown");

  private final String value;

  TaskState(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Returns true once no further status updates are expected for the task. */
  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELED || this == FAILED;
  }

  @JsonCreator
  public static TaskState fromValue(String value) {
    for (TaskState state : values()) {
      if (state.value.equals(value)) {
        return state;
      }
    }
    return UNKNOWN;
  }
}
