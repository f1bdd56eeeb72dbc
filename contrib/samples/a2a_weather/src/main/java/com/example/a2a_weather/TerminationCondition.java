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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.Optional;

/** Decides when a multi-turn conversation has run long enough. */
@FunctionalInterface
public interface TerminationCondition {

  /**
   * Inspects the conversation so far, oldest message first, starting with the user's request.
   *
   * @return the stop reason once the conversation should end, or empty to continue
   */
  Optional<String> check(List<String> transcript);

  /** Stops as soon as either this condition or {@code other} fires. */
  default TerminationCondition or(TerminationCondition other) {
    return transcript -> {
      Optional<String> reason = check(transcript);
      return reason.isPresent() ? reason : other.check(transcript);
    };
  }

  /** Stops once the latest message contains {@code text}. */
  static TerminationCondition textMention(String text) {
    return transcript -> {
      if (!transcript.isEmpty() && transcript.get(transcript.size() - 1).contains(text)) {
        return Optional.of("Text '" + text + "' mentioned");
      }
      return Optional.empty();
    };
  }

  /** Stops once the conversation holds {@code maxMessages} messages. */
  static TerminationCondition maxMessages(int maxMessages) {
    checkArgument(maxMessages > 0, "maxMessages must be positive");
    return transcript -> {
      if (transcript.size() >= maxMessages) {
        return Optional.of(
            "Maximum number of messages "
                + maxMessages
                + " reached, current message count: "
                + transcript.size());
      }
      return Optional.empty();
    };
  }
}
