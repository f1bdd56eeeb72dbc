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

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;

/** A conversational agent answering one query per call, in one-shot or streaming form. */
public interface ChatAgent {

  /** Runs the conversation to its end and emits the text of the last message. */
  Single<String> invoke(String query, String sessionId);

  /**
   * Streams the conversation. Every update but the last has {@link AgentUpdate#isTaskComplete()}
   * false; the stream completes after the one complete update.
   */
  Flowable<AgentUpdate> stream(String query, String sessionId);
}
