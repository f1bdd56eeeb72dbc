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

import com.google.adk.agents.BaseAgent;
import com.google.adk.agents.InvocationContext;
import com.google.adk.events.Event;
import com.google.adk.events.EventActions;
import com.google.common.collect.ImmutableList;
import com.google.genai.types.Content;
import com.google.genai.types.Part;
import io.reactivex.rxjava3.core.Flowable;

/** Stands in for the LLM assistant: answers every run with a fixed list of model replies. */
final class ScriptedAgent extends BaseAgent {

  private final Flowable<String> replies;

  private ScriptedAgent(Flowable<String> replies) {
    super("scripted_agent", "Replies from a script", ImmutableList.of(), null, null);
    this.replies = replies;
  }

  static ScriptedAgent replying(String... replies) {
    return new ScriptedAgent(Flowable.fromArray(replies));
  }

  static ScriptedAgent failing(RuntimeException error) {
    return new ScriptedAgent(Flowable.error(error));
  }

  static ScriptedAgent silent() {
    return new ScriptedAgent(Flowable.never());
  }

  @Override
  protected Flowable<Event> runAsyncImpl(InvocationContext invocationContext) {
    return replies.map(
        text ->
            Event.builder()
                .id(Event.generateEventId())
                .invocationId(invocationContext.invocationId())
                .author(name())
                .content(
                    Content.builder()
                        .role("model")
                        .parts(ImmutableList.of(Part.builder().text(text).build()))
                        .build())
                .actions(EventActions.builder().build())
                .build());
  }

  @Override
  protected Flowable<Event> runLiveImpl(InvocationContext invocationContext) {
    return Flowable.empty();
  }
}
