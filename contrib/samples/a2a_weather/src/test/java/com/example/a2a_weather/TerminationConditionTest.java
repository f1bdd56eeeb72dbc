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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TerminationConditionTest {

  @Test
  public void textMention_firesOnLatestMessageOnly() {
    TerminationCondition condition = TerminationCondition.textMention("TERMINATE");

    assertThat(condition.check(ImmutableList.of("query", "answer"))).isEmpty();
    assertThat(condition.check(ImmutableList.of("query", "answer TERMINATE")))
        .hasValue("Text 'TERMINATE' mentioned");
    assertThat(condition.check(ImmutableList.of("TERMINATE", "answer"))).isEmpty();
    assertThat(condition.check(ImmutableList.of())).isEmpty();
  }

  @Test
  public void maxMessages_firesWhenCountReached() {
    TerminationCondition condition = TerminationCondition.maxMessages(3);

    assertThat(condition.check(ImmutableList.of("a", "b"))).isEmpty();
    assertThat(condition.check(ImmutableList.of("a", "b", "c")))
        .hasValue("Maximum number of messages 3 reached, current message count: 3");
  }

  @Test
  public void maxMessages_rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> TerminationCondition.maxMessages(0));
  }

  @Test
  public void or_reportsFirstConditionThatFires() {
    TerminationCondition condition = WeatherAgent.defaultTermination(2);

    assertThat(condition.check(ImmutableList.of("query"))).isEmpty();
    assertThat(condition.check(ImmutableList.of("query", "done TERMINATE")))
        .hasValue("Text 'TERMINATE' mentioned");
    assertThat(condition.check(ImmutableList.of("query", "still going")))
        .hasValue("Maximum number of messages 2 reached, current message count: 2");
  }
}
