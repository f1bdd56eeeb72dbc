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

import static com.google.common.truth.Truth.assertThat;

import com.example.a2a.types.JsonRpcError;
import com.example.a2a.types.JsonRpcResponse;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ServerUtilsTest {

  private static final ImmutableList<String> TEXT_MODES = ImmutableList.of("text", "text/plain");

  @Test
  public void areModalitiesCompatible_overlap_isCompatible() {
    assertThat(
            ServerUtils.areModalitiesCompatible(
                TEXT_MODES, ImmutableList.of("image/png", "text/plain")))
        .isTrue();
  }

  @Test
  public void areModalitiesCompatible_noOverlap_isIncompatible() {
    assertThat(ServerUtils.areModalitiesCompatible(TEXT_MODES, ImmutableList.of("image/png")))
        .isFalse();
  }

  @Test
  public void areModalitiesCompatible_clientAcceptsAnything() {
    assertThat(ServerUtils.areModalitiesCompatible(TEXT_MODES, null)).isTrue();
    assertThat(ServerUtils.areModalitiesCompatible(TEXT_MODES, ImmutableList.of())).isTrue();
  }

  @Test
  public void areModalitiesCompatible_serverWithoutModes_acceptsAnything() {
    assertThat(ServerUtils.areModalitiesCompatible(null, ImmutableList.of("image/png"))).isTrue();
    assertThat(ServerUtils.areModalitiesCompatible(ImmutableList.of(), ImmutableList.of("x")))
        .isTrue();
  }

  @Test
  public void newIncompatibleTypesError_carriesRequestId() {
    JsonRpcResponse<Object> response = ServerUtils.newIncompatibleTypesError("req-1");

    assertThat(response.id()).isEqualTo("req-1");
    assertThat(response.result()).isNull();
    assertThat(response.error().code()).isEqualTo(JsonRpcError.CONTENT_TYPE_NOT_SUPPORTED);
  }

  @Test
  public void newNotImplementedError_isUnsupportedOperation() {
    JsonRpcResponse<Object> response = ServerUtils.newNotImplementedError(3);

    assertThat(response.error().code()).isEqualTo(JsonRpcError.UNSUPPORTED_OPERATION);
  }
}
