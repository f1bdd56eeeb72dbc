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

import com.example.a2a.types.JsonRpcError;
import com.example.a2a.types.JsonRpcResponse;
import java.util.Collection;
import javax.annotation.Nullable;

/** Helpers shared by task manager implementations. */
public final class ServerUtils {

  /**
   * Returns whether a client accepting {@code clientModes} can consume output in one of {@code
   * serverModes}. An empty or missing list on either side accepts everything.
   */
  public static boolean areModalitiesCompatible(
      @Nullable Collection<String> serverModes, @Nullable Collection<String> clientModes) {
    if (clientModes == null || clientModes.isEmpty()) {
      return true;
    }
    if (serverModes == null || serverModes.isEmpty()) {
      return true;
    }
    return clientModes.stream().anyMatch(serverModes::contains);
  }

  public static <T> JsonRpcResponse<T> newIncompatibleTypesError(@Nullable Object requestId) {
    return JsonRpcResponse.error(requestId, JsonRpcError.contentTypeNotSupported());
  }

  public static <T> JsonRpcResponse<T> newNotImplementedError(@Nullable Object requestId) {
    return JsonRpcResponse.error(requestId, JsonRpcError.unsupportedOperation());
  }

  private ServerUtils() {}
}
