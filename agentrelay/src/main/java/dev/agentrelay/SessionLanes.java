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
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.agentrelay;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import dev.agentrelay.ai.session.SessionKey;

/**
 * SessionLanes runs asynchronous tasks one at a time per session.
 *
 * <p>
 * A task submitted for a session starts only after every task previously
 * submitted for that session has completed, whether normally or not. Tasks for
 * different sessions do not wait on each other.
 */
public class SessionLanes {

  private final Map<SessionKey, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
  private final Executor executor;

  /**
   * Creates a new SessionLanes.
   *
   * @param executor
   *            the executor that starts each task
   */
  public SessionLanes(Executor executor) {
    this.executor = executor;
  }

  /**
   * Submits a task to the lane of a session.
   *
   * @param key
   *            the session key
   * @param task
   *            supplies the task's future once the lane is free
   * @param <T>
   *            the result type
   * @return a future completed with the task's result; cancelling it does not
   *         release the lane early
   */
  public <T> CompletableFuture<T> submit(SessionKey key, Supplier<CompletableFuture<T>> task) {
    CompletableFuture<T> result = new CompletableFuture<>();
    CompletableFuture<Void> gate = new CompletableFuture<>();
    CompletableFuture<Void> previous = tails.put(key, gate);
    gate.whenComplete((ignored, e) -> tails.remove(key, gate));

    CompletableFuture<Void> start = previous != null ? previous : CompletableFuture.completedFuture(null);
    start.thenComposeAsync(ignored -> start(task), executor).whenComplete((value, e) -> {
      if (e != null) {
        result.completeExceptionally(unwrap(e));
      } else {
        result.complete(value);
      }
      gate.complete(null);
    });
    return result;
  }

  /**
   * Returns the number of sessions with a running or queued task.
   *
   * @return the number of busy lanes
   */
  public int activeLanes() {
    return tails.size();
  }

  private static <T> CompletableFuture<T> start(Supplier<CompletableFuture<T>> task) {
    try {
      CompletableFuture<T> future = task.get();
      return future != null ? future : CompletableFuture.failedFuture(new NullPointerException("task returned null"));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  static Throwable unwrap(Throwable e) {
    if (e instanceof CompletionException && e.getCause() != null) {
      return e.getCause();
    }
    return e;
  }
}
