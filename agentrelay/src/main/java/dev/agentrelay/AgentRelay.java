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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.agentrelay.ai.CapabilityException;
import dev.agentrelay.ai.Handler;
import dev.agentrelay.ai.ToolContext;
import dev.agentrelay.ai.ToolResult;
import dev.agentrelay.ai.routing.CapabilityTable;
import dev.agentrelay.ai.routing.CoordinatorRouter;
import dev.agentrelay.ai.routing.InferenceEngine;
import dev.agentrelay.ai.routing.Route;
import dev.agentrelay.ai.routing.Router;
import dev.agentrelay.ai.session.InMemorySessionStore;
import dev.agentrelay.ai.session.Session;
import dev.agentrelay.ai.session.SessionKey;
import dev.agentrelay.ai.session.SessionStore;
import dev.agentrelay.ai.telemetry.TurnTelemetry;
import dev.agentrelay.core.Action;
import dev.agentrelay.core.ActionType;
import dev.agentrelay.core.DefaultRegistry;
import dev.agentrelay.core.ErrorKind;
import dev.agentrelay.core.JsonUtils;
import dev.agentrelay.core.Plugin;
import dev.agentrelay.core.Registry;
import dev.agentrelay.core.RelayException;

/**
 * AgentRelay is the main entry point. It owns the session store and the
 * router, and drives each conversation turn: load the session, route the
 * utterance, invoke at most one tool, commit the resulting state write and
 * return the reply.
 *
 * <pre>{@code
 * AgentRelay relay = AgentRelay.builder().plugin(new WeatherPlugin()).inferenceEngine(engine)
 *     .rootHandler("weather_agent_v2").build();
 * relay.createSession("weather_app", "user_1", "session_001");
 * String reply = relay.runTurn("What is the weather in London?", "weather_app", "user_1", "session_001");
 * }</pre>
 *
 * <p>
 * Turns on one session run strictly one after another; turns on different
 * sessions run concurrently. A tool's state write is committed only when the
 * tool succeeded within the turn timeout and the caller did not cancel the
 * turn.
 */
public class AgentRelay {

  private static final Logger logger = LoggerFactory.getLogger(AgentRelay.class);

  private final AgentRelayOptions options;
  private final Registry registry;
  private final List<Plugin> plugins;
  private final SessionStore sessionStore;
  private final Executor executor;
  private final SessionLanes lanes;
  private Router router;
  private Handler rootHandler;

  private AgentRelay(AgentRelayOptions options, SessionStore sessionStore, Executor executor) {
    this.options = options;
    this.registry = new DefaultRegistry();
    this.plugins = new ArrayList<>();
    this.sessionStore = sessionStore;
    this.executor = executor;
    this.lanes = new SessionLanes(executor);
  }

  /**
   * Creates a new AgentRelay builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  private void init() {
    for (Plugin plugin : plugins) {
      try {
        registry.registerPlugin(plugin.getName(), plugin);
        List<Action> actions = plugin.init(registry);
        for (Action action : actions) {
          action.register(registry);
        }
        logger.info("Initialized plugin: {}", plugin.getName());
      } catch (RuntimeException e) {
        logger.error("Failed to initialize plugin: {}", plugin.getName(), e);
        throw new RelayException("Failed to initialize plugin: " + plugin.getName(), e);
      }
    }
  }

  private Handler resolveHandler(String name) {
    Action action = registry.lookupAction(ActionType.HANDLER, name);
    if (!(action instanceof Handler)) {
      throw new RelayException(ErrorKind.NOT_FOUND, "No handler registered as '" + name + "'");
    }
    return (Handler) action;
  }

  // Sessions

  /**
   * Creates a session with empty state.
   *
   * @param appName
   *            the application name
   * @param userId
   *            the user id
   * @param sessionId
   *            the session id
   * @return the new session
   * @throws dev.agentrelay.ai.session.SessionException
   *             if the session already exists
   */
  public Session createSession(String appName, String userId, String sessionId) {
    return createSession(appName, userId, sessionId, null);
  }

  /**
   * Creates a session.
   *
   * @param appName
   *            the application name
   * @param userId
   *            the user id
   * @param sessionId
   *            the session id
   * @param initialState
   *            the initial state, may be null
   * @return the new session
   * @throws dev.agentrelay.ai.session.SessionException
   *             if the session already exists
   */
  public Session createSession(String appName, String userId, String sessionId, Map<String, Object> initialState) {
    Session session = await(sessionStore.create(SessionKey.of(appName, userId, sessionId), initialState));
    logger.info("Created session {} with state {}", session.getKey(), session.getState());
    return session;
  }

  /**
   * Gets a session.
   *
   * @param appName
   *            the application name
   * @param userId
   *            the user id
   * @param sessionId
   *            the session id
   * @return the session snapshot
   * @throws dev.agentrelay.ai.session.SessionException
   *             if the session does not exist
   */
  public Session getSession(String appName, String userId, String sessionId) {
    return await(sessionStore.get(SessionKey.of(appName, userId, sessionId)));
  }

  /**
   * Merges a partial state mapping into a session between turns, for example
   * to change a user preference. The write waits for any in-flight turn on the
   * session.
   *
   * @param appName
   *            the application name
   * @param userId
   *            the user id
   * @param sessionId
   *            the session id
   * @param write
   *            the partial state mapping
   * @return the updated session
   */
  public Session applyStateWrite(String appName, String userId, String sessionId, Map<String, Object> write) {
    SessionKey key = SessionKey.of(appName, userId, sessionId);
    return await(lanes.submit(key, () -> sessionStore.applyStateWrite(key, write)));
  }

  // Turns

  /**
   * Runs one turn and returns the reply.
   *
   * @param utterance
   *            the user utterance
   * @param appName
   *            the application name
   * @param userId
   *            the user id
   * @param sessionId
   *            the session id
   * @return the final reply text
   * @throws dev.agentrelay.ai.session.SessionException
   *             if the session does not exist
   * @throws CapabilityException
   *             if a handler selected a tool outside its allow-list
   */
  public String runTurn(String utterance, String appName, String userId, String sessionId) {
    return await(runTurnAsync(utterance, appName, userId, sessionId)).getFinalText();
  }

  /**
   * Runs one turn asynchronously. The turn starts once every earlier turn on
   * the same session has finished.
   *
   * @param utterance
   *            the user utterance
   * @param appName
   *            the application name
   * @param userId
   *            the user id
   * @param sessionId
   *            the session id
   * @return a future completed with the finalized turn; cancelling it before
   *         the turn commits prevents the commit
   */
  public CompletableFuture<Turn> runTurnAsync(String utterance, String appName, String userId, String sessionId) {
    SessionKey key = SessionKey.of(appName, userId, sessionId);
    CompletableFuture<Turn> result = new CompletableFuture<>();
    lanes.submit(key, () -> executeTurn(new Turn(key, utterance), result)).whenComplete((turn, e) -> {
      if (e != null) {
        result.completeExceptionally(e);
      } else {
        result.complete(turn);
      }
    });
    return result;
  }

  private CompletableFuture<Turn> executeTurn(Turn turn, CompletableFuture<Turn> caller) {
    long startMs = System.currentTimeMillis();
    logger.debug("Starting turn on {}: '{}'", turn.getSessionKey(), turn.getUtterance());
    return sessionStore.get(turn.getSessionKey()).handle((session, e) -> {
      if (e != null) {
        Throwable cause = SessionLanes.unwrap(e);
        finish(turn, Turn.Outcome.SESSION_ERROR, null, cause, startMs);
        return CompletableFuture.<Turn>failedFuture(cause);
      }
      turn.setSession(session);
      return decide(turn, session, caller, startMs);
    }).thenCompose(future -> future);
  }

  private CompletableFuture<Turn> decide(Turn turn, Session session, CompletableFuture<Turn> caller, long startMs) {
    AtomicReference<Route> routed = new AtomicReference<>();
    CompletableFuture<ToolResult> work = route(turn.getUtterance(), session.getState()).thenApplyAsync(route -> {
      routed.set(route);
      if (route.isDecline() || caller.isCancelled()) {
        return null;
      }
      ToolContext ctx = new ToolContext(turn.getSessionKey(), route.getHandler().getName(), session.getState());
      return route.getTool().invoke(ctx, route.getArguments());
    }, executor);
    if (options.getTurnTimeoutMs() > 0) {
      work = work.orTimeout(options.getTurnTimeoutMs(), TimeUnit.MILLISECONDS);
    }
    return work.handle((toolResult, e) -> conclude(turn, routed.get(), toolResult, SessionLanes.unwrap(e),
        caller, startMs)).thenCompose(future -> future);
  }

  private CompletableFuture<Route> route(String utterance, Map<String, Object> state) {
    try {
      return router.route(utterance, state);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private CompletableFuture<Turn> conclude(Turn turn, Route route, ToolResult toolResult, Throwable error,
      CompletableFuture<Turn> caller, long startMs) {
    if (route != null) {
      turn.routed(route);
      if (route.isDecline() || toolResult != null || error != null) {
        turn.dispatched();
      }
    }

    if (error instanceof CapabilityException) {
      logger.error("Capability fault on {}: {}", turn.getSessionKey(), error.getMessage());
      finish(turn, Turn.Outcome.CAPABILITY_ERROR, null, error, startMs);
      return CompletableFuture.failedFuture(error);
    }
    if (error instanceof TimeoutException) {
      logger.warn("Turn on {} timed out after {} ms", turn.getSessionKey(), options.getTurnTimeoutMs());
      RelayException timeout = new RelayException(ErrorKind.TIMEOUT,
          "turn timed out after " + options.getTurnTimeoutMs() + " ms", error, null);
      return finish(turn, Turn.Outcome.TIMEOUT, options.getTimeoutText(), timeout, startMs);
    }
    if (error != null) {
      logger.warn("Inference failed on {}: {}", turn.getSessionKey(), error.getMessage());
      return finish(turn, Turn.Outcome.INFERENCE_ERROR, options.getInferenceErrorText(), error, startMs);
    }
    if (caller.isCancelled()) {
      logger.debug("Turn on {} was cancelled, nothing committed", turn.getSessionKey());
      return finish(turn, Turn.Outcome.CANCELLED, null, null, startMs);
    }
    if (route.isDecline()) {
      return finish(turn, Turn.Outcome.DECLINED, options.getDeclineText(), null, startMs);
    }

    turn.setToolResult(toolResult);
    if (toolResult.isFailure()) {
      logger.warn("Tool '{}' failed on {}: {} ({})", route.getTool().getName(), turn.getSessionKey(),
          toolResult.getMessage(), toolResult.getErrorKind());
      return finish(turn, Turn.Outcome.FAILURE, options.formatFailure(toolResult.getMessage()), null, startMs);
    }
    return commit(turn, route, toolResult, startMs);
  }

  private CompletableFuture<Turn> commit(Turn turn, Route route, ToolResult toolResult, long startMs) {
    String finalText = replyText(toolResult);
    Map<String, Object> toolWrite = toolResult.getStateWrite();
    String outputKey = route.getHandler().getOutputKey();
    Map<String, Object> capture = outputKey != null ? Map.of(outputKey, finalText) : Map.of();

    Map<String, Object> committed = new LinkedHashMap<>(toolWrite);
    committed.putAll(capture);

    // One merge, so the tool write and the capture land together or not at all.
    SessionKey key = turn.getSessionKey();
    CompletableFuture<Session> writes = committed.isEmpty()
        ? CompletableFuture.completedFuture(null)
        : sessionStore.applyStateWrite(key, committed);
    return writes.handle((session, e) -> {
      if (e != null) {
        Throwable cause = SessionLanes.unwrap(e);
        logger.warn("Could not commit state write {} to {}: {}", committed, key, cause.getMessage());
        return finish(turn, Turn.Outcome.FAILURE, options.formatFailure(cause.getMessage()), cause, startMs);
      }
      turn.setPendingWrite(committed);
      return finish(turn, Turn.Outcome.SUCCESS, finalText, null, startMs);
    }).thenCompose(future -> future);
  }

  private static String replyText(ToolResult toolResult) {
    String report = toolResult.getReport();
    return report != null ? report : JsonUtils.toJson(toolResult.getPayload());
  }

  private CompletableFuture<Turn> finish(Turn turn, Turn.Outcome outcome, String finalText, Throwable error,
      long startMs) {
    turn.finish(outcome, finalText, error);
    long latencyMs = System.currentTimeMillis() - startMs;
    String routing = turn.getDecision() != null ? turn.getDecision().getKind().name().toLowerCase() : null;
    TurnTelemetry.getInstance().recordTurn(turn.getSessionKey().getAppName(), routing, outcome.getValue(),
        latencyMs);
    logger.debug("Finished turn on {} as {} in {} ms", turn.getSessionKey(), outcome, latencyMs);
    return CompletableFuture.completedFuture(turn);
  }

  private static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new RelayException(ErrorKind.INTERNAL, String.valueOf(cause), cause, null);
    }
  }

  // Accessors

  public Registry getRegistry() {
    return registry;
  }

  public AgentRelayOptions getOptions() {
    return options;
  }

  public List<Plugin> getPlugins() {
    return List.copyOf(plugins);
  }

  public SessionStore getSessionStore() {
    return sessionStore;
  }

  public Router getRouter() {
    return router;
  }

  /**
   * Gets the coordinator.
   *
   * @return the root handler, or null if a custom router was supplied without
   *         one
   */
  public Handler getRootHandler() {
    return rootHandler;
  }

  /**
   * Builder for AgentRelay.
   */
  public static class Builder {
    private final List<Plugin> plugins = new ArrayList<>();
    private AgentRelayOptions options = AgentRelayOptions.builder().build();
    private SessionStore sessionStore;
    private InferenceEngine inferenceEngine;
    private String rootHandler;
    private Router router;
    private Executor executor = ForkJoinPool.commonPool();

    /**
     * Sets the options.
     *
     * @param options
     *            the options
     * @return this builder
     */
    public Builder options(AgentRelayOptions options) {
      this.options = options;
      return this;
    }

    /**
     * Adds a plugin.
     *
     * @param plugin
     *            the plugin to add
     * @return this builder
     */
    public Builder plugin(Plugin plugin) {
      this.plugins.add(plugin);
      return this;
    }

    /**
     * Sets the session store. Defaults to an {@link InMemorySessionStore}.
     *
     * @param sessionStore
     *            the session store
     * @return this builder
     */
    public Builder sessionStore(SessionStore sessionStore) {
      this.sessionStore = sessionStore;
      return this;
    }

    public Builder inferenceEngine(InferenceEngine inferenceEngine) {
      this.inferenceEngine = inferenceEngine;
      return this;
    }

    /**
     * Sets the coordinator by the name it was registered under.
     *
     * @param rootHandler
     *            the handler name
     * @return this builder
     */
    public Builder rootHandler(String rootHandler) {
      this.rootHandler = rootHandler;
      return this;
    }

    /**
     * Replaces the coordinator router built from the root handler and the
     * inference engine.
     *
     * @param router
     *            the router
     * @return this builder
     */
    public Builder router(Router router) {
      this.router = router;
      return this;
    }

    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Builds the AgentRelay instance and initializes its plugins.
     *
     * @return the configured AgentRelay
     * @throws IllegalStateException
     *             if neither a router nor a root handler and an inference engine
     *             were supplied
     */
    public AgentRelay build() {
      if (router == null && (rootHandler == null || inferenceEngine == null)) {
        throw new IllegalStateException("A root handler and an inference engine are required unless a router is set");
      }
      AgentRelay relay = new AgentRelay(options, sessionStore != null ? sessionStore : new InMemorySessionStore(),
          executor);
      relay.plugins.addAll(plugins);
      relay.init();
      if (rootHandler != null) {
        relay.rootHandler = relay.resolveHandler(rootHandler);
      }
      relay.router = router != null
          ? router
          : new CoordinatorRouter(CapabilityTable.from(relay.rootHandler), inferenceEngine);
      logger.debug("AgentRelay ready with router {}", relay.router);
      return relay;
    }
  }
}
