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

package dev.agentrelay.ai.routing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RuleBasedInferenceEngine is a deterministic {@link InferenceEngine} driven by
 * ordered regular-expression rules.
 *
 * <p>
 * Each rule is scoped to a handler name, or to every handler with
 * {@link #ANY_HANDLER}. For a request, the first rule whose scope matches the
 * active handler and whose pattern is found in the utterance decides the
 * result. Named capture groups become tool arguments; groups that did not
 * participate in the match are omitted. When no rule matches, the engine
 * declines.
 *
 * <pre>{@code
 * InferenceEngine engine = RuleBasedInferenceEngine.builder()
 *     .when("weather_agent", "(?i)weather in (?<city>\\w+)").callTool("get_weather", "city")
 *     .when("weather_agent", "(?i)^hello").delegateTo("greeting_agent")
 *     .build();
 * }</pre>
 */
public class RuleBasedInferenceEngine implements InferenceEngine {

  private static final Logger logger = LoggerFactory.getLogger(RuleBasedInferenceEngine.class);

  /** Scope that applies a rule to every handler. */
  public static final String ANY_HANDLER = "*";

  private final List<Rule> rules;

  private RuleBasedInferenceEngine(List<Rule> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Creates a builder for RuleBasedInferenceEngine.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public CompletableFuture<InferenceResult> infer(InferenceRequest request) {
    String utterance = request.getUtterance() != null ? request.getUtterance() : "";
    for (Rule rule : rules) {
      if (!rule.appliesTo(request.getHandlerName())) {
        continue;
      }
      Matcher matcher = rule.pattern.matcher(utterance);
      if (matcher.find()) {
        InferenceResult result = rule.toResult(matcher);
        logger.debug("Rule '{}' matched for handler '{}': {}", rule.pattern.pattern(), request.getHandlerName(),
            result);
        return CompletableFuture.completedFuture(result);
      }
    }
    logger.debug("No rule matched for handler '{}'", request.getHandlerName());
    return CompletableFuture.completedFuture(InferenceResult.decline());
  }

  /**
   * Gets the number of configured rules.
   *
   * @return the rule count
   */
  public int size() {
    return rules.size();
  }

  private static final class Rule {
    private final String scope;
    private final Pattern pattern;
    private final InferenceResult.Kind kind;
    private final String toolName;
    private final String handlerId;
    private final List<String> argumentGroups;

    Rule(String scope, Pattern pattern, InferenceResult.Kind kind, String toolName, String handlerId,
        List<String> argumentGroups) {
      this.scope = scope;
      this.pattern = pattern;
      this.kind = kind;
      this.toolName = toolName;
      this.handlerId = handlerId;
      this.argumentGroups = argumentGroups;
    }

    boolean appliesTo(String handlerName) {
      return ANY_HANDLER.equals(scope) || scope.equals(handlerName);
    }

    InferenceResult toResult(Matcher matcher) {
      if (kind == InferenceResult.Kind.DECLINE) {
        return InferenceResult.decline();
      }
      Map<String, Object> arguments = new LinkedHashMap<>();
      for (String group : argumentGroups) {
        String value;
        try {
          value = matcher.group(group);
        } catch (IllegalArgumentException e) {
          return InferenceResult.malformed("pattern '" + pattern.pattern() + "' has no group named '" + group + "'");
        }
        if (value != null) {
          arguments.put(group, value.trim());
        }
      }
      if (kind == InferenceResult.Kind.TOOL_CALL) {
        return InferenceResult.toolCall(toolName, arguments);
      }
      return toolName != null
          ? InferenceResult.delegate(handlerId, toolName, arguments)
          : InferenceResult.delegate(handlerId);
    }
  }

  /** Builder for RuleBasedInferenceEngine. */
  public static class Builder {
    private final List<Rule> rules = new ArrayList<>();

    /**
     * Starts a rule.
     *
     * @param handlerName
     *            the handler the rule applies to, or {@link #ANY_HANDLER}
     * @param regex
     *            the pattern searched for in the utterance
     * @return the rule builder
     */
    public RuleBuilder when(String handlerName, String regex) {
      if (handlerName == null || regex == null) {
        throw new IllegalArgumentException("handler name and pattern are required");
      }
      return new RuleBuilder(this, handlerName, Pattern.compile(regex));
    }

    public RuleBasedInferenceEngine build() {
      return new RuleBasedInferenceEngine(rules);
    }
  }

  /** Completes a rule started with {@link Builder#when(String, String)}. */
  public static class RuleBuilder {
    private final Builder parent;
    private final String scope;
    private final Pattern pattern;

    RuleBuilder(Builder parent, String scope, Pattern pattern) {
      this.parent = parent;
      this.scope = scope;
      this.pattern = pattern;
    }

    /**
     * Makes the rule call a tool of the active handler.
     *
     * @param toolName
     *            the tool name
     * @param argumentGroups
     *            named groups copied into the arguments
     * @return the parent builder
     */
    public Builder callTool(String toolName, String... argumentGroups) {
      return add(InferenceResult.Kind.TOOL_CALL, toolName, null, argumentGroups);
    }

    /**
     * Makes the rule delegate to a specialist, which then decides its own tool.
     *
     * @param handlerId
     *            the specialist name
     * @return the parent builder
     */
    public Builder delegateTo(String handlerId) {
      return add(InferenceResult.Kind.DELEGATE, null, handlerId);
    }

    /**
     * Makes the rule delegate to a specialist with the specialist's tool call
     * already chosen.
     *
     * @param handlerId
     *            the specialist name
     * @param toolName
     *            the specialist's tool
     * @param argumentGroups
     *            named groups copied into the arguments
     * @return the parent builder
     */
    public Builder delegateTo(String handlerId, String toolName, String... argumentGroups) {
      return add(InferenceResult.Kind.DELEGATE, toolName, handlerId, argumentGroups);
    }

    public Builder decline() {
      return add(InferenceResult.Kind.DECLINE, null, null);
    }

    private Builder add(InferenceResult.Kind kind, String toolName, String handlerId, String... groups) {
      parent.rules.add(new Rule(scope, pattern, kind, toolName, handlerId, Arrays.asList(groups)));
      return parent;
    }
  }
}
