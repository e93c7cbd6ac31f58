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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import dev.agentrelay.ai.CapabilityException;
import dev.agentrelay.ai.Handler;
import dev.agentrelay.ai.HandlerConfig;

/** Unit tests for CoordinatorRouter. */
@ExtendWith(MockitoExtension.class)
class CoordinatorRouterTest {

  @Mock
  private InferenceEngine engine;

  private CoordinatorRouter router;
  private final Map<String, InferenceResult> answers = new HashMap<>();

  @BeforeEach
  void setUp() {
    router = new CoordinatorRouter(CapabilityTable.from(RoutingFixtures.team()), engine);
    lenient().when(engine.infer(any())).thenAnswer(invocation -> {
      InferenceRequest request = invocation.getArgument(0);
      return CompletableFuture.completedFuture(answers.get(request.getHandlerName()));
    });
  }

  private void answer(String handlerName, InferenceResult result) {
    answers.put(handlerName, result);
  }

  private static Throwable failure(CompletableFuture<Route> future) {
    ExecutionException e = assertThrows(ExecutionException.class, future::get);
    return e.getCause();
  }

  @Test
  void testHandleSelf() throws Exception {
    answer("weather_agent", InferenceResult.toolCall("get_weather", Map.of("city", "London")));

    Route route = router.route("What is the weather in London?", Map.of()).get();

    assertEquals(RoutingDecision.handleSelf("get_weather"), route.getDecision());
    assertEquals("weather_agent", route.getHandler().getName());
    assertEquals("get_weather", route.getTool().getName());
    assertEquals(Map.of("city", "London"), route.getArguments());
    verify(engine, times(1)).infer(any());
  }

  @Test
  void testRequestCarriesHandlerSchemaAndState() throws Exception {
    answer("weather_agent", InferenceResult.decline());

    router.route("hmm", Map.of("user_preference_temperature_unit", "Fahrenheit")).get();

    ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
    verify(engine).infer(captor.capture());
    InferenceRequest request = captor.getValue();
    assertEquals("hmm", request.getUtterance());
    assertEquals("Fahrenheit", request.getState().get("user_preference_temperature_unit"));
    assertEquals("get_weather", request.getTools().get(0).getName());
    assertEquals(2, request.getDelegates().size());
  }

  @Test
  void testDelegateAsksSpecialist() throws Exception {
    answer("weather_agent", InferenceResult.delegate("greeting_agent"));
    answer("greeting_agent", InferenceResult.toolCall("say_hello", Map.of("name", "Ada")));

    Route route = router.route("Hi, I am Ada", Map.of()).get();

    assertEquals(RoutingDecision.delegate("greeting_agent"), route.getDecision());
    assertEquals("greeting_agent", route.getHandler().getName());
    assertEquals("say_hello", route.getTool().getName());
    assertEquals("Ada", route.getArguments().get("name"));
    assertTrue(route.isDelegated());
    verify(engine, times(2)).infer(any());
  }

  @Test
  void testDelegateWithToolSkipsSecondInference() throws Exception {
    answer("weather_agent", InferenceResult.delegate("farewell_agent", "say_goodbye", null));

    Route route = router.route("bye", Map.of()).get();

    assertEquals("say_goodbye", route.getTool().getName());
    verify(engine, times(1)).infer(any());
  }

  @Test
  void testDecline() throws Exception {
    answer("weather_agent", InferenceResult.decline());

    Route route = router.route("Tell me a joke", Map.of()).get();

    assertTrue(route.isDecline());
    assertNull(route.getTool());
  }

  @Test
  void testSpecialistDecline() throws Exception {
    answer("weather_agent", InferenceResult.delegate("greeting_agent"));
    answer("greeting_agent", InferenceResult.decline());

    assertTrue(router.route("hello?", Map.of()).get().isDecline());
  }

  @Test
  void testRootToolOutsideAllowListIsCapabilityFault() {
    answer("weather_agent", InferenceResult.toolCall("say_hello", null));

    CapabilityException e = assertInstanceOf(CapabilityException.class, failure(router.route("hi", Map.of())));
    assertEquals("weather_agent", e.getHandlerName());
    assertEquals("say_hello", e.getToolName());
  }

  @Test
  void testSpecialistToolOutsideAllowListIsCapabilityFault() {
    answer("weather_agent", InferenceResult.delegate("greeting_agent"));
    answer("greeting_agent", InferenceResult.toolCall("get_weather", Map.of("city", "Paris")));

    CapabilityException e = assertInstanceOf(CapabilityException.class,
        failure(router.route("hi, weather in Paris", Map.of())));
    assertEquals("greeting_agent", e.getHandlerName());
    assertEquals("get_weather", e.getToolName());
  }

  @Test
  void testPreselectedToolOutsideAllowListIsCapabilityFault() {
    answer("weather_agent", InferenceResult.delegate("farewell_agent", "say_hello", null));

    assertInstanceOf(CapabilityException.class, failure(router.route("bye", Map.of())));
  }

  @Test
  void testSpecialistCannotDelegate() {
    answer("weather_agent", InferenceResult.delegate("greeting_agent"));
    answer("greeting_agent", InferenceResult.delegate("farewell_agent"));

    assertInstanceOf(CapabilityException.class, failure(router.route("hi then bye", Map.of())));
  }

  @Test
  void testUnknownDelegateIsInferenceError() {
    answer("weather_agent", InferenceResult.delegate("shopping_agent"));

    assertInstanceOf(InferenceException.class, failure(router.route("buy milk", Map.of())));
  }

  @Test
  void testMalformedIsInferenceError() {
    answer("weather_agent", InferenceResult.malformed("not json"));

    Throwable cause = failure(router.route("???", Map.of()));
    assertInstanceOf(InferenceException.class, cause);
    assertTrue(cause.getMessage().contains("not json"));
  }

  @Test
  void testNullResultIsInferenceError() {
    // no answer registered for the coordinator
    assertInstanceOf(InferenceException.class, failure(router.route("???", Map.of())));
  }

  @Test
  void testToolCallWithoutNameIsInferenceError() {
    answer("weather_agent", InferenceResult.toolCall(null, null));

    assertInstanceOf(InferenceException.class, failure(router.route("???", Map.of())));
  }

  @Test
  void testRequiresCollaborators() {
    assertThrows(IllegalArgumentException.class, () -> new CoordinatorRouter(null, engine));
    verify(engine, never()).infer(any());
  }

  @Test
  void testRandomPairingsNeverEscapeAllowLists() throws Exception {
    Random random = new Random(42);
    for (int round = 0; round < 50; round++) {
      List<HandlerConfig> specialists = new ArrayList<>();
      List<String> allTools = new ArrayList<>();
      int specialistCount = 1 + random.nextInt(3);
      for (int s = 0; s < specialistCount; s++) {
        String[] names = {"s" + s + "_t0", "s" + s + "_t1"};
        allTools.add(names[0]);
        allTools.add(names[1]);
        specialists.add(HandlerConfig.builder().name("specialist_" + s).tools(RoutingFixtures.tools(names)).build());
      }
      allTools.add("root_tool");
      Handler root = new Handler(HandlerConfig.builder().name("root").tools(RoutingFixtures.tools("root_tool"))
          .handlers(specialists).build());
      CoordinatorRouter randomRouter = new CoordinatorRouter(CapabilityTable.from(root), engine);

      String specialist = "specialist_" + random.nextInt(specialistCount);
      String chosenTool = allTools.get(random.nextInt(allTools.size()));
      answers.clear();
      answer("root", InferenceResult.delegate(specialist));
      answer(specialist, InferenceResult.toolCall(chosenTool, null));

      CompletableFuture<Route> future = randomRouter.route("anything", Map.of());
      Handler resolved = root.getSubHandler(specialist);
      if (resolved.allows(chosenTool)) {
        Route route = future.get();
        assertEquals(specialist, route.getHandler().getName());
        assertTrue(route.getHandler().allows(route.getTool().getName()));
      } else {
        assertInstanceOf(CapabilityException.class, failure(future));
      }
    }
  }
}
