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

/**
 * Intent routing: the capability table built from a coordinator and its
 * specialists, the inference contract the router consumes, and the
 * coordinator router itself.
 *
 * <p>
 * A turn is routed once. The coordinator either calls one of its own
 * allow-listed tools, delegates to exactly one specialist which calls one of
 * its allow-listed tools, or declines.
 */
package dev.agentrelay.ai.routing;
