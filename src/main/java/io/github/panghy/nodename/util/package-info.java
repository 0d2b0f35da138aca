/*
 * Copyright 2024 The NodeName Project Authors
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

/**
 * Utility classes for the NodeName project.
 *
 * <p>This package holds the JUL logging helpers used across the library. Naming classes log
 * identity construction at {@code FINE} and node creation at {@code INFO}.
 */
package io.github.panghy.nodename.util;
