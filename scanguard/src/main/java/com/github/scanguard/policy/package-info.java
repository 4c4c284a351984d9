/*
 * Copyright 2026 The ScanGuard Authors. All Rights Reserved.
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
 * An adaptive, scan-resistant cache replacement policy. A bounded store consults the
 * {@link com.github.scanguard.policy.ReplacementPolicy} hooks to choose eviction victims, while the
 * {@link com.github.scanguard.policy.AdaptiveReplacementPolicy} balances a recency pool against a
 * frequency pool using ghost histories, a frequency sketch, and a scan guard.
 */
@NullMarked
@CheckReturnValue
package com.github.scanguard.policy;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
