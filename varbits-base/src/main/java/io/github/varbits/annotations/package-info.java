/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Marker annotations documenting API visibility constraints.
 * <p>
 * {@link io.github.varbits.annotations.VisibleForTesting} marks members that are only accessible
 * so that tests can observe internal state, such as the current backing capacity of a
 * {@link io.github.varbits.bitstream.BitStream}. They are implementation details and may change
 * without notice.
 */
package io.github.varbits.annotations;
