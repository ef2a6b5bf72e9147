package io.fieldnotes.textshapes.analyzers.coding;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// How often a code was applied.
///
/// @param codeName the code
/// @param segmentCount applied segments
/// @param recordCount distinct records with at least one segment
/// @param segmentShare segmentCount as a fraction of all segments
public record CodeFrequency(String codeName, int segmentCount, int recordCount, double segmentShare) {}
