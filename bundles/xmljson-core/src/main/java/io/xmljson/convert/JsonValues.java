/*
 * Copyright (c) 2023, Sirix Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.xmljson.convert;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.Map;

/**
 * Helpers to build Gson values.
 */
final class JsonValues {

  private JsonValues() {
    throw new AssertionError("May not be instantiated!");
  }

  /**
   * Convert a mapping of names to string values, keeping its order.
   *
   * @param values the mapping
   * @return the JSON object
   */
  static JsonObject object(final Map<String, String> values) {
    final JsonObject object = new JsonObject();
    values.forEach(object::addProperty);
    return object;
  }

  /**
   * A single value stays a scalar, more than one becomes an array.
   *
   * @param values at least one value
   * @return the scalar or the array
   */
  static JsonElement scalarOrArray(final ImmutableList<String> values) {
    if (values.size() == 1) {
      return new JsonPrimitive(values.get(0));
    }
    final JsonArray array = new JsonArray(values.size());
    values.forEach(array::add);
    return array;
  }

  /**
   * Add {@code value} under {@code key} only if the mapping is not empty.
   *
   * @param target the object to add to
   * @param key the key
   * @param value the mapping
   */
  static void addIfNotEmpty(final JsonObject target, final String key, final Map<String, String> value) {
    if (!value.isEmpty()) {
      target.add(key, object(value));
    }
  }
}
