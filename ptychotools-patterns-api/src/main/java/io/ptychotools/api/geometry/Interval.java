package io.ptychotools.api.geometry;

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


/// A closed integer interval `[lower, upper]` used for clamping pixel counts and positions.
///
/// An interval whose upper bound is below its lower bound is empty. Clamping into an
/// empty interval yields the lower bound.
/// @param lower the lower bound
/// @param upper the upper bound
public record Interval(int lower, int upper) {

  /// Create an interval from two bounds given in either order
  /// @param a one bound
  /// @param b the other bound
  /// @return an interval with `lower <= upper`
  public static Interval proper(int a, int b) {
    return (b < a) ? new Interval(b, a) : new Interval(a, b);
  }

  /// @return true if upper is less than lower
  public boolean isEmpty() {
    return upper < lower;
  }

  /// Clamp a value into this interval
  /// @param value the value to clamp
  /// @return `max(lower, min(value, upper))`
  public int clamp(int value) {
    return Math.max(lower, Math.min(value, upper));
  }

  /// @return the integer midpoint `(lower + upper) / 2`, rounded toward negative infinity
  public int midrange() {
    return Math.floorDiv(lower + upper, 2);
  }

  /// @return `upper - lower`
  public int length() {
    return upper - lower;
  }

  /// Half-open membership test, matching the way slice bounds are used
  /// @param value the value to test
  /// @return true if `lower <= value < upper`
  public boolean contains(int value) {
    return lower <= value && value < upper;
  }

  @Override
  public String toString() {
    return "Interval(" + lower + ", " + upper + ")";
  }
}
