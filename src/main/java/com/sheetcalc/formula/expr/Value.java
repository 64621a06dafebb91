/*
Copyright (c) 2026 SheetCalc Developers

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.sheetcalc.formula.expr;

/**
 * Wrapper for a typed primitive value used within the formula evaluation
 * engine.  Note that the "null" value is represented by an actual Value
 * instance with the type of {@link Type#NULL}.  Unlike stricter expression
 * languages, every value can be converted to every other representation (the
 * formula language never fails on a conversion, it substitutes a neutral
 * value instead).
 *
 * @author SheetCalc Developers
 */
public interface Value
{
  /** the types supported within the formula evaluation engine */
  public enum Type
  {
    NULL, STRING, NUMBER, BOOLEAN, DATE;

    public boolean isNumeric() {
      return (this == NUMBER);
    }
  }

  /**
   * @return the type of this value
   */
  public Type getType();

  /**
   * @return the raw primitive value ({@code Double}, {@code String},
   *         {@code Boolean}, a date object or {@code null})
   */
  public Object get();

  /**
   * @return {@code true} if this value represents a "null" value,
   *         {@code false} otherwise.
   */
  public boolean isNull();

  /**
   * @return this primitive value converted to a boolean ({@code null},
   *         zero, and the strings "", "false", "0" and "no" are false)
   */
  public boolean getAsBoolean();

  /**
   * @return this primitive value converted to a String ({@code null} is the
   *         empty string)
   */
  public String getAsString();

  /**
   * @return this primitive value converted to a double (anything without a
   *         numeric interpretation is 0)
   */
  public double getAsDouble();
}
