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

package com.sheetcalc.formula.impl.expr;

import com.sheetcalc.formula.expr.Value;
import static com.sheetcalc.formula.impl.expr.ValueSupport.*;


/**
 * Implementations of the formula operators.  Arithmetic and ordering
 * operators always coerce their operands to numbers (anything non-numeric
 * is 0), so none of them ever fails.  Comparisons produce the numbers 1 and
 * 0.
 *
 * @author SheetCalc Developers
 */
public class BuiltinOperators
{
  private BuiltinOperators() {}

  public static Value negate(Value param1) {
    return toValue(-param1.getAsDouble());
  }

  public static Value not(Value param1) {
    return toValue(!param1.getAsBoolean());
  }

  public static Value add(Value param1, Value param2) {
    return toValue(param1.getAsDouble() + param2.getAsDouble());
  }

  public static Value subtract(Value param1, Value param2) {
    return toValue(param1.getAsDouble() - param2.getAsDouble());
  }

  public static Value multiply(Value param1, Value param2) {
    return toValue(param1.getAsDouble() * param2.getAsDouble());
  }

  public static Value divide(Value param1, Value param2) {
    // division by zero yields infinity (or NaN), not an error
    return toValue(param1.getAsDouble() / param2.getAsDouble());
  }

  public static Value mod(Value param1, Value param2) {
    // result has the sign of the dividend
    return toValue(param1.getAsDouble() % param2.getAsDouble());
  }

  public static Value exp(Value param1, Value param2) {
    return toValue(Math.pow(param1.getAsDouble(), param2.getAsDouble()));
  }

  public static Value concat(Value param1, Value param2) {
    // null is the empty string
    return toValue(param1.getAsString().concat(param2.getAsString()));
  }

  public static Value equals(Value param1, Value param2) {
    return toValue(isEqual(param1, param2));
  }

  public static Value notEquals(Value param1, Value param2) {
    return toValue(!isEqual(param1, param2));
  }

  public static Value lessThan(Value param1, Value param2) {
    return toValue(param1.getAsDouble() < param2.getAsDouble());
  }

  public static Value greaterThan(Value param1, Value param2) {
    return toValue(param1.getAsDouble() > param2.getAsDouble());
  }

  public static Value lessThanEq(Value param1, Value param2) {
    return toValue(param1.getAsDouble() <= param2.getAsDouble());
  }

  public static Value greaterThanEq(Value param1, Value param2) {
    return toValue(param1.getAsDouble() >= param2.getAsDouble());
  }

  /**
   * Equality as used by {@code =}, {@code <>} and {@code SWITCH}: numeric if
   * either value is a number, otherwise case-sensitive comparison of the
   * string forms (so {@code null} equals the empty string).
   */
  public static boolean isEqual(Value param1, Value param2) {
    if(param1.getType().isNumeric() || param2.getType().isNumeric()) {
      return (param1.getAsDouble() == param2.getAsDouble());
    }
    return param1.getAsString().equals(param2.getAsString());
  }
}
