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

import com.sheetcalc.formula.expr.EvalContext;
import com.sheetcalc.formula.expr.EvalException;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.Value;
import static com.sheetcalc.formula.impl.expr.FunctionSupport.*;
import static com.sheetcalc.formula.impl.expr.ValueSupport.*;

/**
 * The math functions.  All arguments are coerced to numbers.
 *
 * @author SheetCalc Developers
 */
public class DefaultNumberFunctions
{
  // beyond this magnitude every double is integral
  private static final double MAX_FRACTIONAL = 4503599627370496d;

  private DefaultNumberFunctions() {}

  public static Value evaluate(Node.FunctionCall call, EvalContext ctx) {
    switch(call.getFunction()) {
    case ROUND:
    case FLOOR:
    case CEIL:
    case CEILING: {
      double num = evalDoubleArg(call, 0, ctx);
      double decimals = (hasArg(call, 1) ? evalDoubleArg(call, 1, ctx) : 0d);
      double factor = Math.pow(10d, decimals);
      return toValue(roundScaled(call, num * factor) / factor);
    }

    case ABS:
      return toValue(Math.abs(evalDoubleArg(call, 0, ctx)));

    case POWER:
    case POW:
      return toValue(Math.pow(evalDoubleArg(call, 0, ctx),
                              evalDoubleArg(call, 1, ctx)));

    case SQRT:
      return toValue(Math.sqrt(evalDoubleArg(call, 0, ctx)));

    case MOD:
      return toValue(evalDoubleArg(call, 0, ctx) %
                     evalDoubleArg(call, 1, ctx));

    case LOG:
      return toValue(Math.log(evalDoubleArg(call, 0, ctx)));

    case LOG10:
      return toValue(Math.log10(evalDoubleArg(call, 0, ctx)));

    case EXP:
      return toValue(Math.exp(evalDoubleArg(call, 0, ctx)));

    default:
      throw new EvalException("Unknown function: " + call.getName());
    }
  }

  private static double roundScaled(Node.FunctionCall call, double scaled) {
    switch(call.getFunction()) {
    case ROUND:
      return roundHalfUp(scaled);
    case FLOOR:
      return Math.floor(scaled);
    default:
      return Math.ceil(scaled);
    }
  }

  /**
   * Rounds to the nearest integer, with halves rounded towards positive
   * infinity (so -2.5 rounds to -2).
   */
  static double roundHalfUp(double d) {
    if(Double.isNaN(d) || Double.isInfinite(d) ||
       (Math.abs(d) >= MAX_FRACTIONAL)) {
      return d;
    }
    return Math.round(d);
  }
}
