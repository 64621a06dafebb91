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

import java.util.Locale;

import com.sheetcalc.formula.expr.EvalContext;
import com.sheetcalc.formula.expr.EvalException;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.Value;
import org.apache.commons.lang3.StringUtils;
import static com.sheetcalc.formula.impl.expr.FunctionSupport.*;
import static com.sheetcalc.formula.impl.expr.ValueSupport.*;

/**
 * The text functions.  All arguments are converted to strings, with
 * {@code null} as the empty string.
 * <p/>
 * Substrings are taken with "slice" semantics: positions are truncated to
 * integers, negative positions count back from the end of the string and
 * out of range positions are clamped.  {@code MID} and {@code REPLACE} use
 * 1-based start positions.
 *
 * @author SheetCalc Developers
 */
public class DefaultTextFunctions
{
  private DefaultTextFunctions() {}

  public static Value evaluate(Node.FunctionCall call, EvalContext ctx) {
    switch(call.getFunction()) {
    case CONCATENATE:
    case CONCAT:
      StringBuilder sb = new StringBuilder();
      for(Node arg : call.getArgs()) {
        sb.append(Evaluator.evaluate(arg, ctx).getAsString());
      }
      return toValue(sb.toString());

    case LEFT: {
      String str = evalStringArg(call, 0, ctx);
      return toValue(slice(str, 0, evalDoubleArg(call, 1, ctx)));
    }

    case RIGHT: {
      String str = evalStringArg(call, 0, ctx);
      // RIGHT(str, 0) is the whole string
      return toValue(slice(str, -evalDoubleArg(call, 1, ctx), str.length()));
    }

    case MID: {
      String str = evalStringArg(call, 0, ctx);
      double start = evalDoubleArg(call, 1, ctx) - 1;
      double count = evalDoubleArg(call, 2, ctx);
      return toValue(slice(str, start, start + count));
    }

    case LEN:
      return toValue((double)evalStringArg(call, 0, ctx).length());

    case UPPER:
      return toValue(evalStringArg(call, 0, ctx).toUpperCase(Locale.ROOT));

    case LOWER:
      return toValue(evalStringArg(call, 0, ctx).toLowerCase(Locale.ROOT));

    case TRIM:
      return toValue(StringUtils.strip(evalStringArg(call, 0, ctx)));

    case REPLACE: {
      String str = evalStringArg(call, 0, ctx);
      double start = evalDoubleArg(call, 1, ctx) - 1;
      double count = evalDoubleArg(call, 2, ctx);
      String replacement = evalStringArg(call, 3, ctx);
      return toValue(slice(str, 0, start) + replacement +
                     slice(str, start + count, str.length()));
    }

    case SUBSTITUTE: {
      String str = evalStringArg(call, 0, ctx);
      String find = evalStringArg(call, 1, ctx);
      String replacement = evalStringArg(call, 2, ctx);
      if(find.isEmpty()) {
        // the replacement goes between every pair of characters
        return toValue(String.join(replacement, str.split("")));
      }
      return toValue(StringUtils.replace(str, find, replacement));
    }

    default:
      throw new EvalException("Unknown function: " + call.getName());
    }
  }

  /**
   * @return the substring between the given start (inclusive) and end
   *         (exclusive) positions, using slice semantics
   */
  static String slice(String str, double start, double end) {
    int len = str.length();
    int from = toSliceIndex(start, len);
    int to = toSliceIndex(end, len);
    return ((from < to) ? str.substring(from, to) : "");
  }

  private static int toSliceIndex(double idx, int len) {
    if(Double.isNaN(idx)) {
      return 0;
    }
    // truncate towards zero, then clamp
    double intIdx = ((idx < 0d) ? Math.ceil(idx) : Math.floor(idx));
    if(intIdx < 0d) {
      return (int)Math.max(len + intIdx, 0d);
    }
    return (int)Math.min(intIdx, len);
  }
}
