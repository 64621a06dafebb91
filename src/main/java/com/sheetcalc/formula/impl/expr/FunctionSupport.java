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

import java.util.List;

import com.sheetcalc.formula.expr.EvalContext;
import com.sheetcalc.formula.expr.EvalException;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.Value;

/**
 * Argument handling shared by the built-in function implementations.
 * Arguments are evaluated lazily, on first use, so that functions like
 * {@code COALESCE} and the aggregates control which arguments are evaluated
 * (and in which row context).  A missing argument is only an error if the
 * function actually needs it.
 *
 * @author SheetCalc Developers
 */
public class FunctionSupport
{
  private FunctionSupport() {}

  public static int getNumArgs(Node.FunctionCall call) {
    return call.getArgs().size();
  }

  public static boolean hasArg(Node.FunctionCall call, int idx) {
    return (idx < getNumArgs(call));
  }

  public static Node getArg(Node.FunctionCall call, int idx) {
    List<Node> args = call.getArgs();
    if(idx >= args.size()) {
      throw new EvalException(
          "Invalid number of parameters " + args.size() + " passed to " +
          call.getName() + ", expected at least " +
          Math.max(idx + 1, call.getFunction().getMinParams()));
    }
    return args.get(idx);
  }

  public static Value evalArg(Node.FunctionCall call, int idx,
                              EvalContext ctx) {
    return Evaluator.evaluate(getArg(call, idx), ctx);
  }

  public static double evalDoubleArg(Node.FunctionCall call, int idx,
                                     EvalContext ctx) {
    return evalArg(call, idx, ctx).getAsDouble();
  }

  public static String evalStringArg(Node.FunctionCall call, int idx,
                                     EvalContext ctx) {
    return evalArg(call, idx, ctx).getAsString();
  }

  public static EvalException invalidFunctionCall(
      Throwable t, Node.FunctionCall call)
  {
    String msg = "Invalid function call {" + call.toCleanString() + "}";
    return new EvalException(msg, t);
  }
}
