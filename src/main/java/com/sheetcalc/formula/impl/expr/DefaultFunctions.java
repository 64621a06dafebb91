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

import com.sheetcalc.formula.expr.BuiltinFunction;
import com.sheetcalc.formula.expr.EvalContext;
import com.sheetcalc.formula.expr.EvalException;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.Value;
import static com.sheetcalc.formula.impl.expr.FunctionSupport.*;
import static com.sheetcalc.formula.impl.expr.ValueSupport.*;

/**
 * Dispatches calls to the built-in functions, and implements the
 * conditional, conversion and logical functions.  The other categories live
 * in their own classes.
 *
 * @author SheetCalc Developers
 */
public class DefaultFunctions
{
  private DefaultFunctions() {}

  /**
   * Evaluates a function call.
   *
   * @throws EvalException if the call fails for any reason
   */
  public static Value evaluate(Node.FunctionCall call, EvalContext ctx) {
    BuiltinFunction func = call.getFunction();
    try {
      switch(func.getCategory()) {
      case AGGREGATION:
        return DefaultAggregateFunctions.evaluate(call, ctx);
      case CONDITIONAL:
        return evalConditional(call, ctx);
      case TEXT:
        return DefaultTextFunctions.evaluate(call, ctx);
      case MATH:
        return DefaultNumberFunctions.evaluate(call, ctx);
      case DATE:
        return DefaultDateFunctions.evaluate(call, ctx);
      case CONVERSION:
        return evalConversion(call, ctx);
      case LOGICAL:
        return evalLogical(call, ctx);
      default:
        throw new EvalException("Unknown function: " + call.getName());
      }
    } catch(EvalException e) {
      throw e;
    } catch(RuntimeException e) {
      throw invalidFunctionCall(e, call);
    }
  }

  private static Value evalConditional(Node.FunctionCall call,
                                       EvalContext ctx) {
    switch(call.getFunction()) {
    case IF:
      // normally parsed into a Conditional, but handled for hand built trees
      return (evalArg(call, 0, ctx).getAsBoolean() ?
              evalArg(call, 1, ctx) : evalArg(call, 2, ctx));

    case SWITCH:
      Value subject = evalArg(call, 0, ctx);
      int numArgs = getNumArgs(call);
      for(int i = 1; i < (numArgs - 1); i += 2) {
        if(BuiltinOperators.isEqual(subject, evalArg(call, i, ctx))) {
          return evalArg(call, i + 1, ctx);
        }
      }
      if((numArgs % 2) == 0) {
        // trailing default
        return evalArg(call, numArgs - 1, ctx);
      }
      return NULL_VAL;

    case COALESCE:
      for(Node arg : call.getArgs()) {
        Value val = Evaluator.evaluate(arg, ctx);
        if(!isNullOrEmpty(val)) {
          return val;
        }
      }
      return NULL_VAL;

    default:
      throw new EvalException("Unknown function: " + call.getName());
    }
  }

  private static Value evalConversion(Node.FunctionCall call,
                                      EvalContext ctx) {
    switch(call.getFunction()) {
    case TEXT:
      return toValue(evalStringArg(call, 0, ctx));
    case VALUE:
    case FLOAT:
      return toValue(evalDoubleArg(call, 0, ctx));
    case INT:
      return toValue(Math.floor(evalDoubleArg(call, 0, ctx)));
    default:
      throw new EvalException("Unknown function: " + call.getName());
    }
  }

  private static Value evalLogical(Node.FunctionCall call,
                                   EvalContext ctx) {
    switch(call.getFunction()) {
    case AND:
      // every argument is evaluated, no short circuit
      boolean allTrue = true;
      for(Node arg : call.getArgs()) {
        allTrue &= Evaluator.evaluate(arg, ctx).getAsBoolean();
      }
      return toValue(allTrue);

    case OR:
      boolean anyTrue = false;
      for(Node arg : call.getArgs()) {
        anyTrue |= Evaluator.evaluate(arg, ctx).getAsBoolean();
      }
      return toValue(anyTrue);

    case NOT:
      return BuiltinOperators.not(evalArg(call, 0, ctx));

    case TRUE:
      return TRUE_VAL;

    case FALSE:
      return FALSE_VAL;

    default:
      throw new EvalException("Unknown function: " + call.getName());
    }
  }
}
