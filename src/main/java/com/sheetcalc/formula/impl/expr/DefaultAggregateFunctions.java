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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.sheetcalc.formula.Row;
import com.sheetcalc.formula.expr.EvalContext;
import com.sheetcalc.formula.expr.EvalException;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.Value;
import static com.sheetcalc.formula.impl.expr.FunctionSupport.*;
import static com.sheetcalc.formula.impl.expr.ValueSupport.*;

/**
 * The aggregate functions.  When the context has the full set of rows, the
 * argument of an aggregate is evaluated once for every row (with that row as
 * the current row) and the results are combined.  Without the full set of
 * rows, SUM, AVG, MIN and MAX return their argument evaluated against the
 * current row, and COUNT and DISTINCT return 1.
 *
 * @author SheetCalc Developers
 */
public class DefaultAggregateFunctions
{
  private DefaultAggregateFunctions() {}

  public static Value evaluate(Node.FunctionCall call, EvalContext ctx) {
    List<? extends Row> rows = ctx.getAllRows();

    switch(call.getFunction()) {
    case SUM:
      if(rows == null) {
        return evalArg(call, 0, ctx);
      }
      return toValue(sum(call, ctx, rows));

    case AVG:
      if(rows == null) {
        return evalArg(call, 0, ctx);
      }
      // no rows is 0/0
      return toValue(sum(call, ctx, rows) / rows.size());

    case COUNT:
      if(rows == null) {
        return toValue(1d);
      }
      if(!hasArg(call, 0)) {
        return toValue((double)rows.size());
      }
      int count = 0;
      for(Row row : rows) {
        if(!isNullOrEmpty(evalArg(call, 0, ctx.forRow(row)))) {
          ++count;
        }
      }
      return toValue((double)count);

    case MIN:
      if(rows == null) {
        return evalArg(call, 0, ctx);
      }
      double min = Double.POSITIVE_INFINITY;
      for(Row row : rows) {
        min = Math.min(min, evalDoubleArg(call, 0, ctx.forRow(row)));
      }
      return toValue(min);

    case MAX:
      if(rows == null) {
        return evalArg(call, 0, ctx);
      }
      double max = Double.NEGATIVE_INFINITY;
      for(Row row : rows) {
        max = Math.max(max, evalDoubleArg(call, 0, ctx.forRow(row)));
      }
      return toValue(max);

    case DISTINCT:
      if(rows == null) {
        return toValue(1d);
      }
      // null is distinct from every string
      Set<String> distinct = new HashSet<String>();
      for(Row row : rows) {
        Value val = evalArg(call, 0, ctx.forRow(row));
        distinct.add(val.isNull() ? null : val.getAsString());
      }
      return toValue((double)distinct.size());

    default:
      throw new EvalException("Unknown function: " + call.getName());
    }
  }

  private static double sum(Node.FunctionCall call, EvalContext ctx,
                            List<? extends Row> rows) {
    double sum = 0d;
    for(Row row : rows) {
      sum += evalDoubleArg(call, 0, ctx.forRow(row));
    }
    return sum;
  }
}
