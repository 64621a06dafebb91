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

package com.sheetcalc.formula.impl;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.sheetcalc.formula.Column;
import com.sheetcalc.formula.ColumnType;
import com.sheetcalc.formula.CompiledFormula;
import com.sheetcalc.formula.FormulaEngine;
import com.sheetcalc.formula.Row;
import com.sheetcalc.formula.impl.expr.DefaultDateFunctions;
import com.sheetcalc.formula.impl.expr.ValueSupport;

/**
 * Guesses the type of the values produced by a formula from the results of
 * evaluating it against a few sample rows.  The checks are made in a fixed
 * order: all numbers is {@link ColumnType#NUMBER}, all 0 or 1 is
 * {@link ColumnType#BOOLEAN}, all dates is {@link ColumnType#DATE}, anything
 * else is {@link ColumnType#STRING}.  Since 0 and 1 are numbers, a formula
 * producing only 0 and 1 is a {@code NUMBER}.  A formula which produces
 * nothing but {@code null} is a {@code STRING}.
 *
 * @author SheetCalc Developers
 */
public class TypeInferencer
{
  /** maximum number of sample rows which are evaluated */
  public static final int MAX_SAMPLE_ROWS = 10;

  private TypeInferencer() {}

  public static ColumnType inferType(FormulaEngine engine, String formula,
                                     List<? extends Column> columns,
                                     List<? extends Row> sampleRows) {
    if((sampleRows == null) || sampleRows.isEmpty()) {
      return ColumnType.STRING;
    }

    CompiledFormula compiled = engine.compile(formula);
    if(compiled.hasError()) {
      return ColumnType.STRING;
    }

    // aggregates only see the sample row itself
    List<Object> results = new ArrayList<Object>();
    for(Row row : sampleRows.subList(
            0, Math.min(MAX_SAMPLE_ROWS, sampleRows.size()))) {
      Object result = engine.evaluateFormula(compiled.getAst(), row, columns);
      if(result != null) {
        results.add(result);
      }
    }

    if(results.isEmpty()) {
      return ColumnType.STRING;
    }
    if(allMatch(results, TypeInferencer::isNumber)) {
      return ColumnType.NUMBER;
    }
    if(allMatch(results, TypeInferencer::isZeroOrOne)) {
      return ColumnType.BOOLEAN;
    }
    ZoneId zone = engine.getEvalConfig().getClock().getZone();
    if(allMatch(results, r -> isDate(r, zone))) {
      return ColumnType.DATE;
    }
    return ColumnType.STRING;
  }

  private static boolean allMatch(List<Object> results,
                                  Predicate<Object> pred) {
    for(Object result : results) {
      if(!pred.test(result)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isNumber(Object result) {
    return (result instanceof Double);
  }

  private static boolean isZeroOrOne(Object result) {
    if(!isNumber(result)) {
      return false;
    }
    double d = (Double)result;
    return ((d == 0d) || (d == 1d));
  }

  private static boolean isDate(Object result, ZoneId zone) {
    return (DefaultDateFunctions.toDateValue(
                ValueSupport.toValue(result, zone), zone) != null);
  }
}
