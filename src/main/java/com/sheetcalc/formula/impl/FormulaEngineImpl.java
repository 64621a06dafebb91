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

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.sheetcalc.formula.Column;
import com.sheetcalc.formula.ColumnBuilder;
import com.sheetcalc.formula.ColumnType;
import com.sheetcalc.formula.CompiledFormula;
import com.sheetcalc.formula.ComputeResult;
import com.sheetcalc.formula.ComputedColumn;
import com.sheetcalc.formula.ComputedTable;
import com.sheetcalc.formula.FormulaEngine;
import com.sheetcalc.formula.Row;
import com.sheetcalc.formula.ValidationResult;
import com.sheetcalc.formula.expr.EvalConfig;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.ParseException;
import com.sheetcalc.formula.impl.expr.Evaluator;
import com.sheetcalc.formula.impl.expr.Expressionator;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 *
 * @author SheetCalc Developers
 */
public class FormulaEngineImpl implements FormulaEngine, EvalConfig
{
  private static final Log LOG = LogFactory.getLog(FormulaEngineImpl.class);

  /** tree used in place of a formula which does not parse */
  private static final Node INERT_AST = new Node.NumberLiteral(0d);

  private final Clock _clock;
  private final boolean _debug;

  public FormulaEngineImpl(Clock clock, boolean debug) {
    _clock = clock;
    _debug = debug;
  }

  @Override
  public Clock getClock() {
    return _clock;
  }

  @Override
  public boolean isDebug() {
    return _debug;
  }

  @Override
  public EvalConfig getEvalConfig() {
    return this;
  }

  @Override
  public CompiledFormula compile(String formula) {
    try {
      return new CompiledFormula(formula, Expressionator.parse(formula), null);
    } catch(ParseException pe) {
      return new CompiledFormula(formula, INERT_AST, pe.getMessage());
    }
  }

  @Override
  public Object evaluateFormula(Node ast, Row row,
                                List<? extends Column> columns) {
    return evaluateFormula(ast, row, columns, null);
  }

  @Override
  public Object evaluateFormula(Node ast, Row row,
                                List<? extends Column> columns,
                                List<? extends Row> allRows) {
    try {
      return Evaluator.evaluate(
          ast, new RowEvalContext(this, row, columns, allRows)).get();
    } catch(Exception e) {
      if(_debug && LOG.isDebugEnabled()) {
        LOG.debug("Failed evaluating formula " + ast + " for row " + row, e);
      }
      return null;
    }
  }

  @Override
  public Object evaluateFormulaString(String formula, Row row,
                                      List<? extends Column> columns) {
    return evaluateFormulaString(formula, row, columns, null);
  }

  @Override
  public Object evaluateFormulaString(String formula, Row row,
                                      List<? extends Column> columns,
                                      List<? extends Row> allRows) {
    CompiledFormula compiled = compileOrLog(formula);
    if(compiled.hasError()) {
      return null;
    }
    return evaluateFormula(compiled.getAst(), row, columns, allRows);
  }

  @Override
  public ComputeResult computeColumn(String formula,
                                     List<? extends Row> rows,
                                     List<? extends Column> columns) {
    CompiledFormula compiled = compileOrLog(formula);
    List<Object> values = new ArrayList<Object>(rows.size());
    if(compiled.hasError()) {
      values.addAll(Collections.nCopies(rows.size(), null));
      return new ComputeResult(values, compiled.getError());
    }

    for(Row row : rows) {
      values.add(evaluateFormula(compiled.getAst(), row, columns, rows));
    }
    return new ComputeResult(values, null);
  }

  @Override
  public ValidationResult validateFormula(String formula,
                                          List<? extends Column> columns) {
    return FormulaValidator.validate(formula, columns);
  }

  @Override
  public ColumnType inferFormulaType(String formula,
                                     List<? extends Column> columns,
                                     List<? extends Row> sampleRows) {
    return TypeInferencer.inferType(this, formula, columns, sampleRows);
  }

  @Override
  public ComputedTable applyComputedColumns(
      List<? extends Column> columns, List<? extends Row> rows,
      List<ComputedColumn> computedColumns) {

    List<Column> newColumns = new ArrayList<Column>(columns);
    List<Row> newRows = new ArrayList<Row>(rows.size());
    for(Row row : rows) {
      newRows.add(new RowImpl(row));
    }
    Map<String,String> errors = new LinkedHashMap<String,String>();

    for(ComputedColumn compCol : computedColumns) {
      String name = compCol.getName();
      for(Column col : newColumns) {
        if(name.equals(col.getId())) {
          throw new IllegalArgumentException(
              "Computed column " + name + " duplicates existing column " +
              col);
        }
      }

      ComputeResult result = computeColumn(compCol.getFormula(), newRows,
                                           newColumns);
      if(result.getError() != null) {
        errors.put(name, result.getError());
      }

      // type is inferred before the new values are added
      ColumnType type = inferFormulaType(compCol.getFormula(), newColumns,
                                         newRows);

      List<Object> values = result.getValues();
      for(int i = 0; i < newRows.size(); ++i) {
        newRows.get(i).put(name, values.get(i));
      }

      newColumns.add(new ColumnBuilder(name, type)
                     .setFormula(compCol.getFormula())
                     .toColumn());
    }

    return new ComputedTable(newColumns, newRows, errors);
  }

  private CompiledFormula compileOrLog(String formula) {
    CompiledFormula compiled = compile(formula);
    if(compiled.hasError() && _debug && LOG.isDebugEnabled()) {
      LOG.debug("Failed compiling formula '" + formula + "': " +
                compiled.getError());
    }
    return compiled;
  }

  @Override
  public String toString() {
    return FormulaToStringStyle.builder(this)
      .append("clock", _clock)
      .append("debug", _debug)
      .toString();
  }
}
