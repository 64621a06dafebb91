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

package com.sheetcalc.formula;

import java.util.List;

import com.sheetcalc.formula.expr.EvalConfig;
import com.sheetcalc.formula.expr.Node;

/**
 * Entry point for compiling and evaluating formulas over tabular rows.
 * Instances are created using a {@link FormulaEngineBuilder}, are immutable
 * and may be shared between threads.
 * <p/>
 * Column references within a formula ({@code [Revenue]} or a bare
 * {@code Revenue}) are resolved against the given column metadata by exact
 * id, then by exact name, then by case-insensitive name or id, in that order.
 * The value of the resolved column is looked up in the current row by the
 * column's id.
 * <p/>
 * None of the evaluation methods throw for a broken formula or a failed
 * evaluation.  A formula which does not compile evaluates to {@code null}
 * (and the compile methods report the error), a row which fails to evaluate
 * (unknown column, missing function argument) yields {@code null} for that
 * row only.
 *
 * @author SheetCalc Developers
 */
public interface FormulaEngine
{
  /**
   * @return the evaluation settings of this engine
   */
  public EvalConfig getEvalConfig();

  /**
   * Parses the given formula.  Never throws for invalid formula text.
   *
   * @return the parsed formula, or a literal zero tree and the error message
   *         if the formula could not be parsed
   */
  public CompiledFormula compile(String formula);

  /**
   * Evaluates a compiled formula against a single row.  Aggregate functions
   * only see the given row.
   *
   * @return the result ({@code Double}, {@code String}, a column value
   *         passed through unchanged, or {@code null} if evaluation failed)
   */
  public Object evaluateFormula(Node ast, Row row,
                                List<? extends Column> columns);

  /**
   * Evaluates a compiled formula against a single row, with aggregate
   * functions computed over {@code allRows}.
   *
   * @param allRows all the rows of the table, may be {@code null}
   */
  public Object evaluateFormula(Node ast, Row row,
                                List<? extends Column> columns,
                                List<? extends Row> allRows);

  /**
   * Compiles and evaluates the given formula against a single row.
   *
   * @return the result, {@code null} if the formula does not compile or
   *         evaluation failed
   */
  public Object evaluateFormulaString(String formula, Row row,
                                      List<? extends Column> columns);

  /**
   * Compiles and evaluates the given formula against a single row, with
   * aggregate functions computed over {@code allRows}.
   *
   * @param allRows all the rows of the table, may be {@code null}
   */
  public Object evaluateFormulaString(String formula, Row row,
                                      List<? extends Column> columns,
                                      List<? extends Row> allRows);

  /**
   * Computes the value of the given formula for every one of the given
   * rows, with aggregate functions computed over all the rows.
   *
   * @return exactly one value per row (in row order) and the compile error
   *         if the formula did not compile (in which case all the values are
   *         {@code null})
   */
  public ComputeResult computeColumn(String formula,
                                     List<? extends Row> rows,
                                     List<? extends Column> columns);

  /**
   * Checks that the given formula parses and that every column it references
   * exists.  No functions are evaluated.
   */
  public ValidationResult validateFormula(String formula,
                                          List<? extends Column> columns);

  /**
   * Guesses the type of the values produced by the given formula by
   * evaluating it against (up to) the first 10 sample rows.  Aggregate
   * functions only see the sample row being evaluated.
   */
  public ColumnType inferFormulaType(String formula,
                                     List<? extends Column> columns,
                                     List<? extends Row> sampleRows);

  /**
   * Adds the given computed columns to a table.  The computed columns are
   * applied in order, so the formula of a computed column may reference the
   * computed columns which precede it.  The given rows are not modified.
   *
   * @throws IllegalArgumentException if a computed column name is already
   *         the id of a column
   */
  public ComputedTable applyComputedColumns(
      List<? extends Column> columns, List<? extends Row> rows,
      List<ComputedColumn> computedColumns);
}
