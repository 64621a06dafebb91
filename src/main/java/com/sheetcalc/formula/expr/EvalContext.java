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

import java.time.Clock;
import java.util.List;

import com.sheetcalc.formula.Column;
import com.sheetcalc.formula.Row;

/**
 * EvalContext encapsulates all shared state for formula evaluation: the
 * current row, the column metadata used to resolve column references and,
 * optionally, the full set of rows over which aggregate functions operate.
 *
 * @author SheetCalc Developers
 */
public interface EvalContext
{
  /**
   * @return the row currently being evaluated
   */
  public Row getRow();

  /**
   * @return the metadata of the columns which may be referenced
   */
  public List<? extends Column> getColumns();

  /**
   * @return all the rows of the table, or {@code null} if the formula is
   *         being evaluated outside of a whole-table context (in which case
   *         aggregate functions only see the current row)
   */
  public List<? extends Row> getAllRows();

  /**
   * @return the clock used for the current date/time functions
   */
  public Clock getClock();

  /**
   * @return a context with the same columns and rows as this one, but
   *         evaluating the given row
   */
  public EvalContext forRow(Row row);

  /**
   * @param columnName the column name or id as written in the formula
   *
   * @return the value of the given column in the current row
   * @throws EvalException if the name does not identify any column
   */
  public Value getColumnValue(String columnName);
}
