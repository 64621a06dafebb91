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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.sheetcalc.formula.impl.FormulaToStringStyle;

/**
 * A table extended with computed columns, as produced by
 * {@link FormulaEngine#applyComputedColumns}.
 *
 * @author SheetCalc Developers
 */
public class ComputedTable
{
  private final List<Column> _columns;
  private final List<Row> _rows;
  private final Map<String,String> _errors;

  public ComputedTable(List<Column> columns, List<Row> rows,
                       Map<String,String> errors) {
    _columns = Collections.unmodifiableList(columns);
    _rows = Collections.unmodifiableList(rows);
    _errors = Collections.unmodifiableMap(errors);
  }

  /**
   * @return the original columns followed by the computed columns
   */
  public List<Column> getColumns() {
    return _columns;
  }

  /**
   * @return copies of the original rows which include the computed values
   */
  public List<Row> getRows() {
    return _rows;
  }

  /**
   * @return computed column name to compile error message, for the computed
   *         columns whose formula did not compile
   */
  public Map<String,String> getErrors() {
    return _errors;
  }

  @Override
  public String toString() {
    return FormulaToStringStyle.builder(this)
      .append("columns", _columns)
      .append("rowCount", _rows.size())
      .append("errors", _errors)
      .toString();
  }
}
