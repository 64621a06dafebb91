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
import java.util.List;

import com.sheetcalc.formula.Column;
import com.sheetcalc.formula.Row;
import com.sheetcalc.formula.expr.EvalConfig;
import com.sheetcalc.formula.expr.EvalContext;
import com.sheetcalc.formula.expr.EvalException;
import com.sheetcalc.formula.expr.Value;
import com.sheetcalc.formula.impl.expr.ValueSupport;

/**
 * EvalContext for evaluating a formula against one row of a table.
 *
 * @author SheetCalc Developers
 */
public class RowEvalContext implements EvalContext
{
  private final EvalConfig _config;
  private final Row _row;
  private final List<? extends Column> _columns;
  private final List<? extends Row> _allRows;

  public RowEvalContext(EvalConfig config, Row row,
                        List<? extends Column> columns,
                        List<? extends Row> allRows) {
    _config = config;
    _row = row;
    _columns = columns;
    _allRows = allRows;
  }

  @Override
  public Row getRow() {
    return _row;
  }

  @Override
  public List<? extends Column> getColumns() {
    return _columns;
  }

  @Override
  public List<? extends Row> getAllRows() {
    return _allRows;
  }

  @Override
  public Clock getClock() {
    return _config.getClock();
  }

  @Override
  public EvalContext forRow(Row row) {
    return new RowEvalContext(_config, row, _columns, _allRows);
  }

  @Override
  public Value getColumnValue(String columnName) {

    Column col = ColumnResolver.resolve(_columns, columnName);
    if(col == null) {
      throw new EvalException("Unknown column: " + columnName);
    }

    Object val = ((_row != null) ? _row.get(col.getId()) : null);

    return ValueSupport.toValue(val, getClock().getZone());
  }
}
