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

import com.sheetcalc.formula.impl.FormulaToStringStyle;

/**
 * The result of computing a formula over every row of a table.  There is
 * always exactly one value per input row, rows which failed to evaluate have
 * a {@code null} value.
 *
 * @author SheetCalc Developers
 */
public class ComputeResult
{
  private final List<Object> _values;
  private final String _error;

  public ComputeResult(List<Object> values, String error) {
    _values = Collections.unmodifiableList(values);
    _error = error;
  }

  public List<Object> getValues() {
    return _values;
  }

  /**
   * @return the compilation error message, {@code null} if the formula
   *         compiled
   */
  public String getError() {
    return _error;
  }

  @Override
  public String toString() {
    return FormulaToStringStyle.builder(this)
      .append("values", _values)
      .append("error", _error)
      .toString();
  }
}
