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

import com.sheetcalc.formula.impl.FormulaToStringStyle;

/**
 * Definition of a column whose values are produced by a formula, as
 * persisted by a table configuration.  Only the formula source is kept, the
 * formula is recompiled whenever the column is applied.
 *
 * @author SheetCalc Developers
 */
public class ComputedColumn
{
  private final String _name;
  private final String _formula;

  public ComputedColumn(String name, String formula) {
    if((name == null) || (name.length() == 0)) {
      throw new IllegalArgumentException(
          "Computed column name must be non-empty");
    }
    if(formula == null) {
      throw new IllegalArgumentException(
          "Computed column formula must be non-null for column " + name);
    }
    _name = name;
    _formula = formula;
  }

  public String getName() {
    return _name;
  }

  public String getFormula() {
    return _formula;
  }

  @Override
  public String toString() {
    return FormulaToStringStyle.builder(this)
      .append("name", _name)
      .append("formula", _formula)
      .toString();
  }
}
