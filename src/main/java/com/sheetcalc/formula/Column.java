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

/**
 * Metadata of a column of a table.  Formulas reference columns by id or by
 * name, see {@link FormulaEngine} for the resolution rules.
 *
 * @author SheetCalc Developers
 */
public interface Column
{
  /**
   * @return the id of this column, which is the key of the column's values
   *         within a {@link Row}
   */
  public String getId();

  /**
   * @return the display name of this column
   */
  public String getName();

  public ColumnType getType();

  /**
   * @return {@code true} if the values of this column are produced by a
   *         formula, {@code false} if they are imported data
   */
  public boolean isComputed();

  /**
   * @return the formula source for a computed column, {@code null}
   *         otherwise
   */
  public String getFormula();
}
