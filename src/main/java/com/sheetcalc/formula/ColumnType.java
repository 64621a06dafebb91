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

import java.util.Locale;

/**
 * Supported types of table columns.  The type of a column is advisory only,
 * the formula engine never enforces that the values of a column (or the
 * results of a formula) match it.
 *
 * @author SheetCalc Developers
 */
public enum ColumnType
{
  STRING, NUMBER, DATE, BOOLEAN;

  /**
   * @return the lower case tag for this type, e.g. "number"
   */
  public String getTag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
