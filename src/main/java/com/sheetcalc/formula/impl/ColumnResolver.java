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

import java.util.List;

import com.sheetcalc.formula.Column;

/**
 * Resolves the column names used in formulas to columns.  A name matches
 * (in order of preference) the id of a column, the name of a column, or the
 * name or id of a column ignoring case.
 *
 * @author SheetCalc Developers
 */
public class ColumnResolver
{
  private ColumnResolver() {}

  /**
   * @return the column identified by the given name, {@code null} if none
   */
  public static Column resolve(List<? extends Column> columns, String name) {
    for(Column col : columns) {
      if(name.equals(col.getId())) {
        return col;
      }
    }
    for(Column col : columns) {
      if(name.equals(col.getName())) {
        return col;
      }
    }
    for(Column col : columns) {
      if(name.equalsIgnoreCase(col.getName()) ||
         name.equalsIgnoreCase(col.getId())) {
        return col;
      }
    }
    return null;
  }
}
