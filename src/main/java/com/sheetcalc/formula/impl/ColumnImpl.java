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

import com.sheetcalc.formula.Column;
import com.sheetcalc.formula.ColumnType;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Immutable column metadata.
 *
 * @author SheetCalc Developers
 */
public class ColumnImpl implements Column
{
  private final String _id;
  private final String _name;
  private final ColumnType _type;
  private final String _formula;

  public ColumnImpl(String id, String name, ColumnType type, String formula) {
    _id = id;
    _name = name;
    _type = type;
    _formula = formula;
  }

  @Override
  public String getId() {
    return _id;
  }

  @Override
  public String getName() {
    return _name;
  }

  @Override
  public ColumnType getType() {
    return _type;
  }

  @Override
  public boolean isComputed() {
    return (_formula != null);
  }

  @Override
  public String getFormula() {
    return _formula;
  }

  @Override
  public String toString() {
    ToStringBuilder sb = FormulaToStringStyle.builder(this)
      .append("id", _id)
      .append("name", _name)
      .append("type", _type);
    if(isComputed()) {
      sb.append("formula", _formula);
    }
    return sb.toString();
  }
}
