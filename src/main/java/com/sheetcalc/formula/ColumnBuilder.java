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

import com.sheetcalc.formula.impl.ColumnImpl;

/**
 * Builder style class for constructing a {@link Column}.
 *
 * @author SheetCalc Developers
 */
public class ColumnBuilder
{
  /** id of the new column */
  private final String _id;
  /** name of the new column, defaults to the id */
  private String _name;
  /** the type of the new column */
  private ColumnType _type = ColumnType.STRING;
  /** formula for computed columns */
  private String _formula;

  public ColumnBuilder(String id) {
    this(id, ColumnType.STRING);
  }

  public ColumnBuilder(String id, ColumnType type) {
    _id = id;
    _type = type;
  }

  public String getId() {
    return _id;
  }

  /**
   * Sets the display name of the new column.
   */
  public ColumnBuilder setName(String name) {
    _name = name;
    return this;
  }

  public ColumnBuilder setType(ColumnType type) {
    _type = type;
    return this;
  }

  /**
   * Marks the new column as computed with the given formula.
   */
  public ColumnBuilder setFormula(String formula) {
    _formula = formula;
    return this;
  }

  /**
   * Copies the name, type and formula of the given column.
   */
  public ColumnBuilder setFromColumn(Column template) {
    _name = template.getName();
    _type = template.getType();
    _formula = template.getFormula();
    return this;
  }

  /**
   * Creates a new Column with the currently configured attributes.
   */
  public Column toColumn() {
    if((_id == null) || (_id.length() == 0)) {
      throw new IllegalArgumentException("Column id must be non-empty");
    }
    if(_type == null) {
      throw new IllegalArgumentException(
          "Column type must be non-null for column " + _id);
    }
    return new ColumnImpl(_id, ((_name != null) ? _name : _id), _type,
                          _formula);
  }
}
