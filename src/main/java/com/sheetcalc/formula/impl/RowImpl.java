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

import java.util.LinkedHashMap;
import java.util.Map;

import com.sheetcalc.formula.Row;


/**
 * A row of data as column id-&gt;value pairs.
 *
 * @author SheetCalc Developers
 */
public class RowImpl extends LinkedHashMap<String,Object> implements Row
{
  private static final long serialVersionUID = 20261016L;

  public RowImpl() {
  }

  public RowImpl(Map<String,?> row) {
    super(row);
  }

  @Override
  public String getString(String id) {
    return (String)get(id);
  }

  @Override
  public Boolean getBoolean(String id) {
    return (Boolean)get(id);
  }

  @Override
  public Double getDouble(String id) {
    return (Double)get(id);
  }

  @Override
  public String toString() {
    return FormulaToStringStyle.builder("Row")
      .append(null, this)
      .toString();
  }
}
