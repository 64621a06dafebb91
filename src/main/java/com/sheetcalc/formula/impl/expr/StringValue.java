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

package com.sheetcalc.formula.impl.expr;


/**
 *
 * @author SheetCalc Developers
 */
public class StringValue extends BaseValue
{
  private final String _val;
  private Double _num;

  public StringValue(String val)
  {
    _val = val;
  }

  @Override
  public Type getType() {
    return Type.STRING;
  }

  @Override
  public Object get() {
    return _val;
  }

  @Override
  public boolean getAsBoolean() {
    return ValueSupport.stringToBoolean(_val);
  }

  @Override
  public String getAsString() {
    return _val;
  }

  @Override
  public double getAsDouble() {
    if(_num == null) {
      _num = ValueSupport.parseNumber(_val);
    }
    return _num;
  }
}
