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

import java.time.LocalDateTime;

/**
 * A date or date/time value.  Keeps the original object (as found in a row
 * or produced by a function) along with its local date/time interpretation.
 *
 * @author SheetCalc Developers
 */
public class DateValue extends BaseValue
{
  private final Object _val;
  private final LocalDateTime _dateTime;
  private final boolean _dateOnly;

  public DateValue(Object val, LocalDateTime dateTime, boolean dateOnly) {
    _val = val;
    _dateTime = dateTime;
    _dateOnly = dateOnly;
  }

  @Override
  public Type getType() {
    return Type.DATE;
  }

  @Override
  public Object get() {
    return _val;
  }

  public LocalDateTime getDateTime() {
    return _dateTime;
  }

  /**
   * @return {@code true} if this value has no time component
   */
  public boolean isDateOnly() {
    return _dateOnly;
  }

  @Override
  public boolean getAsBoolean() {
    return true;
  }

  @Override
  public String getAsString() {
    return ValueSupport.formatDateTime(_dateTime, _dateOnly);
  }

  @Override
  public double getAsDouble() {
    // same as the string form, which yields the leading year
    return ValueSupport.parseNumber(getAsString());
  }
}
