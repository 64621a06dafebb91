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

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

import com.sheetcalc.formula.impl.expr.ValueSupport;
import org.apache.commons.lang3.builder.StandardToStringStyle;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * ToStringStyle for the objects of the formula engine.  Cell values are
 * rendered the way a formula would write them: numbers without trailing
 * zeros and strings quoted, e.g. {@code Row[{price=2.5, name="Widget"}]}.
 *
 * @author SheetCalc Developers
 */
public class FormulaToStringStyle extends StandardToStringStyle
{
  private static final long serialVersionUID = 0L;

  private static final String IMPL_SUFFIX = "Impl";

  public static final FormulaToStringStyle INSTANCE =
    new FormulaToStringStyle();

  private FormulaToStringStyle() {
    setUseShortClassName(true);
    setUseIdentityHashCode(false);
  }

  public static ToStringBuilder builder(Object obj) {
    return new ToStringBuilder(obj, INSTANCE);
  }

  @Override
  protected void appendClassName(StringBuffer buffer, Object obj) {
    if(obj instanceof String) {
      // explicit class name
      buffer.append(obj);
    } else {
      super.appendClassName(buffer, obj);
    }
  }

  @Override
  protected String getShortClassName(Class<?> clss) {
    String shortName = super.getShortClassName(clss);
    if(shortName.endsWith(IMPL_SUFFIX)) {
      shortName = shortName.substring(0,
                                      shortName.length() - IMPL_SUFFIX.length());
    }
    return shortName;
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Object value) {
    appendCellValue(buffer, value);
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Collection<?> value) {
    buffer.append("[");
    Iterator<?> iter = value.iterator();
    while(iter.hasNext()) {
      appendCellValue(buffer, iter.next());
      if(iter.hasNext()) {
        buffer.append(", ");
      }
    }
    buffer.append("]");
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Map<?,?> value) {
    buffer.append("{");
    Iterator<? extends Map.Entry<?,?>> iter = value.entrySet().iterator();
    while(iter.hasNext()) {
      Map.Entry<?,?> e = iter.next();
      buffer.append(e.getKey()).append("=");
      appendCellValue(buffer, e.getValue());
      if(iter.hasNext()) {
        buffer.append(", ");
      }
    }
    buffer.append("}");
  }

  private void appendCellValue(StringBuffer buffer, Object value) {
    if(value == null) {
      buffer.append(getNullText());
    } else if(value instanceof Double) {
      buffer.append(ValueSupport.formatNumber((Double)value));
    } else if(value instanceof String) {
      buffer.append('"').append(value).append('"');
    } else {
      buffer.append(value);
    }
  }
}
