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

import java.util.Map;


/**
 * A row of data as column id-&gt;value pairs.  Values are loosely typed
 * (numbers, strings, booleans, dates or {@code null}), and column ids are
 * case sensitive.
 *
 * @author SheetCalc Developers
 */
public interface Row extends Map<String,Object>
{
  /**
   * Convenience method which gets the value for the column with the given
   * id, casting it to a String.
   */
  public String getString(String id);

  /**
   * Convenience method which gets the value for the column with the given
   * id, casting it to a Boolean.
   */
  public Boolean getBoolean(String id);

  /**
   * Convenience method which gets the value for the column with the given
   * id, casting it to a Double.
   */
  public Double getDouble(String id);
}
