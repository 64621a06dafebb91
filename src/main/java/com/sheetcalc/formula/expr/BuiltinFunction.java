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

package com.sheetcalc.formula.expr;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The closed set of functions recognized by the formula language.  The
 * tokenizer consults this registry to decide whether an identifier names a
 * function or a column, and the evaluator dispatches on it.  Adding a
 * function means adding a constant here and a case to the relevant category
 * implementation.
 *
 * @author SheetCalc Developers
 */
public enum BuiltinFunction
{
  SUM(Category.AGGREGATION, 1),
  AVG(Category.AGGREGATION, 1),
  COUNT(Category.AGGREGATION, 0),
  MIN(Category.AGGREGATION, 1),
  MAX(Category.AGGREGATION, 1),
  DISTINCT(Category.AGGREGATION, 1),

  IF(Category.CONDITIONAL, 3),
  SWITCH(Category.CONDITIONAL, 1),
  COALESCE(Category.CONDITIONAL, 0),

  CONCATENATE(Category.TEXT, 0),
  CONCAT(Category.TEXT, 0),
  LEFT(Category.TEXT, 2),
  RIGHT(Category.TEXT, 2),
  MID(Category.TEXT, 3),
  LEN(Category.TEXT, 1),
  UPPER(Category.TEXT, 1),
  LOWER(Category.TEXT, 1),
  TRIM(Category.TEXT, 1),
  REPLACE(Category.TEXT, 4),
  SUBSTITUTE(Category.TEXT, 3),

  ROUND(Category.MATH, 1),
  FLOOR(Category.MATH, 1),
  CEIL(Category.MATH, 1),
  CEILING(Category.MATH, 1),
  ABS(Category.MATH, 1),
  POWER(Category.MATH, 2),
  POW(Category.MATH, 2),
  SQRT(Category.MATH, 1),
  MOD(Category.MATH, 2),
  LOG(Category.MATH, 1),
  LOG10(Category.MATH, 1),
  EXP(Category.MATH, 1),

  YEAR(Category.DATE, 1),
  MONTH(Category.DATE, 1),
  DAY(Category.DATE, 1),
  TODAY(Category.DATE, 0),
  NOW(Category.DATE, 0),
  DATEDIFF(Category.DATE, 2),
  DATEADD(Category.DATE, 2),

  TEXT(Category.CONVERSION, 1),
  VALUE(Category.CONVERSION, 1),
  INT(Category.CONVERSION, 1),
  FLOAT(Category.CONVERSION, 1),

  AND(Category.LOGICAL, 0),
  OR(Category.LOGICAL, 0),
  NOT(Category.LOGICAL, 1),
  TRUE(Category.LOGICAL, 0),
  FALSE(Category.LOGICAL, 0);

  /** groups of related functions */
  public enum Category
  {
    AGGREGATION, CONDITIONAL, TEXT, MATH, DATE, CONVERSION, LOGICAL;
  }

  private static final Map<String,BuiltinFunction> FUNCS =
    new HashMap<String,BuiltinFunction>();
  static {
    for(BuiltinFunction func : values()) {
      FUNCS.put(func.name(), func);
    }
  }

  private final Category _category;
  private final int _minParams;

  private BuiltinFunction(Category category, int minParams) {
    _category = category;
    _minParams = minParams;
  }

  public Category getCategory() {
    return _category;
  }

  /**
   * @return the number of arguments which must be present for a call to
   *         this function to be evaluated.  Additional arguments are
   *         ignored.
   */
  public int getMinParams() {
    return _minParams;
  }

  public boolean isAggregate() {
    return (_category == Category.AGGREGATION);
  }

  /**
   * @return the function with the given name (case-insensitive), or
   *         {@code null} if the name is not a recognized function
   */
  public static BuiltinFunction lookup(String name) {
    if(name == null) {
      return null;
    }
    return FUNCS.get(name.toUpperCase(Locale.ROOT));
  }
}
