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
import java.util.Map;

/**
 * The operators of the formula language.  All binary operators except the
 * comparisons coerce their operands to numbers, with the exception of
 * {@link #CONCAT}.
 *
 * @author SheetCalc Developers
 */
public enum Operator
{
  PLUS("+", true),
  MINUS("-", true),
  MULT("*", true),
  DIV("/", true),
  MOD("%", true),
  EXP("^", true),
  CONCAT("&", true),
  EQ("=", true),
  NE("<>", true),
  LT("<", true),
  GT(">", true),
  LTE("<=", true),
  GTE(">=", true),
  NEGATE("-", false),
  NOT("NOT", false);

  private static final Map<String,Operator> BINARY_OPS =
    new HashMap<String,Operator>();
  static {
    for(Operator op : values()) {
      if(op.isBinary()) {
        BINARY_OPS.put(op._symbol, op);
      }
    }
  }

  private final String _symbol;
  private final boolean _binary;

  private Operator(String symbol, boolean binary) {
    _symbol = symbol;
    _binary = binary;
  }

  public String getSymbol() {
    return _symbol;
  }

  public boolean isBinary() {
    return _binary;
  }

  public boolean isComparison() {
    switch(this) {
    case EQ:
    case NE:
    case LT:
    case GT:
    case LTE:
    case GTE:
      return true;
    default:
      return false;
    }
  }

  /**
   * @return the binary operator with the given symbol, {@code null} if none
   */
  public static Operator forBinarySymbol(String symbol) {
    return BINARY_OPS.get(symbol);
  }

  @Override
  public String toString() {
    return _symbol;
  }
}
