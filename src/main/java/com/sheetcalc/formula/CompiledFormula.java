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

import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.impl.FormulaToStringStyle;

/**
 * The result of compiling formula source text.  A formula which fails to
 * parse still yields a usable (inert) tree, a literal zero, alongside the
 * error message.
 *
 * @author SheetCalc Developers
 */
public class CompiledFormula
{
  private final String _source;
  private final Node _ast;
  private final String _error;

  public CompiledFormula(String source, Node ast, String error) {
    _source = source;
    _ast = ast;
    _error = error;
  }

  /**
   * @return the formula source text which was compiled
   */
  public String getSource() {
    return _source;
  }

  /**
   * @return the parsed tree, or a literal zero if compilation failed
   */
  public Node getAst() {
    return _ast;
  }

  /**
   * @return the compilation error message, {@code null} if compilation
   *         succeeded
   */
  public String getError() {
    return _error;
  }

  public boolean hasError() {
    return (_error != null);
  }

  @Override
  public String toString() {
    return FormulaToStringStyle.builder(this)
      .append("source", _source)
      .append("ast", _ast)
      .append("error", _error)
      .toString();
  }
}
