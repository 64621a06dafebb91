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

import java.util.List;

import com.sheetcalc.formula.Column;
import com.sheetcalc.formula.ValidationResult;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.ParseException;
import com.sheetcalc.formula.impl.expr.Expressionator;

/**
 * Checks a formula against column metadata without evaluating it: the
 * formula must parse and every column it references must resolve.
 * Function arguments are not checked.
 *
 * @author SheetCalc Developers
 */
public class FormulaValidator
{
  private FormulaValidator() {}

  public static ValidationResult validate(String formula,
                                          List<? extends Column> columns) {
    Node ast = null;
    try {
      ast = Expressionator.parse(formula);
    } catch(ParseException pe) {
      return ValidationResult.invalid(pe.getMessage());
    }

    String unknownCol = findUnknownColumn(ast, columns);
    if(unknownCol != null) {
      return ValidationResult.invalid("Unknown column: " + unknownCol);
    }
    return ValidationResult.valid();
  }

  /**
   * @return the first column referenced by the given tree which does not
   *         resolve, {@code null} if all resolve
   */
  private static String findUnknownColumn(Node node,
                                          List<? extends Column> columns) {
    switch(node.getType()) {
    case NUMBER_LITERAL:
    case STRING_LITERAL:
      return null;

    case COLUMN_REF:
      String name = ((Node.ColumnRef)node).getName();
      return ((ColumnResolver.resolve(columns, name) == null) ? name : null);

    case BINARY_OP:
      Node.BinaryOp binOp = (Node.BinaryOp)node;
      return firstUnknown(columns, binOp.getLeft(), binOp.getRight());

    case UNARY_OP:
      return findUnknownColumn(((Node.UnaryOp)node).getOperand(), columns);

    case FUNCTION_CALL:
      return firstUnknown(columns, ((Node.FunctionCall)node).getArgs()
                          .toArray(new Node[0]));

    case CONDITIONAL:
      Node.Conditional cond = (Node.Conditional)node;
      return firstUnknown(columns, cond.getCondition(), cond.getWhenTrue(),
                          cond.getWhenFalse());

    default:
      throw new IllegalStateException("Unexpected node type " +
                                      node.getType());
    }
  }

  private static String firstUnknown(List<? extends Column> columns,
                                     Node... nodes) {
    for(Node node : nodes) {
      String unknownCol = findUnknownColumn(node, columns);
      if(unknownCol != null) {
        return unknownCol;
      }
    }
    return null;
  }
}
