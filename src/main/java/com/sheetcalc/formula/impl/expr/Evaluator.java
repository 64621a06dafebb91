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

import com.sheetcalc.formula.expr.EvalContext;
import com.sheetcalc.formula.expr.EvalException;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.Operator;
import com.sheetcalc.formula.expr.Value;

/**
 * Tree-walking evaluator for parsed formulas.
 *
 * @author SheetCalc Developers
 */
public class Evaluator
{
  private Evaluator() {}

  /**
   * Evaluates the given node in the given context.
   *
   * @throws EvalException if a column reference cannot be resolved or a
   *         function is missing required arguments
   */
  public static Value evaluate(Node node, EvalContext ctx) {
    switch(node.getType()) {
    case NUMBER_LITERAL:
      return ValueSupport.toValue(((Node.NumberLiteral)node).getValue());

    case STRING_LITERAL:
      return ValueSupport.toValue(((Node.StringLiteral)node).getValue());

    case COLUMN_REF:
      return ctx.getColumnValue(((Node.ColumnRef)node).getName());

    case BINARY_OP:
      Node.BinaryOp binOp = (Node.BinaryOp)node;
      return evalBinaryOp(binOp.getOperator(),
                          evaluate(binOp.getLeft(), ctx),
                          evaluate(binOp.getRight(), ctx));

    case UNARY_OP:
      Node.UnaryOp unOp = (Node.UnaryOp)node;
      return evalUnaryOp(unOp.getOperator(),
                         evaluate(unOp.getOperand(), ctx));

    case CONDITIONAL:
      Node.Conditional cond = (Node.Conditional)node;
      // only the selected branch is evaluated
      return (evaluate(cond.getCondition(), ctx).getAsBoolean() ?
              evaluate(cond.getWhenTrue(), ctx) :
              evaluate(cond.getWhenFalse(), ctx));

    case FUNCTION_CALL:
      return DefaultFunctions.evaluate((Node.FunctionCall)node, ctx);

    default:
      throw new EvalException("Unexpected node type " + node.getType());
    }
  }

  private static Value evalBinaryOp(Operator op, Value left, Value right) {
    switch(op) {
    case PLUS:
      return BuiltinOperators.add(left, right);
    case MINUS:
      return BuiltinOperators.subtract(left, right);
    case MULT:
      return BuiltinOperators.multiply(left, right);
    case DIV:
      return BuiltinOperators.divide(left, right);
    case MOD:
      return BuiltinOperators.mod(left, right);
    case EXP:
      return BuiltinOperators.exp(left, right);
    case CONCAT:
      return BuiltinOperators.concat(left, right);
    case EQ:
      return BuiltinOperators.equals(left, right);
    case NE:
      return BuiltinOperators.notEquals(left, right);
    case LT:
      return BuiltinOperators.lessThan(left, right);
    case GT:
      return BuiltinOperators.greaterThan(left, right);
    case LTE:
      return BuiltinOperators.lessThanEq(left, right);
    case GTE:
      return BuiltinOperators.greaterThanEq(left, right);
    default:
      throw new EvalException("Unexpected binary operator " + op.name());
    }
  }

  private static Value evalUnaryOp(Operator op, Value operand) {
    switch(op) {
    case NEGATE:
      return BuiltinOperators.negate(operand);
    case NOT:
      return BuiltinOperators.not(operand);
    default:
      throw new EvalException("Unexpected unary operator " + op.name());
    }
  }
}
