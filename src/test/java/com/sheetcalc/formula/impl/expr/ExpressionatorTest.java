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

import com.sheetcalc.formula.expr.BuiltinFunction;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.ParseException;
import org.apache.commons.lang3.StringUtils;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 * @author SheetCalc Developers
 */
public class ExpressionatorTest
{
  @Test
  public void testParseSimpleExprs() throws Exception
  {
    validateExpr("2", "<NumberLiteral>{2}", "2");
    validateExpr("1.50", "<NumberLiteral>{1.5}", "1.5");
    validateExpr("\"foo\"", "<StringLiteral>{\"foo\"}", "\"foo\"");
    validateExpr("'it\\'s'", "<StringLiteral>{\"it's\"}", "\"it's\"");
    validateExpr("[Net Sales]", "<ColumnRef>{[Net Sales]}", "[Net Sales]");
    validateExpr("Revenue", "<ColumnRef>{[Revenue]}", "[Revenue]");

    validateExpr("-2", "<UnaryOp>{-<NumberLiteral>{2}}", "-2");
    validateExpr("--[x]", "<UnaryOp>{-<UnaryOp>{-<ColumnRef>{[x]}}}",
                 "--[x]");
    validateExpr("NOT([a]=1)",
                 "<UnaryOp>{NOT <BinaryOp>{<ColumnRef>{[a]} = " +
                 "<NumberLiteral>{1}}}",
                 "NOT(([a] = 1))");

    validateExpr("'foo' & \"bar\"",
                 "<BinaryOp>{<StringLiteral>{\"foo\"} & " +
                 "<StringLiteral>{\"bar\"}}",
                 "(\"foo\" & \"bar\")");

    validateExpr("TODAY()", "<FunctionCall>{TODAY()}", "TODAY()");
    validateExpr("sum([Cost])*1.1",
                 "<BinaryOp>{<FunctionCall>{SUM(<ColumnRef>{[Cost]})} * " +
                 "<NumberLiteral>{1.1}}",
                 "(SUM([Cost]) * 1.1)");
    validateExpr("CONCAT([a], ' ', [b])",
                 "<FunctionCall>{CONCAT(<ColumnRef>{[a]}, " +
                 "<StringLiteral>{\" \"}, <ColumnRef>{[b]})}",
                 "CONCAT([a], \" \", [b])");

    validateExpr("IF([x]>5,\"big\",\"small\")",
                 "<Conditional>{IF(<BinaryOp>{<ColumnRef>{[x]} > " +
                 "<NumberLiteral>{5}}, <StringLiteral>{\"big\"}, " +
                 "<StringLiteral>{\"small\"})}",
                 "IF(([x] > 5), \"big\", \"small\")");
  }

  @Test
  public void testPrecedence() throws Exception
  {
    validateExpr("2+3*4",
                 "<BinaryOp>{<NumberLiteral>{2} + <BinaryOp>{" +
                 "<NumberLiteral>{3} * <NumberLiteral>{4}}}",
                 "(2 + (3 * 4))");
    validateExpr("(2+3)*4",
                 "<BinaryOp>{<BinaryOp>{<NumberLiteral>{2} + " +
                 "<NumberLiteral>{3}} * <NumberLiteral>{4}}",
                 "((2 + 3) * 4)");

    // exponentiation is left associative
    validateExpr("2^3^2",
                 "<BinaryOp>{<BinaryOp>{<NumberLiteral>{2} ^ " +
                 "<NumberLiteral>{3}} ^ <NumberLiteral>{2}}",
                 "((2 ^ 3) ^ 2)");

    // negation binds tighter than exponentiation
    validateExpr("-2^2",
                 "<BinaryOp>{<UnaryOp>{-<NumberLiteral>{2}} ^ " +
                 "<NumberLiteral>{2}}",
                 "(-2 ^ 2)");

    validateExpr("[a] & [b] = 'xy'",
                 "<BinaryOp>{<BinaryOp>{<ColumnRef>{[a]} & " +
                 "<ColumnRef>{[b]}} = <StringLiteral>{\"xy\"}}",
                 "(([a] & [b]) = \"xy\")");

    validateExpr("1 < 2 <> 0",
                 "<BinaryOp>{<BinaryOp>{<NumberLiteral>{1} < " +
                 "<NumberLiteral>{2}} <> <NumberLiteral>{0}}",
                 "((1 < 2) <> 0)");

    validateExpr("10 - 4 - 3 % 2",
                 "<BinaryOp>{<BinaryOp>{<NumberLiteral>{10} - " +
                 "<NumberLiteral>{4}} - <BinaryOp>{<NumberLiteral>{3} % " +
                 "<NumberLiteral>{2}}}",
                 "((10 - 4) - (3 % 2))");
  }

  @Test
  public void testInfixLogicalFunctions() throws Exception
  {
    validateExpr("AND([a], [b])",
                 "<FunctionCall>{AND(<ColumnRef>{[a]}, <ColumnRef>{[b]})}",
                 "AND([a], [b])");

    validateExpr("[a] AND([b], [c])",
                 "<FunctionCall>{AND(<ColumnRef>{[a]}, <ColumnRef>{[b]}, " +
                 "<ColumnRef>{[c]})}",
                 "AND([a], [b], [c])");

    validateExpr("[a] AND([b]) AND([c])",
                 "<FunctionCall>{AND(<FunctionCall>{AND(<ColumnRef>{[a]}, " +
                 "<ColumnRef>{[b]})}, <ColumnRef>{[c]})}",
                 "AND(AND([a], [b]), [c])");

    validateExpr("[a] > 1 OR([b] < 2)",
                 "<FunctionCall>{OR(<BinaryOp>{<ColumnRef>{[a]} > " +
                 "<NumberLiteral>{1}}, <BinaryOp>{<ColumnRef>{[b]} < " +
                 "<NumberLiteral>{2}})}",
                 "OR(([a] > 1), ([b] < 2))");

    // AND binds tighter than OR
    validateExpr("[a] AND([b]) OR([c])",
                 "<FunctionCall>{OR(<FunctionCall>{AND(<ColumnRef>{[a]}, " +
                 "<ColumnRef>{[b]})}, <ColumnRef>{[c]})}",
                 "OR(AND([a], [b]), [c])");
  }

  @Test
  public void testTrailingTokensIgnored() throws Exception
  {
    assertEquals(new Node.NumberLiteral(1d), Expressionator.parse("1 2"));
    assertEquals(new Node.ColumnRef("a"), Expressionator.parse("[a])"));
  }

  @Test
  public void testParseErrors() throws Exception
  {
    validateParseFail("IF(1,2)",
                      "Expected COMMA but got RPAREN at position 6",
                      "RPAREN", 6);
    validateParseFail("IF(1,2,3,4)",
                      "Expected RPAREN but got COMMA at position 8",
                      "COMMA", 8);
    validateParseFail("(1+2", "Expected RPAREN but got EOF at position 4",
                      "EOF", 4);
    validateParseFail("", "Unexpected token EOF at position 0", "EOF", 0);
    validateParseFail("1+", "Unexpected token EOF at position 2", "EOF", 2);
    validateParseFail("*3", "Unexpected token OPERATOR at position 0",
                      "OPERATOR", 0);
    validateParseFail("SUM(1,)", "Unexpected token RPAREN at position 6",
                      "RPAREN", 6);
    validateParseFail("SUM 1", "Expected LPAREN but got NUMBER at position 4",
                      "NUMBER", 4);
    validateParseFail("NOT 1", "Expected LPAREN but got NUMBER at position 4",
                      "NUMBER", 4);

    // TRUE and FALSE are only usable as functions
    validateParseFail("TRUE", "Expected LPAREN but got EOF at position 4",
                      "EOF", 4);
  }

  @Test
  public void testNestingLimit() throws Exception
  {
    String okExpr = StringUtils.repeat('(', 100) + "1" +
      StringUtils.repeat(')', 100);
    assertEquals(new Node.NumberLiteral(1d), Expressionator.parse(okExpr));

    String deepExpr = StringUtils.repeat('(', Expressionator.MAX_DEPTH + 10) +
      "1" + StringUtils.repeat(')', Expressionator.MAX_DEPTH + 10);
    ParseException pe = assertThrows(ParseException.class,
                                      () -> Expressionator.parse(deepExpr));
    assertTrue(pe.getMessage().startsWith("Formula is nested too deeply"));

    String deepNegate = StringUtils.repeat('-', Expressionator.MAX_DEPTH + 10) +
      "1";
    assertThrows(ParseException.class,
                 () -> Expressionator.parse(deepNegate));
  }

  @Test
  public void testOperatorChainLimit() throws Exception
  {
    String okChain = "1" + StringUtils.repeat("+1", 200);
    Node expr = Expressionator.parse(okChain);
    assertEquals(expr, Expressionator.parse(expr.toCleanString()));

    // a flat chain builds a left-deep tree one level per operator
    String longChain = "1" + StringUtils.repeat("+1", 5000);
    ParseException pe = assertThrows(ParseException.class,
                                      () -> Expressionator.parse(longChain));
    assertEquals("Formula is nested too deeply at position 513",
                 pe.getMessage());
    assertEquals(513, pe.getPosition());

    assertThrows(ParseException.class,
                 () -> Expressionator.parse(
                     "[a]" + StringUtils.repeat("*[a]", 300)));
    assertThrows(ParseException.class,
                 () -> Expressionator.parse(
                     "1" + StringUtils.repeat(" AND(1)", 300)));
    assertThrows(ParseException.class,
                 () -> Expressionator.parse(
                     "1" + StringUtils.repeat(" OR(1)", 300)));

    // chains stack up through parentheses
    String chain = "1" + StringUtils.repeat("+1", 150);
    assertThrows(ParseException.class,
                 () -> Expressionator.parse("(" + chain + ")" +
                                            StringUtils.repeat("*2", 150)));
    assertThrows(ParseException.class,
                 () -> Expressionator.parse(
                     "IF(1, 2, " + chain + StringUtils.repeat("-1", 150) +
                     ")"));
  }

  @Test
  public void testCleanStringReparses() throws Exception
  {
    for(String exprStr : new String[] {
        "2+3*4", "-[a]^2 % 3", "IF([x]>5, 'big', NOT([y]))",
        "[a] AND([b] <> 'c\"d') OR(0)", "'back\\\\slash' & [Net Sales]",
        "DATEADD(TODAY(), -7, 'days') >= [d]", "--1.25"}) {
      Node expr = Expressionator.parse(exprStr);
      Node reparsed = Expressionator.parse(expr.toCleanString());
      assertEquals(expr, reparsed, exprStr);
      assertEquals(expr.hashCode(), reparsed.hashCode());
      assertEquals(expr.toCleanString(), reparsed.toCleanString());
    }
  }

  @Test
  public void testFunctionNames() throws Exception
  {
    Node.FunctionCall call = (Node.FunctionCall)
      Expressionator.parse("concatenate('a')");
    assertSame(BuiltinFunction.CONCATENATE, call.getFunction());
    assertEquals("CONCATENATE", call.getName());
  }

  private static void validateExpr(String exprStr, String debugStr,
                                   String cleanStr) {
    Node expr = Expressionator.parse(exprStr);
    assertEquals(debugStr, expr.toDebugString());
    assertEquals(debugStr, expr.toString());
    assertEquals(cleanStr, expr.toCleanString());
  }

  private static void validateParseFail(String exprStr, String msg,
                                        String tokenType, int pos) {
    ParseException pe = assertThrows(ParseException.class,
                                      () -> Expressionator.parse(exprStr),
                                      exprStr);
    assertEquals(msg, pe.getMessage());
    assertEquals(tokenType, pe.getTokenType());
    assertEquals(pos, pe.getPosition());
  }
}
