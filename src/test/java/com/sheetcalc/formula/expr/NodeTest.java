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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.sheetcalc.formula.impl.expr.Expressionator;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 * @author SheetCalc Developers
 */
public class NodeTest
{
  @Test
  public void testStructuralEquality() throws Exception
  {
    Node expr1 = Expressionator.parse("IF([a] > 1, SUM([b]), 'x')");
    Node expr2 = Expressionator.parse("if( [a]>1 , sum(b) , \"x\" )");
    assertEquals(expr1, expr2);
    assertEquals(expr1.hashCode(), expr2.hashCode());

    Node built = new Node.Conditional(
        new Node.BinaryOp(Operator.GT, new Node.ColumnRef("a"),
                          new Node.NumberLiteral(1d)),
        new Node.FunctionCall(BuiltinFunction.SUM,
                              Arrays.asList(new Node.ColumnRef("b"))),
        new Node.StringLiteral("x"));
    assertEquals(expr1, built);

    assertNotEquals(expr1, Expressionator.parse("IF([a] >= 1, SUM([b]), 'x')"));
    assertNotEquals(Expressionator.parse("1+2"),
                    Expressionator.parse("2+1"));
    assertNotEquals(Expressionator.parse("'1'"), Expressionator.parse("1"));
    assertNotEquals(Expressionator.parse("SUM(1)"),
                    Expressionator.parse("AVG(1)"));
  }

  @Test
  public void testColumnRefs() throws Exception
  {
    Node expr = Expressionator.parse(
        "IF([a] > 1, [b] & NOT(c), SUM([c]) + -[a])");
    assertEquals(Arrays.asList("a", "b", "c", "c", "a"),
                 expr.getColumnRefs());

    List<String> names = new ArrayList<String>();
    names.add("z");
    Expressionator.parse("1 + 2").collectColumnRefs(names);
    assertEquals(Collections.singletonList("z"), names);
  }

  @Test
  public void testNodeTypes() throws Exception
  {
    assertEquals(Node.Type.NUMBER_LITERAL, Expressionator.parse("1").getType());
    assertEquals(Node.Type.STRING_LITERAL,
                 Expressionator.parse("'1'").getType());
    assertEquals(Node.Type.COLUMN_REF, Expressionator.parse("[1]").getType());
    assertEquals(Node.Type.BINARY_OP, Expressionator.parse("1^1").getType());
    assertEquals(Node.Type.UNARY_OP, Expressionator.parse("-1").getType());
    assertEquals(Node.Type.UNARY_OP, Expressionator.parse("NOT(1)").getType());
    assertEquals(Node.Type.FUNCTION_CALL,
                 Expressionator.parse("NOW()").getType());
    assertEquals(Node.Type.CONDITIONAL,
                 Expressionator.parse("IF(1,2,3)").getType());
  }

  @Test
  public void testInvalidNodes() throws Exception
  {
    Node one = new Node.NumberLiteral(1d);

    assertThrows(IllegalArgumentException.class,
                 () -> new Node.BinaryOp(Operator.NOT, one, one));
    assertThrows(IllegalArgumentException.class,
                 () -> new Node.BinaryOp(Operator.NEGATE, one, one));
    assertThrows(IllegalArgumentException.class,
                 () -> new Node.UnaryOp(Operator.PLUS, one));
    assertThrows(NullPointerException.class,
                 () -> new Node.BinaryOp(Operator.PLUS, one, null));
    assertThrows(NullPointerException.class,
                 () -> new Node.ColumnRef(null));
    assertThrows(NullPointerException.class,
                 () -> new Node.FunctionCall(BuiltinFunction.ABS,
                                             Arrays.asList(one, null)));
  }

  @Test
  public void testImmutable() throws Exception
  {
    List<Node> args = new ArrayList<Node>();
    args.add(new Node.NumberLiteral(1d));
    Node.FunctionCall call = new Node.FunctionCall(BuiltinFunction.ABS, args);

    // later changes to the given list are not seen
    args.add(new Node.NumberLiteral(2d));
    assertEquals(1, call.getArgs().size());

    assertThrows(UnsupportedOperationException.class,
                 () -> call.getArgs().add(new Node.NumberLiteral(3d)));
  }

  @Test
  public void testCleanString() throws Exception
  {
    assertEquals("\"say \\\"hi\\\" \\\\o/\"",
                 new Node.StringLiteral("say \"hi\" \\o/").toCleanString());
    assertEquals("[Net Sales]", new Node.ColumnRef("Net Sales").toCleanString());
    assertEquals("0.25", new Node.NumberLiteral(0.25d).toCleanString());

    // hand-built trees without an exact source form
    Node negative = new Node.NumberLiteral(-5d);
    assertEquals("-5", negative.toCleanString());
    assertEquals(new Node.UnaryOp(Operator.NEGATE, new Node.NumberLiteral(5d)),
                 Expressionator.parse(negative.toCleanString()));
    assertEquals(new Node.ColumnRef("NaN"),
                 Expressionator.parse(
                     new Node.NumberLiteral(Double.NaN).toCleanString()));
    assertEquals(new Node.ColumnRef("Infinity"),
                 Expressionator.parse(
                     new Node.NumberLiteral(Double.POSITIVE_INFINITY)
                     .toCleanString()));
    assertEquals("[a]b]", new Node.ColumnRef("a]b").toCleanString());
    assertEquals(new Node.ColumnRef("a"), Expressionator.parse("[a]b]"));
  }

  @Test
  public void testBuiltinFunctions() throws Exception
  {
    assertSame(BuiltinFunction.SUM, BuiltinFunction.lookup("sum"));
    assertSame(BuiltinFunction.LOG10, BuiltinFunction.lookup("Log10"));
    assertNull(BuiltinFunction.lookup("Revenue"));
    assertNull(BuiltinFunction.lookup(null));

    assertTrue(BuiltinFunction.COUNT.isAggregate());
    assertFalse(BuiltinFunction.IF.isAggregate());
    assertEquals(BuiltinFunction.Category.DATE,
                 BuiltinFunction.DATEADD.getCategory());
    assertEquals(3, BuiltinFunction.IF.getMinParams());
    assertEquals(0, BuiltinFunction.COALESCE.getMinParams());

    for(BuiltinFunction.Category cat : BuiltinFunction.Category.values()) {
      assertTrue(Arrays.stream(BuiltinFunction.values())
                 .anyMatch(f -> f.getCategory() == cat), cat.name());
    }
  }

  @Test
  public void testOperators() throws Exception
  {
    assertSame(Operator.LTE, Operator.forBinarySymbol("<="));
    assertSame(Operator.MINUS, Operator.forBinarySymbol("-"));
    assertNull(Operator.forBinarySymbol("NOT"));
    assertTrue(Operator.NE.isComparison());
    assertFalse(Operator.CONCAT.isComparison());
    assertFalse(Operator.NEGATE.isBinary());
    assertEquals("&", Operator.CONCAT.toString());
  }
}
