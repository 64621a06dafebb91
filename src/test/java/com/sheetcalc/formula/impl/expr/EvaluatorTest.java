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

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import com.sheetcalc.formula.Column;
import com.sheetcalc.formula.ColumnType;
import com.sheetcalc.formula.FormulaEngine;
import com.sheetcalc.formula.Row;
import com.sheetcalc.formula.expr.EvalException;
import com.sheetcalc.formula.expr.Value;
import com.sheetcalc.formula.impl.RowEvalContext;
import static com.sheetcalc.formula.TestUtil.*;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 * @author SheetCalc Developers
 */
public class EvaluatorTest
{
  private static final FormulaEngine ENGINE = createEngine();

  @Test
  public void testArithmetic() throws Exception
  {
    assertEquals(14d, eval("2+3*4"));
    assertEquals(20d, eval("(2+3)*4"));
    assertEquals(64d, eval("2^3^2"));
    assertEquals(4d, eval("-2^2"));
    assertEquals(2.5d, eval("10/4"));
    assertEquals(1d, eval("7%3"));
    assertEquals(-1d, eval("-7%3"));
    assertEquals(3d, eval("10-4-3"));
    assertEquals(0.30000000000000004d, eval("0.1+0.2"));

    assertEquals(Double.POSITIVE_INFINITY, eval("1/0"));
    assertEquals(Double.NEGATIVE_INFINITY, eval("-1/0"));
    assertTrue(Double.isNaN((Double)eval("0/0")));
    // NaN is 0 when used as an operand
    assertEquals(1d, eval("0/0 + 1"));
  }

  @Test
  public void testCoercion() throws Exception
  {
    assertEquals(1d, eval("'abc'+1"));
    assertEquals(1201d, eval("\"$1,200\"+1"));
    assertEquals(24d, eval("'12abc'*2"));
    assertEquals(50d, eval("' 50 % '*1"));
    assertEquals(-3.5d, eval("-'3.5'"));

    assertEquals("foobar", eval("'foo'&'bar'"));
    assertEquals("12", eval("1&2"));
    assertEquals("1.5", eval("1.50&''"));
    assertEquals("0.1", eval("1/10&''"));
    assertEquals("Infinity", eval("1/0&''"));

    assertEquals(1d, eval("NOT(0)"));
    assertEquals(0d, eval("NOT(2)"));
    assertEquals(1d, eval("NOT('no')"));
    assertEquals(1d, eval("NOT('FALSE')"));
    assertEquals(1d, eval("NOT('')"));
    assertEquals(0d, eval("NOT('yes')"));
    assertEquals(0d, eval("NOT('0.0')"));
  }

  @Test
  public void testComparison() throws Exception
  {
    assertEquals(1d, eval("5=5.0"));
    assertEquals(1d, eval("'a'<>'b'"));
    assertEquals(0d, eval("'a'='A'"));
    assertEquals(1d, eval("'abc'='abc'"));
    // numeric if either side is a number
    assertEquals(1d, eval("'10'=10"));
    assertEquals(1d, eval("'$10'=10"));
    assertEquals(0d, eval("'10'='10.0'"));

    assertEquals(1d, eval("2<3"));
    assertEquals(0d, eval("3<3"));
    assertEquals(1d, eval("3<=3"));
    assertEquals(1d, eval("4>=3"));
    assertEquals(0d, eval("2>3"));
    // ordering is always numeric
    assertEquals(0d, eval("'b'>'a'"));
    assertEquals(1d, eval("'10'>'9'"));
  }

  @Test
  public void testLogicalFunctions() throws Exception
  {
    assertEquals(1d, eval("TRUE()"));
    assertEquals(0d, eval("FALSE()"));
    assertNull(eval("TRUE"));

    assertEquals(1d, eval("2>1 AND(3>2)"));
    assertEquals(0d, eval("2>1 AND(3<2)"));
    assertEquals(1d, eval("0 OR(0, 1)"));
    assertEquals(0d, eval("OR(0, '', 'no')"));
    assertEquals(1d, eval("AND()"));
    assertEquals(0d, eval("OR()"));
    assertEquals(0d, eval("AND(1, 'no')"));
    assertEquals(1d, eval("OR(0, 'yes')"));
  }

  @Test
  public void testConditional() throws Exception
  {
    List<Column> columns = createColumns("x");
    assertEquals("big", eval("IF([x]>5,\"big\",\"small\")",
                             createRow("x", 10), columns));
    assertEquals("small", eval("IF([x]>5,\"big\",\"small\")",
                               createRow("x", 3), columns));

    // the branch not taken is never evaluated
    assertEquals("ok", eval("IF(1, 'ok', [Missing])"));
    assertEquals("ok", eval("IF(0, [Missing], 'ok')"));
    assertNull(eval("IF(1, [Missing], 'ok')"));
  }

  @Test
  public void testColumnValues() throws Exception
  {
    List<Column> columns = createColumns("n", "s", "flag", "d", "empty");
    Row row = createRow("n", 3, "s", "abc", "flag", true,
                        "d", LocalDate.of(2024, 2, 29));

    // numbers are always doubles
    assertEquals(3d, eval("[n]", row, columns));
    assertEquals(6d, eval("n*2", row, columns));
    assertEquals("abc", eval("[s]", row, columns));

    assertEquals(Boolean.TRUE, eval("[flag]", row, columns));
    assertEquals(1d, eval("IF([flag],1,2)", row, columns));
    assertEquals(2d, eval("[flag]+1", row, columns));
    assertEquals("true", eval("[flag]&''", row, columns));

    assertEquals(LocalDate.of(2024, 2, 29), eval("[d]", row, columns));
    assertEquals("2024-02-29", eval("[d]&''", row, columns));

    // missing values are null
    assertNull(eval("[empty]", row, columns));
    assertEquals("a", eval("[empty]&'a'", row, columns));
    assertEquals(1d, eval("[empty]+1", row, columns));
    assertEquals(1d, eval("[empty]=''", row, columns));
  }

  @Test
  public void testColumnResolution() throws Exception
  {
    List<Column> columns = Arrays.asList(
        createColumn("c1", "Revenue", ColumnType.NUMBER),
        createColumn("a", "b", ColumnType.STRING),
        createColumn("b", "a", ColumnType.STRING));
    Row row = createRow("c1", 100, "a", "col a", "b", "col b");

    assertEquals(100d, eval("[c1]", row, columns));
    assertEquals(200d, eval("[Revenue]*2", row, columns));
    assertEquals(200d, eval("revenue*2", row, columns));
    assertEquals(100d, eval("[C1]", row, columns));

    // ids win over names
    assertEquals("col a", eval("[a]", row, columns));
    assertEquals("col b", eval("[b]", row, columns));
  }

  @Test
  public void testEvalFailures() throws Exception
  {
    List<Column> columns = createColumns("x");

    evalFail("[Nope]+1", createRow("x", 1), columns, "Unknown column: Nope");
    evalFail("LEFT('abc')", createRow(), columns,
             "Invalid number of parameters 1 passed to LEFT, expected at " +
             "least 2");
    evalFail("SUM()", createRow(), columns,
             "Invalid number of parameters 0 passed to SUM, expected at " +
             "least 1");

    // the engine reports failures as null
    assertNull(eval("[Nope]+1", createRow("x", 1), columns));
    assertNull(eval("LEFT('abc')"));

    // extra arguments are ignored
    assertEquals("a", eval("LEFT('abc', 1, 'extra')"));
  }

  private static Object eval(String formula) {
    return eval(formula, createRow(), createColumns());
  }

  private static Object eval(String formula, Row row, List<Column> columns) {
    return ENGINE.evaluateFormulaString(formula, row, columns);
  }

  private static void evalFail(String formula, Row row, List<Column> columns,
                               String msg) {
    RowEvalContext ctx = new RowEvalContext(ENGINE.getEvalConfig(), row,
                                            columns, null);
    EvalException e = assertThrows(
        EvalException.class,
        () -> {
          Value val = Evaluator.evaluate(Expressionator.parse(formula), ctx);
          fail("Expected failure, got " + val);
        });
    assertEquals(msg, e.getMessage());
  }
}
