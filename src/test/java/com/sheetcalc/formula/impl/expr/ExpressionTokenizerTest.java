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

import java.util.ArrayList;
import java.util.List;

import com.sheetcalc.formula.expr.BuiltinFunction;
import com.sheetcalc.formula.impl.expr.ExpressionTokenizer.Token;
import com.sheetcalc.formula.impl.expr.ExpressionTokenizer.TokenType;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

/**
 *
 * @author SheetCalc Developers
 */
public class ExpressionTokenizerTest
{
  @Test
  public void testTokenTypes() throws Exception
  {
    List<Token> tokens = ExpressionTokenizer.tokenize(
        "SUM([Cost]) * 1.5 <> 'a\\'b'");
    assertEquals("FUNCTION:SUM@0 LPAREN:(@3 COLUMN_REF:Cost@4 RPAREN:)@10 " +
                 "OPERATOR:*@12 NUMBER:1.5@14 OPERATOR:<>@18 STRING:a'b@21 " +
                 "EOF:@27", toSummary(tokens));

    Token func = tokens.get(0);
    assertSame(BuiltinFunction.SUM, func.getValue());
    assertEquals(1.5d, tokens.get(5).getValue());
  }

  @Test
  public void testIdentifiers() throws Exception
  {
    assertEquals("FUNCTION:SUM@0 LPAREN:(@3 COLUMN_REF:Revenue@4 RPAREN:)@11 " +
                 "EOF:@12",
                 toSummary(ExpressionTokenizer.tokenize("sum(Revenue)")));

    // true/false are functions, so they are never folded into numbers
    assertEquals("FUNCTION:TRUE@0 FUNCTION:FALSE@5 EOF:@10",
                 toSummary(ExpressionTokenizer.tokenize("true False")));

    assertEquals("COLUMN_REF:a_1@0 OPERATOR:+@4 COLUMN_REF:_b@6 EOF:@8",
                 toSummary(ExpressionTokenizer.tokenize("a_1 + _b")));

    // letters may not follow directly after a number
    assertEquals("NUMBER:2@0 COLUMN_REF:x@1 EOF:@2",
                 toSummary(ExpressionTokenizer.tokenize("2x")));
  }

  @Test
  public void testNumbers() throws Exception
  {
    assertEquals("NUMBER:1.2@0 EOF:@5",
                 toSummary(ExpressionTokenizer.tokenize("1.2.3")));
    assertEquals("NUMBER:0.5@0 EOF:@2",
                 toSummary(ExpressionTokenizer.tokenize(".5")));
    assertEquals("NUMBER:10@0 EOF:@3",
                 toSummary(ExpressionTokenizer.tokenize("10.")));
    // no leading sign, no exponent
    assertEquals("OPERATOR:-@0 NUMBER:3@1 COLUMN_REF:e5@2 EOF:@4",
                 toSummary(ExpressionTokenizer.tokenize("-3e5")));
  }

  @Test
  public void testStrings() throws Exception
  {
    assertEquals("STRING:say \"hi\"@0 EOF:@12",
                 toSummary(ExpressionTokenizer.tokenize("\"say \\\"hi\\\"\"")));
    assertEquals("STRING:it\"s@0 EOF:@6",
                 toSummary(ExpressionTokenizer.tokenize("'it\"s'")));

    // unterminated strings and column names run to the end
    assertEquals("STRING:abc@0 EOF:@4",
                 toSummary(ExpressionTokenizer.tokenize("\"abc")));
    assertEquals("COLUMN_REF:Net Sales@0 EOF:@10",
                 toSummary(ExpressionTokenizer.tokenize("[Net Sales")));

    assertEquals("COLUMN_REF:a (b), c@0 EOF:@10",
                 toSummary(ExpressionTokenizer.tokenize("[a (b), c]")));
  }

  @Test
  public void testOperators() throws Exception
  {
    assertEquals("OPERATOR:<=@0 OPERATOR:>=@2 OPERATOR:<>@4 OPERATOR:<@6 " +
                 "OPERATOR:=@8 OPERATOR:>@9 EOF:@10",
                 toSummary(ExpressionTokenizer.tokenize("<=>=<>< =>")));
    assertEquals("OPERATOR:+@0 OPERATOR:-@1 OPERATOR:*@2 OPERATOR:/@3 " +
                 "OPERATOR:%@4 OPERATOR:^@5 OPERATOR:&@6 COMMA:,@7 EOF:@8",
                 toSummary(ExpressionTokenizer.tokenize("+-*/%^&,")));
  }

  @Test
  public void testUnknownCharsIgnored() throws Exception
  {
    assertEquals("NUMBER:1@1 NUMBER:2@5 EOF:@6",
                 toSummary(ExpressionTokenizer.tokenize("#1 @ 2")));
    assertEquals("EOF:@0", toSummary(ExpressionTokenizer.tokenize("")));
    assertEquals("EOF:@0", toSummary(ExpressionTokenizer.tokenize(null)));
    assertEquals("EOF:@3", toSummary(ExpressionTokenizer.tokenize(" \t\n")));
  }

  private static String toSummary(List<Token> tokens) {
    List<String> strs = new ArrayList<String>();
    for(Token t : tokens) {
      String valStr = ((t.getType() == TokenType.NUMBER) ?
                       ValueSupport.formatNumber((Double)t.getValue()) :
                       t.getValueStr());
      strs.add(t.getType() + ":" + valStr + "@" + t.getPosition());
    }
    return String.join(" ", strs);
  }
}
