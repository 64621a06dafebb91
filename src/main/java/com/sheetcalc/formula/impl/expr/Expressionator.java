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
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.sheetcalc.formula.expr.BuiltinFunction;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.Operator;
import com.sheetcalc.formula.expr.ParseException;
import com.sheetcalc.formula.impl.expr.ExpressionTokenizer.Token;
import com.sheetcalc.formula.impl.expr.ExpressionTokenizer.TokenType;

/**
 * Parses formula text into a tree of {@link Node}s using recursive descent,
 * one method per precedence level (lowest first):
 * <pre>
 *   Expr       := Or
 *   Or         := And ( "OR(" Expr ("," Expr)* ")" )*
 *   And        := Comparison ( "AND(" Expr ("," Expr)* ")" )*
 *   Comparison := AddSub ( ("=" | "&lt;&gt;" | "&lt;" | "&gt;" | "&lt;=" | "&gt;=") AddSub )*
 *   AddSub     := MulDiv ( ("+" | "-" | "&amp;") MulDiv )*
 *   MulDiv     := Power ( ("*" | "/" | "%") Power )*
 *   Power      := Unary ( "^" Unary )*
 *   Unary      := "-" Unary | "NOT(" Expr ")" | Primary
 *   Primary    := Number | String | ColumnRef
 *               | "IF(" Expr "," Expr "," Expr ")"
 *               | FunctionName "(" [Expr ("," Expr)*] ")"
 *               | "(" Expr ")"
 * </pre>
 * Some quirks of the language:
 * <ul>
 *   <li>{@code ^} is left-associative, {@code 2^3^2} is 64.</li>
 *   <li>{@code AND} and {@code OR} may follow an expression as if they were
 *       infix operators, {@code a AND(b, c)} is {@code AND(a, b, c)}.</li>
 *   <li>{@code IF} always takes exactly three arguments.</li>
 *   <li>Any tokens following a complete expression are ignored.</li>
 * </ul>
 *
 * @author SheetCalc Developers
 */
public class Expressionator
{
  /** maximum nesting of sub-expressions within a formula, which is also the
      maximum height of the parsed tree */
  public static final int MAX_DEPTH = 256;

  private Expressionator() {}

  /**
   * Parses the given formula.
   *
   * @throws ParseException if the formula is not valid
   */
  public static Node parse(String formula) {
    return parse(ExpressionTokenizer.tokenize(formula));
  }

  static Node parse(List<Token> tokens) {
    return parseExpression(new TokBuf(tokens));
  }

  private static Node parseExpression(TokBuf buf) {
    buf.pushDepth();
    Node expr = parseOr(buf);
    buf.popDepth();
    return expr;
  }

  private static Node parseOr(TokBuf buf) {
    Node left = parseAnd(buf);
    while(buf.isFunction(BuiltinFunction.OR)) {
      buf.next();
      left = parseInfixFunction(BuiltinFunction.OR, left, buf);
    }
    return left;
  }

  private static Node parseAnd(TokBuf buf) {
    Node left = parseComparison(buf);
    while(buf.isFunction(BuiltinFunction.AND)) {
      buf.next();
      left = parseInfixFunction(BuiltinFunction.AND, left, buf);
    }
    return left;
  }

  private static Node parseInfixFunction(BuiltinFunction func, Node left,
                                         TokBuf buf) {
    buf.expect(TokenType.LPAREN);
    List<Node> args = new ArrayList<Node>();
    args.add(left);
    parseArgs(buf, args);
    buf.expect(TokenType.RPAREN);
    return buf.track(new Node.FunctionCall(func, args), args);
  }

  private static Node parseComparison(TokBuf buf) {
    Node left = parseAddSub(buf);
    Operator op = null;
    while((op = buf.getBinaryOp(OpLevel.COMPARISON)) != null) {
      buf.next();
      left = binaryOp(op, left, parseAddSub(buf), buf);
    }
    return left;
  }

  private static Node parseAddSub(TokBuf buf) {
    Node left = parseMulDiv(buf);
    Operator op = null;
    while((op = buf.getBinaryOp(OpLevel.ADD_SUB)) != null) {
      buf.next();
      left = binaryOp(op, left, parseMulDiv(buf), buf);
    }
    return left;
  }

  private static Node parseMulDiv(TokBuf buf) {
    Node left = parsePower(buf);
    Operator op = null;
    while((op = buf.getBinaryOp(OpLevel.MUL_DIV)) != null) {
      buf.next();
      left = binaryOp(op, left, parsePower(buf), buf);
    }
    return left;
  }

  private static Node parsePower(TokBuf buf) {
    Node left = parseUnary(buf);
    Operator op = null;
    while((op = buf.getBinaryOp(OpLevel.POWER)) != null) {
      buf.next();
      left = binaryOp(op, left, parseUnary(buf), buf);
    }
    return left;
  }

  private static Node binaryOp(Operator op, Node left, Node right,
                               TokBuf buf) {
    return buf.track(new Node.BinaryOp(op, left, right), left, right);
  }

  private static Node parseUnary(TokBuf buf) {
    Token t = buf.peekNext();

    if((t.getType() == TokenType.OPERATOR) &&
       Operator.MINUS.getSymbol().equals(t.getValueStr())) {
      buf.next();
      buf.pushDepth();
      Node operand = parseUnary(buf);
      buf.popDepth();
      return buf.track(new Node.UnaryOp(Operator.NEGATE, operand), operand);
    }

    if(buf.isFunction(BuiltinFunction.NOT)) {
      buf.next();
      buf.expect(TokenType.LPAREN);
      Node operand = parseExpression(buf);
      buf.expect(TokenType.RPAREN);
      return buf.track(new Node.UnaryOp(Operator.NOT, operand), operand);
    }

    return parsePrimary(buf);
  }

  private static Node parsePrimary(TokBuf buf) {
    Token t = buf.peekNext();

    switch(t.getType()) {
    case NUMBER:
      buf.next();
      return new Node.NumberLiteral((Double)t.getValue());

    case STRING:
      buf.next();
      return new Node.StringLiteral(t.getValueStr());

    case COLUMN_REF:
      buf.next();
      return new Node.ColumnRef(t.getValueStr());

    case FUNCTION:
      buf.next();
      return parseFunction((BuiltinFunction)t.getValue(), buf);

    case LPAREN:
      buf.next();
      Node expr = parseExpression(buf);
      buf.expect(TokenType.RPAREN);
      return expr;

    default:
      throw unexpectedToken(t);
    }
  }

  private static Node parseFunction(BuiltinFunction func, TokBuf buf) {
    buf.expect(TokenType.LPAREN);

    if(func == BuiltinFunction.IF) {
      // IF is the only function with a fixed number of arguments
      Node condition = parseExpression(buf);
      buf.expect(TokenType.COMMA);
      Node whenTrue = parseExpression(buf);
      buf.expect(TokenType.COMMA);
      Node whenFalse = parseExpression(buf);
      buf.expect(TokenType.RPAREN);
      return buf.track(new Node.Conditional(condition, whenTrue, whenFalse),
                       condition, whenTrue, whenFalse);
    }

    List<Node> args = new ArrayList<Node>();
    if(buf.peekNext().getType() != TokenType.RPAREN) {
      parseArgs(buf, args);
    }
    buf.expect(TokenType.RPAREN);
    return buf.track(new Node.FunctionCall(func, args), args);
  }

  private static void parseArgs(TokBuf buf, List<Node> args) {
    args.add(parseExpression(buf));
    while(buf.peekNext().getType() == TokenType.COMMA) {
      buf.next();
      args.add(parseExpression(buf));
    }
  }

  private static ParseException tooDeep(Token t) {
    return new ParseException(
        "Formula is nested too deeply at position " + t.getPosition(),
        t.getType().name(), t.getPosition());
  }

  private static ParseException unexpectedToken(Token t) {
    return new ParseException(
        "Unexpected token " + t.getType() + " at position " + t.getPosition(),
        t.getType().name(), t.getPosition());
  }

  /** the binary operator precedence levels */
  private enum OpLevel
  {
    COMPARISON(Operator.EQ, Operator.NE, Operator.LT, Operator.GT,
               Operator.LTE, Operator.GTE),
    ADD_SUB(Operator.PLUS, Operator.MINUS, Operator.CONCAT),
    MUL_DIV(Operator.MULT, Operator.DIV, Operator.MOD),
    POWER(Operator.EXP);

    private final Operator[] _ops;

    private OpLevel(Operator... ops) {
      _ops = ops;
    }

    private Operator find(String symbol) {
      for(Operator op : _ops) {
        if(op.getSymbol().equals(symbol)) {
          return op;
        }
      }
      return null;
    }
  }

  private static final class TokBuf
  {
    private final List<Token> _tokens;
    private int _pos;
    private int _depth;
    /** heights of the non-leaf nodes parsed so far */
    private final Map<Node,Integer> _heights =
      new IdentityHashMap<Node,Integer>();

    private TokBuf(List<Token> tokens) {
      _tokens = tokens;
    }

    /**
     * @return the current token, the EOF token once all tokens are consumed
     */
    public Token peekNext() {
      return _tokens.get(Math.min(_pos, _tokens.size() - 1));
    }

    public Token next() {
      Token t = peekNext();
      if(_pos < (_tokens.size() - 1)) {
        ++_pos;
      }
      return t;
    }

    public Token expect(TokenType type) {
      Token t = peekNext();
      if(t.getType() != type) {
        throw new ParseException(
            "Expected " + type + " but got " + t.getType() + " at position " +
            t.getPosition(), t.getType().name(), t.getPosition());
      }
      return next();
    }

    public boolean isFunction(BuiltinFunction func) {
      Token t = peekNext();
      return ((t.getType() == TokenType.FUNCTION) && (t.getValue() == func));
    }

    public Operator getBinaryOp(OpLevel level) {
      Token t = peekNext();
      if(t.getType() != TokenType.OPERATOR) {
        return null;
      }
      return level.find(t.getValueStr());
    }

    public void pushDepth() {
      if(++_depth > MAX_DEPTH) {
        throw tooDeep(peekNext());
      }
    }

    public void popDepth() {
      --_depth;
    }

    public Node track(Node node, Node... children) {
      int height = 0;
      for(Node child : children) {
        height = Math.max(height, getHeight(child));
      }
      return track(node, height);
    }

    public Node track(Node node, Collection<? extends Node> children) {
      int height = 0;
      for(Node child : children) {
        height = Math.max(height, getHeight(child));
      }
      return track(node, height);
    }

    private Node track(Node node, int childHeight) {
      // operator chains are parsed in a loop, so the tree may be taller than
      // the parse nesting
      if(++childHeight > MAX_DEPTH) {
        throw tooDeep(peekNext());
      }
      _heights.put(node, childHeight);
      return node;
    }

    private int getHeight(Node node) {
      Integer height = _heights.get(node);
      return ((height != null) ? height : 1);
    }

    @Override
    public String toString() {
      return "[token " + _pos + "] " + _tokens;
    }
  }
}
