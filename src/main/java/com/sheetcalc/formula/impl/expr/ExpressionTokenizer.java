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
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.sheetcalc.formula.expr.BuiltinFunction;


/**
 * Splits formula source text into tokens.  Tokenizing never fails:
 * characters which cannot start any token are dropped, so a partially typed
 * formula still tokenizes.
 *
 * @author SheetCalc Developers
 */
class ExpressionTokenizer
{
  private static final int EOF = -1;
  private static final char QUOTED_STR_CHAR = '"';
  private static final char SINGLE_QUOTED_STR_CHAR = '\'';
  private static final char ESCAPE_CHAR = '\\';
  private static final char OBJ_NAME_START_CHAR = '[';
  private static final char OBJ_NAME_END_CHAR = ']';
  private static final String SINGLE_CHAR_OPS = "+-*/%^&=<>";
  private static final Set<String> TWO_CHAR_COMP_OPS = new HashSet<String>(
      Arrays.asList("<>", "<=", ">="));
  private static final String TRUE_STR = "TRUE";
  private static final String FALSE_STR = "FALSE";

  enum TokenType {
    NUMBER, STRING, COLUMN_REF, FUNCTION, OPERATOR, LPAREN, RPAREN, COMMA,
    EOF;
  }

  private ExpressionTokenizer() {}

  /**
   * Tokenizes a formula string.  The returned list always ends with a single
   * {@link TokenType#EOF} token.
   */
  static List<Token> tokenize(String formula) {

    if(formula == null) {
      formula = "";
    }

    List<Token> tokens = new ArrayList<Token>();

    ExprBuf buf = new ExprBuf(formula);

    while(buf.hasNext()) {
      int start = buf.curPos();
      char c = buf.next();

      if(isSpace(c)) {
        continue;
      }

      if(isDigit(c) || ((c == '.') && isDigit(buf.peekNext()))) {
        buf.popPrev();
        tokens.add(parseNumber(buf));
        continue;
      }

      switch(c) {
      case QUOTED_STR_CHAR:
      case SINGLE_QUOTED_STR_CHAR:
        tokens.add(new Token(TokenType.STRING, parseQuotedString(buf, c),
                             start));
        continue;

      case OBJ_NAME_START_CHAR:
        tokens.add(new Token(TokenType.COLUMN_REF, parseObjName(buf), start));
        continue;

      case '(':
        tokens.add(new Token(TokenType.LPAREN, "(", start));
        continue;

      case ')':
        tokens.add(new Token(TokenType.RPAREN, ")", start));
        continue;

      case ',':
        tokens.add(new Token(TokenType.COMMA, ",", start));
        continue;

      default:
        // fall through to operators and identifiers
      }

      if(SINGLE_CHAR_OPS.indexOf(c) >= 0) {
        tokens.add(new Token(TokenType.OPERATOR, parseOp(c, buf), start));
        continue;
      }

      if(isIdentStart(c)) {
        buf.popPrev();
        tokens.add(parseIdentifier(buf));
      }

      // anything else is silently ignored
    }

    tokens.add(new Token(TokenType.EOF, "", buf.curPos()));

    return tokens;
  }

  private static Token parseNumber(ExprBuf buf) {
    int start = buf.curPos();
    StringBuilder sb = buf.getScratchBuffer();
    while(buf.hasNext()) {
      int c = buf.peekNext();
      if(!isDigit(c) && (c != '.')) {
        break;
      }
      sb.append(buf.next());
    }
    // "1.2.3" is read as 1.2
    String numStr = sb.toString();
    return new Token(TokenType.NUMBER, ValueSupport.parseNumber(numStr),
                     numStr, start);
  }

  private static String parseQuotedString(ExprBuf buf, char quoteChar) {
    StringBuilder sb = buf.getScratchBuffer();
    while(buf.hasNext()) {
      char c = buf.next();
      if(c == quoteChar) {
        return sb.toString();
      }
      if(c == ESCAPE_CHAR) {
        if(!buf.hasNext()) {
          // dangling escape at the end of the formula
          break;
        }
        c = buf.next();
      }
      sb.append(c);
    }

    // unterminated string runs to the end of the formula
    return sb.toString();
  }

  private static String parseObjName(ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer();
    while(buf.hasNext()) {
      char c = buf.next();
      if(c == OBJ_NAME_END_CHAR) {
        break;
      }
      sb.append(c);
    }
    return sb.toString();
  }

  private static String parseOp(char firstChar, ExprBuf buf) {
    int nextChar = buf.peekNext();
    if(nextChar != EOF) {
      String twoCharOp = new StringBuilder(2).append(firstChar)
        .append((char)nextChar).toString();
      if(TWO_CHAR_COMP_OPS.contains(twoCharOp)) {
        buf.next();
        return twoCharOp;
      }
    }
    return String.valueOf(firstChar);
  }

  private static Token parseIdentifier(ExprBuf buf) {
    int start = buf.curPos();
    StringBuilder sb = buf.getScratchBuffer();
    while(buf.hasNext() && isIdentPart(buf.peekNext())) {
      sb.append(buf.next());
    }
    String ident = sb.toString();
    String upperIdent = ident.toUpperCase(Locale.ROOT);

    BuiltinFunction func = BuiltinFunction.lookup(upperIdent);
    if(func != null) {
      return new Token(TokenType.FUNCTION, func, upperIdent, start);
    }

    // note, TRUE and FALSE are registered functions, so these only apply if
    // they are ever removed from the registry
    if(TRUE_STR.equals(upperIdent)) {
      return new Token(TokenType.NUMBER, 1d, ident, start);
    }
    if(FALSE_STR.equals(upperIdent)) {
      return new Token(TokenType.NUMBER, 0d, ident, start);
    }

    // bare identifiers are an alternate column reference syntax
    return new Token(TokenType.COLUMN_REF, ident, start);
  }

  private static boolean isSpace(char c) {
    return (Character.isWhitespace(c) || Character.isSpaceChar(c));
  }

  private static boolean isDigit(int c) {
    return ((c >= '0') && (c <= '9'));
  }

  private static boolean isIdentStart(int c) {
    return (((c >= 'A') && (c <= 'Z')) || ((c >= 'a') && (c <= 'z')) ||
            (c == '_'));
  }

  private static boolean isIdentPart(int c) {
    return (isIdentStart(c) || isDigit(c));
  }

  static final class ExprBuf
  {
    private final String _str;
    private int _pos;
    private final StringBuilder _scratch = new StringBuilder();

    ExprBuf(String str) {
      _str = str;
    }

    private int len() {
      return _str.length();
    }

    public int curPos() {
      return _pos;
    }

    public boolean hasNext() {
      return _pos < len();
    }

    public char next() {
      return _str.charAt(_pos++);
    }

    public void popPrev() {
      --_pos;
    }

    public int peekNext() {
      if(!hasNext()) {
        return EOF;
      }
      return _str.charAt(_pos);
    }

    public StringBuilder getScratchBuffer() {
      _scratch.setLength(0);
      return _scratch;
    }

    @Override
    public String toString() {
      return "[char " + _pos + "] '" + _str + "'";
    }
  }


  static final class Token
  {
    private final TokenType _type;
    private final Object _val;
    private final String _valStr;
    private final int _pos;

    private Token(TokenType type, String val, int pos) {
      this(type, val, val, pos);
    }

    private Token(TokenType type, Object val, String valStr, int pos) {
      _type = type;
      _val = ((val != null) ? val : valStr);
      _valStr = valStr;
      _pos = pos;
    }

    public TokenType getType() {
      return _type;
    }

    /**
     * @return the token value: a Double for numbers, the BuiltinFunction for
     *         functions, the String for everything else
     */
    public Object getValue() {
      return _val;
    }

    public String getValueStr() {
      return _valStr;
    }

    public int getPosition() {
      return _pos;
    }

    @Override
    public String toString() {
      return "[" + _type + "] '" + _val + "' @" + _pos;
    }
  }

}
