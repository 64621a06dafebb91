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

/**
 * Exception thrown when a formula cannot be parsed.  Identifies the type of
 * the offending token and its offset within the formula source.
 *
 * @author SheetCalc Developers
 */
public class ParseException extends EvalException
{
  private static final long serialVersionUID = 20261016L;

  private final String _tokenType;
  private final int _position;

  public ParseException(String message, String tokenType, int position) {
    super(message);
    _tokenType = tokenType;
    _position = position;
  }

  /**
   * @return the type of the token at which parsing failed
   */
  public String getTokenType() {
    return _tokenType;
  }

  /**
   * @return the source offset of the token at which parsing failed
   */
  public int getPosition() {
    return _position;
  }
}
