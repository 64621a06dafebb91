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

import com.sheetcalc.formula.impl.FormulaToStringStyle;

/**
 * The result of validating a formula against column metadata.
 *
 * @author SheetCalc Developers
 */
public class ValidationResult
{
  private static final ValidationResult VALID = new ValidationResult(null);

  private final String _error;

  private ValidationResult(String error) {
    _error = error;
  }

  public static ValidationResult valid() {
    return VALID;
  }

  public static ValidationResult invalid(String error) {
    return new ValidationResult(error);
  }

  public boolean isValid() {
    return (_error == null);
  }

  /**
   * @return the reason the formula is invalid, {@code null} if it is valid
   */
  public String getError() {
    return _error;
  }

  @Override
  public String toString() {
    return FormulaToStringStyle.builder(this)
      .append("valid", isValid())
      .append("error", _error)
      .toString();
  }
}
