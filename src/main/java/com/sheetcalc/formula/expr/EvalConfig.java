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

import java.time.Clock;

/**
 * The EvalConfig holds the settings shared by every evaluation performed by
 * a given {@link com.sheetcalc.formula.FormulaEngine}.  Instances are
 * immutable, configure them via the
 * {@link com.sheetcalc.formula.FormulaEngineBuilder}.
 *
 * @see com.sheetcalc.formula.expr formula package docs
 *
 * @author SheetCalc Developers
 */
public interface EvalConfig
{
  /**
   * @return the clock read by the {@code TODAY} and {@code NOW} functions.
   *         The zone of this clock is also the zone into which date/time
   *         strings with an explicit offset are converted.
   */
  public Clock getClock();

  /**
   * @return {@code true} if diagnostic output for failed compilations and
   *         evaluations is enabled.  Never affects evaluation results.
   */
  public boolean isDebug();
}
