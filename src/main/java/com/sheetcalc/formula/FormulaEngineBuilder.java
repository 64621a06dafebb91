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

import java.time.Clock;

import com.sheetcalc.formula.impl.FormulaEngineImpl;

/**
 * Builder style class for constructing a {@link FormulaEngine}.
 * <p/>
 * Simple example usage:
 * <pre>
 *   FormulaEngine engine = new FormulaEngineBuilder().toEngine();
 * </pre>
 * <p/>
 * Advanced example usage:
 * <pre>
 *   FormulaEngine engine = new FormulaEngineBuilder()
 *     .setClock(Clock.fixed(instant, ZoneOffset.UTC))
 *     .setDebug(true)
 *     .toEngine();
 * </pre>
 *
 * @author SheetCalc Developers
 */
public class FormulaEngineBuilder
{
  /** system property which can be used to enable diagnostic output for all
      engines by default */
  public static final String DEBUG_PROPERTY = "com.sheetcalc.formula.debug";

  /** clock read by the TODAY and NOW functions */
  private Clock _clock = Clock.systemDefaultZone();
  /** whether or not failures should be logged */
  private boolean _debug = Boolean.getBoolean(DEBUG_PROPERTY);

  public FormulaEngineBuilder() {
  }

  /**
   * Sets the clock read by the current date/time functions.  Its zone is
   * also used to interpret date/time strings with an explicit offset.
   * Tests will usually want a {@link Clock#fixed fixed} clock.
   */
  public FormulaEngineBuilder setClock(Clock clock) {
    if(clock == null) {
      throw new IllegalArgumentException("Clock must be non-null");
    }
    _clock = clock;
    return this;
  }

  /**
   * Enables logging (at debug level) of compilation and evaluation
   * failures, which are otherwise reported only as {@code null} results.
   * Defaults to the value of the {@value #DEBUG_PROPERTY} system property.
   */
  public FormulaEngineBuilder setDebug(boolean debug) {
    _debug = debug;
    return this;
  }

  /**
   * Creates a new FormulaEngine with the currently configured attributes.
   */
  public FormulaEngine toEngine() {
    return new FormulaEngineImpl(_clock, _debug);
  }
}
