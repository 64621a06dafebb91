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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.sheetcalc.formula.expr.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Conversions between raw java values and formula {@link Value}s, and the
 * coercion rules shared by the value implementations.
 *
 * @author SheetCalc Developers
 */
public class ValueSupport
{
  public static final Value NULL_VAL = new BaseValue() {
    @Override public boolean isNull() {
      return true;
    }
    @Override public Type getType() {
      return Type.NULL;
    }
    @Override public Object get() {
      return null;
    }
    @Override public boolean getAsBoolean() {
      return false;
    }
    @Override public String getAsString() {
      return "";
    }
    @Override public double getAsDouble() {
      return 0d;
    }
  };
  // logical results are numbers, not booleans
  public static final Value TRUE_VAL = new NumberValue(1d);
  public static final Value FALSE_VAL = new NumberValue(0d);
  public static final Value EMPTY_STR_VAL = new StringValue("");

  static final Pattern NUMBER_PAT =
    Pattern.compile("^[+-]?(([0-9]+[.]?[0-9]*)|([.][0-9]+))([eE][+-]?[0-9]+)?");
  // currency/grouping/percent decoration and whitespace are ignored
  static final Pattern NUMBER_DECORATION_PAT = Pattern.compile("[,$%\\s]+");

  private ValueSupport() {}

  public static Value toValue(boolean b) {
    return (b ? TRUE_VAL : FALSE_VAL);
  }

  public static Value toValue(String s) {
    return ((s != null) ? new StringValue(s) : NULL_VAL);
  }

  public static Value toValue(double d) {
    return new NumberValue(d);
  }

  public static Value toValue(LocalDate ld) {
    return new DateValue(ld, ld.atStartOfDay(), true);
  }

  public static Value toValue(LocalDateTime ldt) {
    return new DateValue(ldt, ldt, false);
  }

  /**
   * Wraps a loosely typed row value.
   *
   * @param zone zone used to interpret instants
   */
  public static Value toValue(Object val, ZoneId zone) {
    if(val == null) {
      return NULL_VAL;
    }
    if(val instanceof Number) {
      return toValue(((Number)val).doubleValue());
    }
    if(val instanceof Boolean) {
      return new BooleanValue((Boolean)val);
    }
    if(val instanceof CharSequence) {
      return toValue(val.toString());
    }
    if(val instanceof LocalDate) {
      return toValue((LocalDate)val);
    }
    if(val instanceof LocalDateTime) {
      return toValue((LocalDateTime)val);
    }
    if(val instanceof OffsetDateTime) {
      return new DateValue(val, toLocalDateTime(
                               ((OffsetDateTime)val).toInstant(), zone),
                           false);
    }
    if(val instanceof ZonedDateTime) {
      return new DateValue(val, toLocalDateTime(
                               ((ZonedDateTime)val).toInstant(), zone),
                           false);
    }
    if(val instanceof Instant) {
      return new DateValue(val, toLocalDateTime((Instant)val, zone), false);
    }
    if(val instanceof Date) {
      // java.sql.Date does not support toInstant()
      return new DateValue(val, toLocalDateTime(
                               Instant.ofEpochMilli(((Date)val).getTime()),
                               zone), false);
    }
    return toValue(val.toString());
  }

  private static LocalDateTime toLocalDateTime(Instant inst, ZoneId zone) {
    return LocalDateTime.ofInstant(inst, zone);
  }

  /**
   * Parses the leading number of the given string, ignoring any whitespace,
   * commas, dollar signs and percent signs.
   *
   * @return the parsed number, 0 if the string does not start with a number
   */
  public static double parseNumber(String str) {
    if(StringUtils.isEmpty(str)) {
      return 0d;
    }
    String tmpVal = NUMBER_DECORATION_PAT.matcher(str).replaceAll("");
    Matcher m = NUMBER_PAT.matcher(tmpVal);
    if(!m.find()) {
      return 0d;
    }
    double d = Double.parseDouble(m.group());
    return (Double.isNaN(d) ? 0d : d);
  }

  /**
   * @return {@code false} for the empty string and the strings "false", "0"
   *         and "no" (ignoring case), {@code true} otherwise
   */
  public static boolean stringToBoolean(String str) {
    return !(str.isEmpty() || str.equalsIgnoreCase("false") ||
             str.equals("0") || str.equalsIgnoreCase("no"));
  }

  /**
   * Formats a number the way it is displayed by the formula language:
   * integral values have no fractional part and no exponent is ever used.
   */
  public static String formatNumber(double d) {
    if(Double.isNaN(d)) {
      return "NaN";
    }
    if(Double.isInfinite(d)) {
      return ((d > 0d) ? "Infinity" : "-Infinity");
    }
    if(d == 0d) {
      // includes negative zero
      return "0";
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  /**
   * Formats a date/time in ISO format, omitting the time for date-only
   * values.
   */
  public static String formatDateTime(LocalDateTime ldt, boolean dateOnly) {
    return (dateOnly ? ldt.toLocalDate().toString() : ldt.toString());
  }

  /**
   * @return {@code true} if the given value is {@code null} or the empty
   *         string
   */
  public static boolean isNullOrEmpty(Value val) {
    return (val.isNull() ||
            ((val.getType() == Value.Type.STRING) &&
             val.getAsString().isEmpty()));
  }
}
