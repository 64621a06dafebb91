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

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalQuery;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import com.sheetcalc.formula.expr.EvalContext;
import com.sheetcalc.formula.expr.EvalException;
import com.sheetcalc.formula.expr.Node;
import com.sheetcalc.formula.expr.Value;
import org.apache.commons.lang3.StringUtils;
import static com.sheetcalc.formula.impl.expr.FunctionSupport.*;
import static com.sheetcalc.formula.impl.expr.ValueSupport.*;

/**
 * The date functions.  Arguments are interpreted as dates leniently: date
 * column values are used as is, strings are parsed using a number of common
 * formats (ISO dates and date/times, with or without an offset, and US
 * month/day/year dates), and everything else is "not a date", for which the
 * date functions return {@code null}.
 *
 * @author SheetCalc Developers
 */
public class DefaultDateFunctions
{
  private static final long MILLIS_PER_DAY = 24L * 60L * 60L * 1000L;

  private static final DateTimeFormatter NOW_FMT =
    DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT)
    .withZone(ZoneOffset.UTC);

  private static final List<DateTimeFormatter> DATE_FMTS = Arrays.asList(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.ofPattern("M/d/uuuu", Locale.ROOT),
      DateTimeFormatter.ofPattern("uuuu/M/d", Locale.ROOT));

  private static final List<DateTimeFormatter> DATE_TIME_FMTS = Arrays.asList(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral(' ')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .toFormatter(Locale.ROOT),
      DateTimeFormatter.ofPattern("M/d/uuuu H:mm[:ss]", Locale.ROOT));

  private DefaultDateFunctions() {}

  public static Value evaluate(Node.FunctionCall call, EvalContext ctx) {
    switch(call.getFunction()) {
    case YEAR: {
      DateValue date = evalDateArg(call, 0, ctx);
      return ((date != null) ? toValue(date.getDateTime().getYear()) :
              NULL_VAL);
    }

    case MONTH: {
      DateValue date = evalDateArg(call, 0, ctx);
      return ((date != null) ? toValue(date.getDateTime().getMonthValue()) :
              NULL_VAL);
    }

    case DAY: {
      DateValue date = evalDateArg(call, 0, ctx);
      return ((date != null) ? toValue(date.getDateTime().getDayOfMonth()) :
              NULL_VAL);
    }

    case TODAY:
      return toValue(LocalDate.now(ctx.getClock()).toString());

    case NOW:
      return toValue(formatNow(ctx.getClock()));

    case DATEDIFF: {
      DateValue start = evalDateArg(call, 0, ctx);
      DateValue end = evalDateArg(call, 1, ctx);
      if((start == null) || (end == null)) {
        return NULL_VAL;
      }
      long millis = Duration.between(start.getDateTime(), end.getDateTime())
        .toMillis();
      return toValue((double)Math.floorDiv(millis, MILLIS_PER_DAY));
    }

    case DATEADD: {
      DateValue date = evalDateArg(call, 0, ctx);
      if(date == null) {
        return NULL_VAL;
      }
      long amount = (long)evalDoubleArg(call, 1, ctx);
      DateUnit unit = (hasArg(call, 2) ?
                       DateUnit.forName(evalStringArg(call, 2, ctx)) :
                       DateUnit.DAY);
      LocalDateTime result = unit.add(date.getDateTime(), amount);
      return toValue(formatDateTime(result, date.isDateOnly()));
    }

    default:
      throw new EvalException("Unknown function: " + call.getName());
    }
  }

  static String formatNow(Clock clock) {
    return NOW_FMT.format(clock.instant());
  }

  private static DateValue evalDateArg(Node.FunctionCall call, int idx,
                                       EvalContext ctx) {
    return toDateValue(evalArg(call, idx, ctx), ctx.getClock().getZone());
  }

  /**
   * @param zone zone into which date/times with an explicit offset are
   *             converted
   *
   * @return the given value as a date, {@code null} if it cannot be
   *         interpreted as a date
   */
  public static DateValue toDateValue(Value val, ZoneId zone) {
    switch(val.getType()) {
    case DATE:
      return (DateValue)val;
    case STRING:
      return stringToDateValue(val.getAsString(), zone);
    default:
      // numbers are never dates
      return null;
    }
  }

  static DateValue stringToDateValue(String str, ZoneId zone) {
    String tmpStr = StringUtils.trimToNull(str);
    if(tmpStr == null) {
      return null;
    }

    for(DateTimeFormatter fmt : DATE_FMTS) {
      LocalDate ld = tryParse(fmt, tmpStr, LocalDate::from);
      if(ld != null) {
        return new DateValue(str, ld.atStartOfDay(), true);
      }
    }

    for(DateTimeFormatter fmt : DATE_TIME_FMTS) {
      LocalDateTime ldt = tryParse(fmt, tmpStr, LocalDateTime::from);
      if(ldt != null) {
        return new DateValue(str, ldt, false);
      }
    }

    ZonedDateTime zdt = tryParse(DateTimeFormatter.ISO_ZONED_DATE_TIME,
                                 tmpStr, ZonedDateTime::from);
    if(zdt != null) {
      return new DateValue(
          str, LocalDateTime.ofInstant(zdt.toInstant(), zone), false);
    }

    return null;
  }

  private static <T> T tryParse(DateTimeFormatter fmt, String str,
                                TemporalQuery<T> query) {
    try {
      return fmt.parse(str, query);
    } catch(DateTimeParseException pe) {
      // not in this format
      return null;
    }
  }

  /** the units supported by DATEADD */
  private enum DateUnit
  {
    DAY("d", "day", "days") {
      @Override
      LocalDateTime add(LocalDateTime ldt, long amount) {
        return ldt.plusDays(amount);
      }
    },
    WEEK("w", "week", "weeks") {
      @Override
      LocalDateTime add(LocalDateTime ldt, long amount) {
        return ldt.plusWeeks(amount);
      }
    },
    MONTH("m", "month", "months") {
      @Override
      LocalDateTime add(LocalDateTime ldt, long amount) {
        return ldt.plusMonths(amount);
      }
    },
    YEAR("y", "year", "years") {
      @Override
      LocalDateTime add(LocalDateTime ldt, long amount) {
        return ldt.plusYears(amount);
      }
    };

    private final List<String> _names;

    private DateUnit(String... names) {
      _names = Arrays.asList(names);
    }

    abstract LocalDateTime add(LocalDateTime ldt, long amount);

    static DateUnit forName(String name) {
      String lowerName = name.trim().toLowerCase(Locale.ROOT);
      for(DateUnit unit : values()) {
        if(unit._names.contains(lowerName)) {
          return unit;
        }
      }
      throw new EvalException("Invalid date unit '" + name + "'");
    }
  }
}
