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

/**
 * The formula language: a small spreadsheet-like expression language used to
 * define computed columns over tabular rows, for example
 * {@code IF([Revenue]>1000,"High",SUM([Cost])*1.1)}.
 * <p/>
 * Formulas are compiled into an immutable tree of
 * {@link com.sheetcalc.formula.expr.Node}s which can be evaluated against any
 * number of rows.  Evaluation is forgiving: values are coerced
 * freely between numbers and strings (a string which is not a number is 0),
 * and the logical operators and functions produce the numbers 1 and 0.
 * <p/>
 * <h2>Syntax</h2>
 * <ul>
 *   <li><b>Literals:</b> numbers ({@code 12}, {@code 1.5}, {@code .5}) and
 *       strings in double or single quotes, where a backslash escapes the
 *       next character.</li>
 *   <li><b>Columns:</b> {@code [Column Name]}, or just {@code ColumnName} if
 *       the name is a simple identifier which is not a function name.
 *       Columns are matched by id, then name, then case-insensitively.</li>
 *   <li><b>Operators</b> (highest precedence first): unary {@code -},
 *       {@code ^} (left-associative), {@code * / %}, {@code + - &}
 *       (where {@code &} concatenates strings), and the comparisons
 *       {@code = <> < > <= >=}.</li>
 *   <li><b>Functions:</b> {@code NAME(arg, ...)}, names are case-insensitive.
 *       {@code AND} and {@code OR} may also follow an expression,
 *       {@code [a]>1 AND([b]>2)} is {@code AND([a]>1, [b]>2)}.</li>
 * </ul>
 * <p/>
 * <h2>Supporting Classes</h2>
 * <p/>
 * <ul>
 * <li>{@link com.sheetcalc.formula.expr.Node} the parsed form of a formula.</li>
 * <li>{@link com.sheetcalc.formula.expr.BuiltinFunction} the registry of
 *     supported functions.</li>
 * <li>{@link com.sheetcalc.formula.expr.EvalConfig} the settings shared by all
 *     evaluations of an engine.</li>
 * <li>{@link com.sheetcalc.formula.expr.EvalContext} encapsulates all state
 *     for evaluating a formula against a row.</li>
 * <li>{@link com.sheetcalc.formula.expr.Value} represents a typed primitive
 *     value.</li>
 * <li>{@link com.sheetcalc.formula.expr.EvalException} wrapper exception
 *     thrown for failures which occur during evaluation.</li>
 * <li>{@link com.sheetcalc.formula.expr.ParseException} wrapper exception
 *     thrown for failures which occur during parsing.</li>
 * </ul>
 * <p/>
 * <h2>Function Support</h2>
 *
 * <h3>Aggregation</h3>
 * <p/>
 * With the full set of rows available (e.g. when computing a column), the
 * argument is evaluated for every row.  Otherwise SUM, AVG, MIN and MAX
 * return the argument for the current row, and COUNT and DISTINCT return 1.
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Result</th></tr>
 * <tr class="TableRowColor"><td>SUM(x)</td><td>sum of x</td></tr>
 * <tr class="TableRowColor"><td>AVG(x)</td><td>sum of x / number of rows</td></tr>
 * <tr class="TableRowColor"><td>COUNT([x])</td><td>number of rows, or of non-empty x</td></tr>
 * <tr class="TableRowColor"><td>MIN(x)</td><td>smallest x</td></tr>
 * <tr class="TableRowColor"><td>MAX(x)</td><td>largest x</td></tr>
 * <tr class="TableRowColor"><td>DISTINCT(x)</td><td>number of distinct x</td></tr>
 * </table>
 *
 * <h3>Conditional</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th><th>Result</th></tr>
 * <tr class="TableRowColor"><td>IF(cond, a, b)</td><td>a if cond, else b</td></tr>
 * <tr class="TableRowColor"><td>SWITCH(x, case, result, ..., [default])</td><td>result of the first case equal to x</td></tr>
 * <tr class="TableRowColor"><td>COALESCE(a, ...)</td><td>first argument which is not null or empty</td></tr>
 * </table>
 *
 * <h3>Text</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th></tr>
 * <tr class="TableRowColor"><td>CONCATENATE, CONCAT</td></tr>
 * <tr class="TableRowColor"><td>LEFT(s, n), RIGHT(s, n)</td></tr>
 * <tr class="TableRowColor"><td>MID(s, start, count)</td></tr>
 * <tr class="TableRowColor"><td>LEN, UPPER, LOWER, TRIM</td></tr>
 * <tr class="TableRowColor"><td>REPLACE(s, start, count, new)</td></tr>
 * <tr class="TableRowColor"><td>SUBSTITUTE(s, find, new)</td></tr>
 * </table>
 *
 * <h3>Math</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th></tr>
 * <tr class="TableRowColor"><td>ROUND, FLOOR, CEIL, CEILING (x, [decimals])</td></tr>
 * <tr class="TableRowColor"><td>ABS, SQRT, LOG, LOG10, EXP</td></tr>
 * <tr class="TableRowColor"><td>POWER, POW, MOD</td></tr>
 * </table>
 *
 * <h3>Date</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th></tr>
 * <tr class="TableRowColor"><td>YEAR, MONTH, DAY</td></tr>
 * <tr class="TableRowColor"><td>TODAY, NOW</td></tr>
 * <tr class="TableRowColor"><td>DATEDIFF(start, end)</td></tr>
 * <tr class="TableRowColor"><td>DATEADD(date, amount, [day|week|month|year])</td></tr>
 * </table>
 *
 * <h3>Conversion and Logical</h3>
 *
 * <table border="1" width="25%" cellpadding="3" cellspacing="0">
 * <tr class="TableHeadingColor" align="left"><th>Function</th></tr>
 * <tr class="TableRowColor"><td>TEXT, VALUE, INT, FLOAT</td></tr>
 * <tr class="TableRowColor"><td>AND, OR, NOT, TRUE(), FALSE()</td></tr>
 * </table>
 */
package com.sheetcalc.formula.expr;
