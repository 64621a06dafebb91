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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import com.sheetcalc.formula.impl.expr.ValueSupport;

/**
 * A node of the abstract syntax tree of a parsed formula.  The set of node
 * types is closed (all subclasses are nested in this class) and every node
 * is immutable, so a tree may be held and re-evaluated for as long as the
 * formula text is unchanged.  Column references are kept by name only,
 * resolution happens at evaluation time.
 * <p/>
 * Nodes implement structural equality: two trees are equal if they have the
 * same shape and the same literal values, operators, column names and
 * functions.
 *
 * @author SheetCalc Developers
 */
public abstract class Node
{
  /** the kinds of nodes in a formula tree */
  public enum Type
  {
    NUMBER_LITERAL, STRING_LITERAL, COLUMN_REF, BINARY_OP, UNARY_OP,
    FUNCTION_CALL, CONDITIONAL;
  }

  private Node() {}

  public abstract Type getType();

  /**
   * Adds the names of all the columns referenced by this node (and its
   * children) to the given collection, in source order.
   */
  public void collectColumnRefs(Collection<String> names) {
    // most nodes have no column refs
  }

  /**
   * @return the names of all the columns referenced by this node, in source
   *         order (duplicates included)
   */
  public List<String> getColumnRefs() {
    List<String> names = new ArrayList<String>();
    collectColumnRefs(names);
    return names;
  }

  /**
   * @return a verbose rendering of this tree which identifies each node by
   *         type, e.g. {@code <BinaryOp>{<NumberLiteral>{1} + <ColumnRef>{[a]}}}
   */
  public String toDebugString() {
    StringBuilder sb = new StringBuilder();
    toDebugString(sb);
    return sb.toString();
  }

  /**
   * Returns formula source text for this tree, with binary operations fully
   * parenthesized.  The text of any tree produced by the parser parses back
   * to an equal tree.  A hand-built tree may have no exact source form: a
   * negative number literal is written as a negation, {@code NaN} and
   * {@code Infinity} are written as column names and a {@code ']'} in a
   * column name is written as is.
   *
   * @return formula source text for this tree
   */
  public String toCleanString() {
    StringBuilder sb = new StringBuilder();
    toCleanString(sb);
    return sb.toString();
  }

  protected abstract void toDebugString(StringBuilder sb);

  protected abstract void toCleanString(StringBuilder sb);

  @Override
  public String toString() {
    return toDebugString();
  }

  private static void openDebug(StringBuilder sb, String name) {
    sb.append("<").append(name).append(">{");
  }

  private static void appendDebugArgs(StringBuilder sb, List<Node> args) {
    sb.append("(");
    for(Iterator<Node> iter = args.iterator(); iter.hasNext(); ) {
      iter.next().toDebugString(sb);
      if(iter.hasNext()) {
        sb.append(", ");
      }
    }
    sb.append(")");
  }

  private static void appendCleanArgs(StringBuilder sb, List<Node> args) {
    sb.append("(");
    for(Iterator<Node> iter = args.iterator(); iter.hasNext(); ) {
      iter.next().toCleanString(sb);
      if(iter.hasNext()) {
        sb.append(", ");
      }
    }
    sb.append(")");
  }

  private static void appendQuoted(StringBuilder sb, String str) {
    sb.append('"');
    for(int i = 0; i < str.length(); ++i) {
      char c = str.charAt(i);
      if((c == '"') || (c == '\\')) {
        sb.append('\\');
      }
      sb.append(c);
    }
    sb.append('"');
  }

  private static <T> T requireNode(T node, String desc) {
    return Objects.requireNonNull(node, desc + " may not be null");
  }

  /**
   * A numeric literal.
   */
  public static final class NumberLiteral extends Node
  {
    private final double _value;

    public NumberLiteral(double value) {
      _value = value;
    }

    @Override
    public Type getType() {
      return Type.NUMBER_LITERAL;
    }

    public double getValue() {
      return _value;
    }

    @Override
    protected void toDebugString(StringBuilder sb) {
      openDebug(sb, "NumberLiteral");
      toCleanString(sb);
      sb.append("}");
    }

    @Override
    protected void toCleanString(StringBuilder sb) {
      sb.append(ValueSupport.formatNumber(_value));
    }

    @Override
    public boolean equals(Object o) {
      return ((this == o) ||
              ((o instanceof NumberLiteral) &&
               (Double.compare(_value, ((NumberLiteral)o)._value) == 0)));
    }

    @Override
    public int hashCode() {
      return Double.hashCode(_value);
    }
  }

  /**
   * A string literal.
   */
  public static final class StringLiteral extends Node
  {
    private final String _value;

    public StringLiteral(String value) {
      _value = requireNode(value, "value");
    }

    @Override
    public Type getType() {
      return Type.STRING_LITERAL;
    }

    public String getValue() {
      return _value;
    }

    @Override
    protected void toDebugString(StringBuilder sb) {
      openDebug(sb, "StringLiteral");
      toCleanString(sb);
      sb.append("}");
    }

    @Override
    protected void toCleanString(StringBuilder sb) {
      appendQuoted(sb, _value);
    }

    @Override
    public boolean equals(Object o) {
      return ((this == o) ||
              ((o instanceof StringLiteral) &&
               _value.equals(((StringLiteral)o)._value)));
    }

    @Override
    public int hashCode() {
      return _value.hashCode();
    }
  }

  /**
   * A reference to a column of the current row, by column name or id.
   */
  public static final class ColumnRef extends Node
  {
    private final String _name;

    public ColumnRef(String name) {
      _name = requireNode(name, "name");
    }

    @Override
    public Type getType() {
      return Type.COLUMN_REF;
    }

    public String getName() {
      return _name;
    }

    @Override
    public void collectColumnRefs(Collection<String> names) {
      names.add(_name);
    }

    @Override
    protected void toDebugString(StringBuilder sb) {
      openDebug(sb, "ColumnRef");
      toCleanString(sb);
      sb.append("}");
    }

    @Override
    protected void toCleanString(StringBuilder sb) {
      sb.append("[").append(_name).append("]");
    }

    @Override
    public boolean equals(Object o) {
      return ((this == o) ||
              ((o instanceof ColumnRef) &&
               _name.equals(((ColumnRef)o)._name)));
    }

    @Override
    public int hashCode() {
      return _name.hashCode();
    }
  }

  /**
   * An operation with two operands.
   */
  public static final class BinaryOp extends Node
  {
    private final Operator _op;
    private final Node _left;
    private final Node _right;

    public BinaryOp(Operator op, Node left, Node right) {
      if(!requireNode(op, "operator").isBinary()) {
        throw new IllegalArgumentException("Operator " + op.name() +
                                           " is not a binary operator");
      }
      _op = op;
      _left = requireNode(left, "left");
      _right = requireNode(right, "right");
    }

    @Override
    public Type getType() {
      return Type.BINARY_OP;
    }

    public Operator getOperator() {
      return _op;
    }

    public Node getLeft() {
      return _left;
    }

    public Node getRight() {
      return _right;
    }

    @Override
    public void collectColumnRefs(Collection<String> names) {
      _left.collectColumnRefs(names);
      _right.collectColumnRefs(names);
    }

    @Override
    protected void toDebugString(StringBuilder sb) {
      openDebug(sb, "BinaryOp");
      _left.toDebugString(sb);
      sb.append(" ").append(_op.getSymbol()).append(" ");
      _right.toDebugString(sb);
      sb.append("}");
    }

    @Override
    protected void toCleanString(StringBuilder sb) {
      sb.append("(");
      _left.toCleanString(sb);
      sb.append(" ").append(_op.getSymbol()).append(" ");
      _right.toCleanString(sb);
      sb.append(")");
    }

    @Override
    public boolean equals(Object o) {
      if(this == o) {
        return true;
      }
      if(!(o instanceof BinaryOp)) {
        return false;
      }
      BinaryOp other = (BinaryOp)o;
      return ((_op == other._op) && _left.equals(other._left) &&
              _right.equals(other._right));
    }

    @Override
    public int hashCode() {
      return Objects.hash(_op, _left, _right);
    }
  }

  /**
   * An operation with one operand ({@code -} or {@code NOT}).
   */
  public static final class UnaryOp extends Node
  {
    private final Operator _op;
    private final Node _operand;

    public UnaryOp(Operator op, Node operand) {
      if(requireNode(op, "operator").isBinary()) {
        throw new IllegalArgumentException("Operator " + op.name() +
                                           " is not a unary operator");
      }
      _op = op;
      _operand = requireNode(operand, "operand");
    }

    @Override
    public Type getType() {
      return Type.UNARY_OP;
    }

    public Operator getOperator() {
      return _op;
    }

    public Node getOperand() {
      return _operand;
    }

    @Override
    public void collectColumnRefs(Collection<String> names) {
      _operand.collectColumnRefs(names);
    }

    @Override
    protected void toDebugString(StringBuilder sb) {
      openDebug(sb, "UnaryOp");
      sb.append(_op.getSymbol());
      if(_op == Operator.NOT) {
        sb.append(" ");
      }
      _operand.toDebugString(sb);
      sb.append("}");
    }

    @Override
    protected void toCleanString(StringBuilder sb) {
      if(_op == Operator.NOT) {
        sb.append("NOT(");
        _operand.toCleanString(sb);
        sb.append(")");
      } else {
        sb.append(_op.getSymbol());
        _operand.toCleanString(sb);
      }
    }

    @Override
    public boolean equals(Object o) {
      if(this == o) {
        return true;
      }
      if(!(o instanceof UnaryOp)) {
        return false;
      }
      UnaryOp other = (UnaryOp)o;
      return ((_op == other._op) && _operand.equals(other._operand));
    }

    @Override
    public int hashCode() {
      return Objects.hash(_op, _operand);
    }
  }

  /**
   * A call to one of the built-in functions.
   */
  public static final class FunctionCall extends Node
  {
    private final BuiltinFunction _func;
    private final List<Node> _args;

    public FunctionCall(BuiltinFunction func, List<? extends Node> args) {
      _func = requireNode(func, "function");
      List<Node> argsCopy = new ArrayList<Node>(requireNode(args, "args"));
      for(Node arg : argsCopy) {
        requireNode(arg, "arg");
      }
      _args = Collections.unmodifiableList(argsCopy);
    }

    @Override
    public Type getType() {
      return Type.FUNCTION_CALL;
    }

    public BuiltinFunction getFunction() {
      return _func;
    }

    public String getName() {
      return _func.name();
    }

    public List<Node> getArgs() {
      return _args;
    }

    @Override
    public void collectColumnRefs(Collection<String> names) {
      for(Node arg : _args) {
        arg.collectColumnRefs(names);
      }
    }

    @Override
    protected void toDebugString(StringBuilder sb) {
      openDebug(sb, "FunctionCall");
      sb.append(getName());
      appendDebugArgs(sb, _args);
      sb.append("}");
    }

    @Override
    protected void toCleanString(StringBuilder sb) {
      sb.append(getName());
      appendCleanArgs(sb, _args);
    }

    @Override
    public boolean equals(Object o) {
      if(this == o) {
        return true;
      }
      if(!(o instanceof FunctionCall)) {
        return false;
      }
      FunctionCall other = (FunctionCall)o;
      return ((_func == other._func) && _args.equals(other._args));
    }

    @Override
    public int hashCode() {
      return Objects.hash(_func, _args);
    }
  }

  /**
   * The three argument {@code IF} expression.  Only the branch selected by
   * the condition is evaluated.
   */
  public static final class Conditional extends Node
  {
    private final Node _condition;
    private final Node _whenTrue;
    private final Node _whenFalse;

    public Conditional(Node condition, Node whenTrue, Node whenFalse) {
      _condition = requireNode(condition, "condition");
      _whenTrue = requireNode(whenTrue, "whenTrue");
      _whenFalse = requireNode(whenFalse, "whenFalse");
    }

    @Override
    public Type getType() {
      return Type.CONDITIONAL;
    }

    public Node getCondition() {
      return _condition;
    }

    public Node getWhenTrue() {
      return _whenTrue;
    }

    public Node getWhenFalse() {
      return _whenFalse;
    }

    private List<Node> getParts() {
      List<Node> parts = new ArrayList<Node>(3);
      parts.add(_condition);
      parts.add(_whenTrue);
      parts.add(_whenFalse);
      return parts;
    }

    @Override
    public void collectColumnRefs(Collection<String> names) {
      _condition.collectColumnRefs(names);
      _whenTrue.collectColumnRefs(names);
      _whenFalse.collectColumnRefs(names);
    }

    @Override
    protected void toDebugString(StringBuilder sb) {
      openDebug(sb, "Conditional");
      sb.append("IF");
      appendDebugArgs(sb, getParts());
      sb.append("}");
    }

    @Override
    protected void toCleanString(StringBuilder sb) {
      sb.append("IF");
      appendCleanArgs(sb, getParts());
    }

    @Override
    public boolean equals(Object o) {
      if(this == o) {
        return true;
      }
      if(!(o instanceof Conditional)) {
        return false;
      }
      Conditional other = (Conditional)o;
      return (_condition.equals(other._condition) &&
              _whenTrue.equals(other._whenTrue) &&
              _whenFalse.equals(other._whenFalse));
    }

    @Override
    public int hashCode() {
      return Objects.hash(_condition, _whenTrue, _whenFalse);
    }
  }
}
