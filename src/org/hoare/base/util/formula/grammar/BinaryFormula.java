package org.hoare.base.util.formula.grammar;

/**
 * A binary connective joining two <i>formulae</i>.  The connective is determined by the concrete subclass.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
public abstract class BinaryFormula extends Formula
{

  private final Formula left;
  private final Formula right;

  BinaryFormula(Formula left, Formula right)
  {
    this.left = left;
    this.right = right;
  }

  public Formula getLeft()
  {
    return left;
  }

  public Formula getRight()
  {
    return right;
  }

  @Override
  public FormulaDecomposition decompose()
  {
    return new FormulaDecomposition(getKind(), left.toPrefixNotation(), right.toPrefixNotation());
  }

  @Override
  void appendPrefix(StringBuilder sb)
  {
    sb.append(getKind().getSymbol()).append(' ');
    left.appendPrefix(sb);
    sb.append(' ');
    right.appendPrefix(sb);
  }

  @Override
  void appendInfix(StringBuilder sb)
  {
    sb.append('(');
    left.appendInfix(sb);
    sb.append(getKind().getSymbol());
    right.appendInfix(sb);
    sb.append(')');
  }

}
