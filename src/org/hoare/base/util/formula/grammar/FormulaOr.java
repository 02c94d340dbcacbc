package org.hoare.base.util.formula.grammar;

/**
 * A <i>disjunction</i>, <code>∨ φ ψ</code>.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
public final class FormulaOr extends BinaryFormula
{
  FormulaOr(Formula left, Formula right)
  {
    super(left, right);
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.DISJUNCTION;
  }
}
