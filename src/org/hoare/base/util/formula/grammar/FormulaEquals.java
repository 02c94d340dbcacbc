package org.hoare.base.util.formula.grammar;

/**
 * An <i>equivalence</i>, <code>= φ ψ</code>.  Also used to state that two terms are equal.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
public final class FormulaEquals extends BinaryFormula
{
  FormulaEquals(Formula left, Formula right)
  {
    super(left, right);
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.EQUIVALENCE;
  }
}
