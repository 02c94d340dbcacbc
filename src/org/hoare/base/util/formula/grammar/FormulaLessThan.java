package org.hoare.base.util.formula.grammar;

/**
 * A <i>less-than</i> comparison, <code>&lt; φ ψ</code>.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
public final class FormulaLessThan extends BinaryFormula
{
  FormulaLessThan(Formula left, Formula right)
  {
    super(left, right);
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.LESS_THAN;
  }
}
