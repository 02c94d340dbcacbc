package org.hoare.base.util.formula.grammar;

/**
 * A <i>conjunction</i>, <code>∧ φ ψ</code>.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
public final class FormulaAnd extends BinaryFormula
{
  FormulaAnd(Formula left, Formula right)
  {
    super(left, right);
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.CONJUNCTION;
  }
}
