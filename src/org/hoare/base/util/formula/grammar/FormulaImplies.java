package org.hoare.base.util.formula.grammar;

/**
 * An <i>implication</i>, <code>→ φ ψ</code>.  The left operand is the antecedent and the right operand the consequent.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
public final class FormulaImplies extends BinaryFormula
{
  FormulaImplies(Formula left, Formula right)
  {
    super(left, right);
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.IMPLICATION;
  }
}
