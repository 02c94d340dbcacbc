package org.hoare.base.util.formula.grammar;

/**
 * The universal quantifier.
 */
public final class FormulaForAll extends QuantifiedFormula
{
  FormulaForAll(String variable, Formula body)
  {
    super(variable, body);
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.UNIVERSAL_QUANTIFIER;
  }
}
