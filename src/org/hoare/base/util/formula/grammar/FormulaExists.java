package org.hoare.base.util.formula.grammar;

/**
 * The existential quantifier.
 */
public final class FormulaExists extends QuantifiedFormula
{
  FormulaExists(String variable, Formula body)
  {
    super(variable, body);
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.EXISTENTIAL_QUANTIFIER;
  }
}
