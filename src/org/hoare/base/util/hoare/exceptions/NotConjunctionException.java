package org.hoare.base.util.hoare.exceptions;

import org.hoare.base.util.formula.grammar.FormulaKind;

/**
 * A rule needed a precondition of the form <code>∧ φ ψ</code> and got something else.
 */
public final class NotConjunctionException extends RuleException
{
  private static final long serialVersionUID = 1L;

  private final String      mFormula;
  private final FormulaKind mKind;

  public NotConjunctionException(String xiFormula, FormulaKind xiKind)
  {
    super("The precondition \"" + xiFormula + "\" is not a Conjunction type Formula. Type: " + xiKind);
    mFormula = xiFormula;
    mKind = xiKind;
  }

  public String getFormula()
  {
    return mFormula;
  }

  public FormulaKind getKind()
  {
    return mKind;
  }
}
