package org.hoare.base.util.hoare.exceptions;

import org.hoare.base.util.formula.grammar.FormulaKind;

/**
 * The consequence rule was given a strengthening or weakening formula that isn't an implication.
 */
public final class NotImplicationException extends RuleException
{
  private static final long serialVersionUID = 1L;

  /**
   * Which of the two formulae given to the consequence rule was wrong.
   */
  public static enum Side
  {
    /**
     * The formula that strengthens the precondition.
     */
    LEFT,

    /**
     * The formula that weakens the postcondition.
     */
    RIGHT;
  }

  private final Side        mSide;
  private final String      mFormula;
  private final FormulaKind mKind;

  public NotImplicationException(Side xiSide, String xiFormula, FormulaKind xiKind)
  {
    super("The " + xiSide.toString().toLowerCase() + " formula \"" + xiFormula +
          "\" is not an Implication type Formula. Type: " + xiKind);
    mSide = xiSide;
    mFormula = xiFormula;
    mKind = xiKind;
  }

  public Side getSide()
  {
    return mSide;
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
