package org.hoare.base.util.hoare.exceptions;

/**
 * The condition rule was given branches whose conditions aren't B and ¬ B.
 */
public final class ConditionMismatchException extends RuleException
{
  private static final long serialVersionUID = 1L;

  private final String mLeftCondition;
  private final String mRightCondition;

  /**
   * @param xiLeftCondition - the first conjunct of the left precondition (B).
   * @param xiRightCondition - the first conjunct of the right precondition, which should have been ¬ B.
   */
  public ConditionMismatchException(String xiLeftCondition, String xiRightCondition)
  {
    super("The input triples do not match\nunnegated: \"" + xiLeftCondition + "\"\nnegated: \"" + xiRightCondition +
          "\"");
    mLeftCondition = xiLeftCondition;
    mRightCondition = xiRightCondition;
  }

  public String getLeftCondition()
  {
    return mLeftCondition;
  }

  public String getRightCondition()
  {
    return mRightCondition;
  }
}
