package org.hoare.base.util.hoare.exceptions;

/**
 * Composition was attempted on triples where the first postcondition isn't the second precondition.
 */
public final class MidconditionMismatchException extends RuleException
{
  private static final long serialVersionUID = 1L;

  private final String mLeftPostcondition;
  private final String mRightPrecondition;

  public MidconditionMismatchException(String xiLeftPostcondition, String xiRightPrecondition)
  {
    super("The input triples do not have matching midcondition\nleft postcondition: \"" + xiLeftPostcondition +
          "\"\nright precondition: \"" + xiRightPrecondition + "\"");
    mLeftPostcondition = xiLeftPostcondition;
    mRightPrecondition = xiRightPrecondition;
  }

  public String getLeftPostcondition()
  {
    return mLeftPostcondition;
  }

  public String getRightPrecondition()
  {
    return mRightPrecondition;
  }
}
