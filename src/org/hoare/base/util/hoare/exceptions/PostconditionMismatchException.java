package org.hoare.base.util.hoare.exceptions;

/**
 * A postcondition didn't match the formula it is required to equal.  Raised by the condition rule (the two branch
 * postconditions differ) and by the consequence rule (the antecedent of the right implication isn't the triple's
 * postcondition).
 */
public final class PostconditionMismatchException extends RuleException
{
  private static final long serialVersionUID = 1L;

  private final String mExpected;
  private final String mActual;

  public PostconditionMismatchException(String xiExpected, String xiActual)
  {
    super("The postconditions do not match\nexpected: \"" + xiExpected + "\"\nactual: \"" + xiActual + "\"");
    mExpected = xiExpected;
    mActual = xiActual;
  }

  public String getExpected()
  {
    return mExpected;
  }

  public String getActual()
  {
    return mActual;
  }
}
