package org.hoare.base.util.hoare.exceptions;

/**
 * The consequent of the left implication given to the consequence rule isn't the triple's precondition.
 */
public final class PreconditionMismatchException extends RuleException
{
  private static final long serialVersionUID = 1L;

  private final String mExpected;
  private final String mActual;

  public PreconditionMismatchException(String xiExpected, String xiActual)
  {
    super("The preconditions do not match\nexpected: \"" + xiExpected + "\"\nactual: \"" + xiActual + "\"");
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
