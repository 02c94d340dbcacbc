package org.hoare.base.util.hoare.exceptions;

/**
 * The while rule was given a loop body whose postcondition isn't the invariant from its precondition.
 */
public final class InvariantNotPreservedException extends RuleException
{
  private static final long serialVersionUID = 1L;

  private final String mInvariant;
  private final String mPostcondition;

  public InvariantNotPreservedException(String xiInvariant, String xiPostcondition)
  {
    super("The loop invariant is not preserved\nprecondition (P∧B): \"" + xiInvariant + "\", postcondition (P): \"" +
          xiPostcondition + "\"");
    mInvariant = xiInvariant;
    mPostcondition = xiPostcondition;
  }

  public String getInvariant()
  {
    return mInvariant;
  }

  public String getPostcondition()
  {
    return mPostcondition;
  }
}
