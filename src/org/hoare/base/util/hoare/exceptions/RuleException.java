package org.hoare.base.util.hoare.exceptions;

import org.hoare.base.util.exceptions.HoareLogicException;

/**
 * Abstract class for exceptions thrown when the inputs to an inference rule don't have the shape the rule requires.
 * Each subclass names the check that failed and carries the prefix notation of the formulae that didn't match.
 */
public abstract class RuleException extends HoareLogicException
{
  private static final long serialVersionUID = 1L;

  protected RuleException(String message)
  {
    super(message);
  }
}
