package org.hoare.base.util.exceptions;

/**
 * Abstract class for exceptions that are a result of malformed formulae or of unsound proof steps.
 */
public abstract class HoareLogicException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected HoareLogicException(String message)
  {
    super(message);
  }
}
