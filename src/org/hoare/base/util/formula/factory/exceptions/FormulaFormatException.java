package org.hoare.base.util.formula.factory.exceptions;

import org.hoare.base.util.exceptions.HoareLogicException;

/**
 * Thrown when text can't be parsed as a formula in prefix notation.
 */
public final class FormulaFormatException extends HoareLogicException
{
  private static final long serialVersionUID = 1L;

  /**
   * Why the text was rejected.
   */
  public static enum Reason
  {
    /**
     * The tokens ran out while an operator still needed an operand, or a quantifier its bound variable.  Empty input
     * is reported this way too.
     */
    UNEXPECTED_END,

    /**
     * A complete formula was read but tokens remained after it.  Only reported by strict parsers.
     */
    TRAILING_TOKENS,

    /**
     * Operators were nested more deeply than the parser allows.
     */
    TOO_DEEP;
  }

  private final Reason mReason;
  private final String mSource;
  private final int    mTokenIndex;

  /**
   * Create an exception.
   *
   * @param xiReason - why the text was rejected.
   * @param xiSource - the text being parsed.
   * @param xiTokenIndex - the index of the token at which the problem was detected.
   */
  public FormulaFormatException(Reason xiReason, String xiSource, int xiTokenIndex)
  {
    super(describe(xiReason, xiSource, xiTokenIndex));
    mReason = xiReason;
    mSource = xiSource;
    mTokenIndex = xiTokenIndex;
  }

  private static String describe(Reason xiReason, String xiSource, int xiTokenIndex)
  {
    switch (xiReason)
    {
      case UNEXPECTED_END:
        return "Unexpected end of formula after " + xiTokenIndex + " token(s): \"" + xiSource + "\"";
      case TRAILING_TOKENS:
        return "Unexpected trailing tokens from token " + xiTokenIndex + ": \"" + xiSource + "\"";
      case TOO_DEEP:
        return "Formula nested too deeply at token " + xiTokenIndex + ": \"" + xiSource + "\"";
      default:
        return "Malformed formula: \"" + xiSource + "\"";
    }
  }

  public Reason getReason()
  {
    return mReason;
  }

  public String getSource()
  {
    return mSource;
  }

  public int getTokenIndex()
  {
    return mTokenIndex;
  }
}
