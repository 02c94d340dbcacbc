package org.hoare.base.util.formula.factory;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.hoare.base.util.configuration.HoareConfiguration;
import org.hoare.base.util.configuration.HoareConfiguration.CfgItem;
import org.hoare.base.util.formula.factory.exceptions.FormulaFormatException;
import org.hoare.base.util.formula.factory.exceptions.FormulaFormatException.Reason;
import org.hoare.base.util.formula.grammar.Formula;
import org.hoare.base.util.formula.grammar.FormulaKind;
import org.hoare.base.util.formula.grammar.FormulaPool;

/**
 * Recursive-descent parser for formulae in prefix notation.
 * <p>
 * Grammar:
 * <pre>
 *  Formula: Term | '¬' Formula | BinOp Formula Formula | Quantifier Variable Formula
 *  BinOp: '∧' | '∨' | '→' | '=' | '&lt;'
 *  Quantifier: '∀' | '∃'
 *  Variable: any token
 *  Term: any other token
 * </pre>
 * Tokens are separated by whitespace (any character in {@link Formula#WHITESPACE}), so every operator, quantifier,
 * variable and term must be written as a token of its own.  A term can't contain whitespace.
 *
 * <p>Parsers are stateless and may be shared.
 */
public final class FormulaParser
{
  private final boolean mStrict;
  private final int     mMaxDepth;

  /**
   * Create a parser.
   *
   * @param xiStrict - whether tokens left over after a complete formula are an error.
   * @param xiMaxDepth - maximum nesting depth accepted.
   */
  public FormulaParser(boolean xiStrict, int xiMaxDepth)
  {
    if (xiMaxDepth < 1)
    {
      throw new IllegalArgumentException("Maximum depth must be greater than 0");
    }

    mStrict = xiStrict;
    mMaxDepth = xiMaxDepth;
  }

  /**
   * @return a parser with the configured settings.
   */
  public static FormulaParser fromConfiguration()
  {
    return new FormulaParser(HoareConfiguration.getCfgBool(CfgItem.STRICT_PARSING),
                             HoareConfiguration.getCfgInt(CfgItem.MAX_FORMULA_DEPTH));
  }

  public boolean isStrict()
  {
    return mStrict;
  }

  public int getMaxDepth()
  {
    return mMaxDepth;
  }

  /**
   * Parse a formula.
   *
   * @param xiText - the formula in prefix notation.
   * @return the formula.
   *
   * @throws FormulaFormatException if the text is not a well-formed formula.
   */
  public Formula parse(String xiText) throws FormulaFormatException
  {
    if (xiText == null)
    {
      throw new IllegalArgumentException("Formula text must not be null");
    }

    TokenStream lTokens = new TokenStream(xiText, tokenize(xiText));
    Formula lFormula = parseFormula(lTokens, 1);

    if (mStrict && lTokens.hasNext())
    {
      throw new FormulaFormatException(Reason.TRAILING_TOKENS, xiText, lTokens.position());
    }

    return lFormula;
  }

  private Formula parseFormula(TokenStream xiTokens, int xiDepth) throws FormulaFormatException
  {
    if (xiDepth > mMaxDepth)
    {
      throw new FormulaFormatException(Reason.TOO_DEEP, xiTokens.getSource(), xiTokens.position());
    }

    String lToken = xiTokens.next();
    FormulaKind lKind = FormulaKind.forSymbol(lToken);

    if (lKind == null)
    {
      return FormulaPool.getTerm(lToken);
    }

    switch (lKind)
    {
      case NEGATION:
        return FormulaPool.getNot(parseFormula(xiTokens, xiDepth + 1));

      case UNIVERSAL_QUANTIFIER:
      case EXISTENTIAL_QUANTIFIER:
        // The bound variable is taken verbatim, even if it looks like an operator.
        String lVariable = xiTokens.next();
        return FormulaPool.getQuantified(lKind, lVariable, parseFormula(xiTokens, xiDepth + 1));

      default:
        Formula lLeft = parseFormula(xiTokens, xiDepth + 1);
        Formula lRight = parseFormula(xiTokens, xiDepth + 1);
        return FormulaPool.getBinary(lKind, lLeft, lRight);
    }
  }

  /**
   * @return the whitespace-separated tokens of the specified text.
   *
   * @param xiText - the text.
   */
  public static List<String> tokenize(String xiText)
  {
    return Arrays.asList(StringUtils.split(xiText, Formula.WHITESPACE));
  }

  /**
   * Cursor over the tokens of a single parse.
   */
  private static class TokenStream
  {
    private final String       mSource;
    private final List<String> mTokens;
    private int                mPosition;

    TokenStream(String xiSource, List<String> xiTokens)
    {
      mSource = xiSource;
      mTokens = xiTokens;
      mPosition = 0;
    }

    String getSource()
    {
      return mSource;
    }

    int position()
    {
      return mPosition;
    }

    boolean hasNext()
    {
      return mPosition < mTokens.size();
    }

    String next() throws FormulaFormatException
    {
      if (!hasNext())
      {
        throw new FormulaFormatException(Reason.UNEXPECTED_END, mSource, mPosition);
      }

      return mTokens.get(mPosition++);
    }
  }
}
