package org.hoare.base.util.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hoare.base.util.formula.factory.exceptions.FormulaFormatException;
import org.hoare.base.util.formula.grammar.Formula;
import org.hoare.base.util.hoare.Triple;
import org.hoare.base.util.hoare.exceptions.RuleException;

/**
 * An ordered, append-only sequence of proof lines.
 *
 * Lines are either stated directly (a parsed formula or triple) or derived by applying a rule to earlier lines, which
 * are fetched by index.  A rejected rule application leaves the proof unchanged.
 */
public class Proof
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final List<ProofLine> mLines = new ArrayList<>();

  /**
   * Append a formula.
   *
   * @param xiFormula - the formula.
   * @return the index of the new line.
   */
  public int add(Formula xiFormula)
  {
    return append(ProofLine.of(xiFormula));
  }

  /**
   * Append a triple.
   *
   * @param xiTriple - the triple.
   * @return the index of the new line.
   */
  public int add(Triple xiTriple)
  {
    return append(ProofLine.of(xiTriple));
  }

  /**
   * Parse and append a formula.
   *
   * @param xiFormula - the formula in prefix notation.
   * @return the index of the new line.
   *
   * @throws FormulaFormatException if the formula is malformed.
   */
  public int addFormula(String xiFormula) throws FormulaFormatException
  {
    return add(Formula.parse(xiFormula));
  }

  /**
   * Parse and append a triple.
   *
   * @param xiPrecondition - the precondition in prefix notation.
   * @param xiCommand - the command.
   * @param xiPostcondition - the postcondition in prefix notation.
   * @return the index of the new line.
   *
   * @throws FormulaFormatException if either condition is malformed.
   */
  public int addTriple(String xiPrecondition, String xiCommand, String xiPostcondition)
      throws FormulaFormatException
  {
    return add(Triple.create(xiPrecondition, xiCommand, xiPostcondition));
  }

  /**
   * Apply a rule and append the derived triple.
   *
   * @param xiRule - the rule application.
   * @return the index of the new line.
   *
   * @throws RuleException if the rule rejects its inputs.  Nothing is appended.
   */
  public int apply(RuleApplication xiRule) throws RuleException
  {
    ProofLine lLine;
    try
    {
      lLine = ProofLine.fromRule(xiRule);
    }
    catch (RuleException lEx)
    {
      LOGGER.warn("Rule rejected at line " + mLines.size() + ": " + lEx.getMessage());
      throw lEx;
    }

    return append(lLine);
  }

  /**
   * @return the line at the specified index.
   *
   * @param xiIndex - the index.
   */
  public ProofLine get(int xiIndex)
  {
    if ((xiIndex < 0) || (xiIndex >= mLines.size()))
    {
      throw new IllegalArgumentException("No line " + xiIndex + " in a proof of " + mLines.size() + " line(s)");
    }
    return mLines.get(xiIndex);
  }

  /**
   * @return the formula at the specified index.
   *
   * @param xiIndex - the index of a line holding a formula.
   */
  public Formula getFormula(int xiIndex)
  {
    Formula lFormula = get(xiIndex).asFormula();
    if (lFormula == null)
    {
      throw new IllegalArgumentException("Line " + xiIndex + " holds a triple, not a formula");
    }
    return lFormula;
  }

  /**
   * @return the triple at the specified index.
   *
   * @param xiIndex - the index of a line holding a triple.
   */
  public Triple getTriple(int xiIndex)
  {
    Triple lTriple = get(xiIndex).asTriple();
    if (lTriple == null)
    {
      throw new IllegalArgumentException("Line " + xiIndex + " holds a formula, not a triple");
    }
    return lTriple;
  }

  /**
   * @return the index of the most recently added line.
   */
  public int last()
  {
    if (mLines.isEmpty())
    {
      throw new IllegalStateException("The proof is empty");
    }
    return mLines.size() - 1;
  }

  public int size()
  {
    return mLines.size();
  }

  /**
   * @return a read-only view of the lines.
   */
  public List<ProofLine> getLines()
  {
    return Collections.unmodifiableList(mLines);
  }

  private int append(ProofLine xiLine)
  {
    mLines.add(xiLine);
    LOGGER.debug("Line " + (mLines.size() - 1) + ": " + xiLine);
    return mLines.size() - 1;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();

    for (int lii = 0; lii < mLines.size(); lii++)
    {
      sb.append(lii).append(' ').append(mLines.get(lii)).append('\n');
    }

    return sb.toString();
  }
}
