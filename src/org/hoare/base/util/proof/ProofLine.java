package org.hoare.base.util.proof;

import org.hoare.base.util.formula.grammar.Formula;
import org.hoare.base.util.hoare.Triple;
import org.hoare.base.util.hoare.exceptions.RuleException;

/**
 * One step of a proof.  A line holds either a formula (typically a lemma used by the consequence rule) or a triple.
 */
public final class ProofLine
{
  private final Formula formula;
  private final Triple  triple;

  private ProofLine(Formula formula, Triple triple)
  {
    this.formula = formula;
    this.triple = triple;
  }

  public static ProofLine of(Formula formula)
  {
    if (formula == null)
    {
      throw new IllegalArgumentException("Formula must not be null");
    }
    return new ProofLine(formula, null);
  }

  public static ProofLine of(Triple triple)
  {
    if (triple == null)
    {
      throw new IllegalArgumentException("Triple must not be null");
    }
    return new ProofLine(null, triple);
  }

  /**
   * Apply a rule and wrap the derived triple in a line.
   *
   * @param rule - the rule application.
   * @return a line holding the derived triple.
   *
   * @throws RuleException, unchanged, if the rule rejects its inputs.
   */
  public static ProofLine fromRule(RuleApplication rule) throws RuleException
  {
    return of(rule.apply());
  }

  public boolean isFormula()
  {
    return formula != null;
  }

  public boolean isTriple()
  {
    return triple != null;
  }

  /**
   * @return the formula held by this line, or null if it holds a triple.
   */
  public Formula asFormula()
  {
    return formula;
  }

  /**
   * @return the triple held by this line, or null if it holds a formula.
   */
  public Triple asTriple()
  {
    return triple;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o)
    {
      return true;
    }

    if (o instanceof ProofLine)
    {
      ProofLine other = (ProofLine)o;
      return isFormula() ? formula.equals(other.formula) : triple.equals(other.triple);
    }

    return false;
  }

  @Override
  public int hashCode()
  {
    return isFormula() ? formula.hashCode() : triple.hashCode();
  }

  @Override
  public String toString()
  {
    return isFormula() ? formula.toString() : triple.toString();
  }
}
