package org.hoare.base.util.hoare;

import org.hoare.base.util.formula.factory.exceptions.FormulaFormatException;
import org.hoare.base.util.formula.grammar.Formula;

/**
 * A Hoare triple <code>{P} C {Q}</code>: if the precondition P holds before the command C runs, the postcondition Q
 * holds after it.
 *
 * The command is free text and is never parsed.  Triples are immutable and two triples are equal if their
 * preconditions, commands and postconditions are all equal.
 */
public final class Triple
{
  private final Formula precondition;
  private final String  command;
  private final Formula postcondition;

  /**
   * Create a triple from formulae that have already been parsed.
   *
   * @param precondition - P.
   * @param command - C.
   * @param postcondition - Q.
   */
  public Triple(Formula precondition, String command, Formula postcondition)
  {
    if ((precondition == null) || (command == null) || (postcondition == null))
    {
      throw new IllegalArgumentException("Triple components must not be null");
    }

    this.precondition = precondition;
    this.command = command;
    this.postcondition = postcondition;
  }

  /**
   * Create a triple, parsing its conditions from prefix notation.
   *
   * @param precondition - P, in prefix notation.
   * @param command - C.
   * @param postcondition - Q, in prefix notation.
   * @return the triple.
   *
   * @throws FormulaFormatException if either condition is malformed.
   */
  public static Triple create(String precondition, String command, String postcondition)
      throws FormulaFormatException
  {
    return new Triple(Formula.parse(precondition), command, Formula.parse(postcondition));
  }

  public Formula getPrecondition()
  {
    return precondition;
  }

  public String getCommand()
  {
    return command;
  }

  public Formula getPostcondition()
  {
    return postcondition;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o)
    {
      return true;
    }

    if (o instanceof Triple)
    {
      Triple other = (Triple)o;
      return precondition.equals(other.precondition) &&
             command.equals(other.command) &&
             postcondition.equals(other.postcondition);
    }

    return false;
  }

  @Override
  public int hashCode()
  {
    return (precondition.hashCode() * 31 + command.hashCode()) * 31 + postcondition.hashCode();
  }

  @Override
  public String toString()
  {
    return "{" + precondition + "} " + command + " {" + postcondition + "}";
  }
}
