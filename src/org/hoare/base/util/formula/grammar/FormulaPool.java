package org.hoare.base.util.formula.grammar;

import org.apache.commons.lang.StringUtils;

/**
 * The only way to construct formula nodes outside this package.
 *
 * Nothing is cached: formula equality is defined by prefix notation, so there's no need to share nodes, and a
 * long-running proof checker doesn't accumulate every term it has ever seen.
 */
public final class FormulaPool
{
  private FormulaPool()
  {
  }

  /**
   * @return the term for the specified token.
   *
   * @param value - a non-empty, whitespace-free token that isn't an operator or quantifier symbol.
   */
  public static FormulaTerm getTerm(String value)
  {
    checkToken(value, "Term");
    if (FormulaKind.forSymbol(value) != null)
    {
      throw new IllegalArgumentException("Term cannot be the reserved symbol '" + value + "'");
    }

    return new FormulaTerm(value);
  }

  public static FormulaNot getNot(Formula body)
  {
    return new FormulaNot(checkNotNull(body));
  }

  public static FormulaAnd getAnd(Formula left, Formula right)
  {
    return new FormulaAnd(checkNotNull(left), checkNotNull(right));
  }

  public static FormulaOr getOr(Formula left, Formula right)
  {
    return new FormulaOr(checkNotNull(left), checkNotNull(right));
  }

  public static FormulaImplies getImplies(Formula antecedent, Formula consequent)
  {
    return new FormulaImplies(checkNotNull(antecedent), checkNotNull(consequent));
  }

  public static FormulaEquals getEquals(Formula left, Formula right)
  {
    return new FormulaEquals(checkNotNull(left), checkNotNull(right));
  }

  public static FormulaLessThan getLessThan(Formula left, Formula right)
  {
    return new FormulaLessThan(checkNotNull(left), checkNotNull(right));
  }

  public static FormulaForAll getForAll(String variable, Formula body)
  {
    checkToken(variable, "Bound variable");
    return new FormulaForAll(variable, checkNotNull(body));
  }

  public static FormulaExists getExists(String variable, Formula body)
  {
    checkToken(variable, "Bound variable");
    return new FormulaExists(variable, checkNotNull(body));
  }

  /**
   * @return a binary formula of the specified kind.
   *
   * @param kind - one of the binary connective kinds.
   * @param left - the left operand.
   * @param right - the right operand.
   */
  public static BinaryFormula getBinary(FormulaKind kind, Formula left, Formula right)
  {
    switch (kind)
    {
      case CONJUNCTION:
        return getAnd(left, right);
      case DISJUNCTION:
        return getOr(left, right);
      case IMPLICATION:
        return getImplies(left, right);
      case EQUIVALENCE:
        return getEquals(left, right);
      case LESS_THAN:
        return getLessThan(left, right);
      default:
        throw new IllegalArgumentException(kind + " is not a binary connective");
    }
  }

  /**
   * @return a quantified formula of the specified kind.
   *
   * @param kind - one of the quantifier kinds.
   * @param variable - the bound variable name.
   * @param body - the quantified formula.
   */
  public static QuantifiedFormula getQuantified(FormulaKind kind, String variable, Formula body)
  {
    switch (kind)
    {
      case UNIVERSAL_QUANTIFIER:
        return getForAll(variable, body);
      case EXISTENTIAL_QUANTIFIER:
        return getExists(variable, body);
      default:
        throw new IllegalArgumentException(kind + " is not a quantifier");
    }
  }

  private static Formula checkNotNull(Formula formula)
  {
    if (formula == null)
    {
      throw new IllegalArgumentException("Operand must not be null");
    }
    return formula;
  }

  private static void checkToken(String token, String what)
  {
    if ((token == null) || token.isEmpty())
    {
      throw new IllegalArgumentException(what + " must not be empty");
    }

    if (StringUtils.containsAny(token, Formula.WHITESPACE))
    {
      throw new IllegalArgumentException(what + " '" + token + "' contains whitespace");
    }
  }
}
