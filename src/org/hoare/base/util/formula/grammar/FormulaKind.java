package org.hoare.base.util.formula.grammar;

/**
 * The variants of the formula hierarchy.
 */
public enum FormulaKind
{
  /**
   * An opaque atomic token.
   */
  TERM("Term", null),

  /**
   * <code>¬ φ</code>
   */
  NEGATION("Negation", "¬"),

  /**
   * <code>∧ φ ψ</code>
   */
  CONJUNCTION("Conjunction", "∧"),

  /**
   * <code>∨ φ ψ</code>
   */
  DISJUNCTION("Disjunction", "∨"),

  /**
   * <code>→ φ ψ</code>
   */
  IMPLICATION("Implication", "→"),

  /**
   * <code>= φ ψ</code>
   */
  EQUIVALENCE("Equivalence", "="),

  /**
   * <code>&lt; φ ψ</code>
   */
  LESS_THAN("LessThan", "<"),

  /**
   * <code>∀ x φ</code>
   */
  UNIVERSAL_QUANTIFIER("UniversalQuantifier", "∀"),

  /**
   * <code>∃ x φ</code>
   */
  EXISTENTIAL_QUANTIFIER("ExistentialQuantifier", "∃");

  private final String mName;
  private final String mSymbol;

  private FormulaKind(String xiName, String xiSymbol)
  {
    mName = xiName;
    mSymbol = xiSymbol;
  }

  /**
   * @return the token that introduces this kind of formula in prefix notation, or null for a term.
   */
  public String getSymbol()
  {
    return mSymbol;
  }

  /**
   * @return the kind introduced by the specified token, or null if the token is an atomic term.
   *
   * @param xiToken - the token.
   */
  public static FormulaKind forSymbol(String xiToken)
  {
    for (FormulaKind lKind : values())
    {
      if (xiToken.equals(lKind.mSymbol))
      {
        return lKind;
      }
    }

    return null;
  }

  @Override
  public String toString()
  {
    return mName;
  }
}
