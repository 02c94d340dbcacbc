package org.hoare.base.util.formula.grammar;

import org.hoare.base.util.formula.factory.FormulaParser;
import org.hoare.base.util.formula.factory.exceptions.FormulaFormatException;

/**
 * Class at the root of the formula hierarchy.  Every first-order formula that appears in a Hoare triple or a proof is
 * represented by an object that is part of this hierarchy.
 *
 * <h1>The formula hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Term</b>: An opaque, whitespace-free token.  It may be a variable (<code>x</code>), a constant
 *     (<code>43</code>) or a function application (<code>fact(count-1)</code>).  The parser never inspects the
 *     structure of a term.
 *
 * <li><b>Not</b>: A negated <i>formula</i>, written <code>¬ φ</code>.
 *
 * <li><b>Binary connectives</b>: Two <i>formulae</i> joined by a connective.<ul>
 *   <li><code>∧ φ ψ</code> - conjunction.
 *   <li><code>∨ φ ψ</code> - disjunction.
 *   <li><code>→ φ ψ</code> - implication.
 *   <li><code>= φ ψ</code> - equivalence (also used for equality of terms).
 *   <li><code>&lt; φ ψ</code> - less-than.</ul>
 *
 * <li><b>Quantifiers</b>: A bound variable name (a plain string, not a formula) and a body.<ul>
 *   <li><code>∀ x φ</code> - universal quantification.
 *   <li><code>∃ x φ</code> - existential quantification.</ul>
 *
 * </ul>
 *
 * <h1>Textual forms</h1>
 *
 * The canonical form of a formula is its <i>prefix notation</i>: the operator first, followed by its operands, every
 * token separated by a single space.  Parsing the prefix notation of any formula yields an equal formula.
 *
 * <p>The <i>infix notation</i> is for display only.  Every connective is parenthesised, so no precedence rules are
 * needed to read it.  Negation renders as <code>(¬φ)</code> and quantifiers as <code>∀x(φ)</code>.
 *
 * <h1>Worked example</h1>
 *
 * <p><pre>{@code
 * ∧ ∀ x → P(x) ∧ Q(x) ∃ y ∨ R(y) S(y) = ¬ T(x) < U V}</pre>
 *
 * <ul>
 *   <li>The whole thing is a conjunction.
 *   <ul>
 *     <li><code>∀ x → P(x) ∧ Q(x) ∃ y ∨ R(y) S(y)</code> is the first conjunct, a universal quantifier binding
 *         <code>x</code>.
 *     <li><code>= ¬ T(x) &lt; U V</code> is the second conjunct, an equivalence between the negated term
 *         <code>T(x)</code> and the comparison <code>U &lt; V</code>.
 *   </ul>
 * </ul>
 *
 * Its infix notation is <code>(∀x((P(x)→(Q(x)∧∃y((R(y)∨S(y))))))∧((¬T(x))=(U&lt;V)))</code>.
 *
 * <p>Formulae are immutable.  Equality is structural and is defined by the prefix notation.
 */
public abstract class Formula
{
  /**
   * Characters that separate tokens: the Unicode White_Space set, including the no-break spaces.
   */
  public static final String WHITESPACE = "\t\n\u000B\f\r \u0085\u00A0\u1680" +
                                          "\u2000\u2001\u2002\u2003\u2004\u2005\u2006\u2007\u2008\u2009\u200A" +
                                          "\u2028\u2029\u202F\u205F\u3000";

  private String prefixNotation;

  /**
   * Parse a formula written in prefix notation, using the configured parser settings.
   *
   * @param text - whitespace-separated tokens.
   * @return the formula.
   *
   * @throws FormulaFormatException if the text is not a well-formed formula.
   */
  public static Formula parse(String text) throws FormulaFormatException
  {
    return FormulaParser.fromConfiguration().parse(text);
  }

  /**
   * @return which variant of the hierarchy this formula is.
   */
  public abstract FormulaKind getKind();

  /**
   * @return the formula split into its kind and the prefix notation of its operands.  For quantifiers the first
   *         component is the bound variable name.  Components that don't exist are empty strings.
   */
  public abstract FormulaDecomposition decompose();

  abstract void appendPrefix(StringBuilder sb);

  abstract void appendInfix(StringBuilder sb);

  /**
   * @return the canonical prefix notation of this formula.
   */
  public final String toPrefixNotation()
  {
    if (prefixNotation == null)
    {
      StringBuilder sb = new StringBuilder();
      appendPrefix(sb);
      prefixNotation = sb.toString();
    }

    return prefixNotation;
  }

  /**
   * @return the fully parenthesised infix rendering of this formula.
   */
  public final String toInfixNotation()
  {
    StringBuilder sb = new StringBuilder();
    appendInfix(sb);
    return sb.toString();
  }

  @Override
  public final boolean equals(Object o)
  {
    if (this == o)
    {
      return true;
    }

    if (o instanceof Formula)
    {
      return toPrefixNotation().equals(((Formula)o).toPrefixNotation());
    }

    return false;
  }

  @Override
  public final int hashCode()
  {
    return toPrefixNotation().hashCode();
  }

  @Override
  public String toString()
  {
    return toInfixNotation();
  }
}
