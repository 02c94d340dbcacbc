package org.hoare.base.util.formula.grammar;

/**
 * A formula broken into its kind and the prefix notation of its operands.
 *
 * <ul>
 *   <li>Terms: the first component is the term itself, the second is empty.
 *   <li>Negations: the first component is the negated formula, the second is empty.
 *   <li>Binary connectives: the left and right operands.
 *   <li>Quantifiers: the bound variable name and the body.
 * </ul>
 */
public final class FormulaDecomposition
{
  private final FormulaKind kind;
  private final String      first;
  private final String      second;

  public FormulaDecomposition(FormulaKind kind, String first, String second)
  {
    this.kind = kind;
    this.first = first;
    this.second = second;
  }

  public FormulaKind getKind()
  {
    return kind;
  }

  public String getFirst()
  {
    return first;
  }

  public String getSecond()
  {
    return second;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o)
    {
      return true;
    }

    if (o instanceof FormulaDecomposition)
    {
      FormulaDecomposition other = (FormulaDecomposition)o;
      return kind == other.kind && first.equals(other.first) && second.equals(other.second);
    }

    return false;
  }

  @Override
  public int hashCode()
  {
    return (kind.hashCode() * 31 + first.hashCode()) * 31 + second.hashCode();
  }

  @Override
  public String toString()
  {
    return "[" + kind + ", " + first + ", " + second + "]";
  }
}
