package org.hoare.base.util.formula.grammar;

/**
 * A <i>term</i> is a single whitespace-free token: a variable, a constant or a function application such as
 * <code>fact(count-1)</code>.  Its contents are opaque.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
public final class FormulaTerm extends Formula
{

  private final String value;

  FormulaTerm(String value)
  {
    this.value = value;
  }

  public String getValue()
  {
    return value;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.TERM;
  }

  @Override
  public FormulaDecomposition decompose()
  {
    return new FormulaDecomposition(FormulaKind.TERM, value, "");
  }

  @Override
  void appendPrefix(StringBuilder sb)
  {
    sb.append(value);
  }

  @Override
  void appendInfix(StringBuilder sb)
  {
    sb.append(value);
  }

}
