package org.hoare.base.util.formula.grammar;

/**
 * A <i>not</i> is a negated <i>formula</i>.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
public final class FormulaNot extends Formula
{

  private final Formula body;

  FormulaNot(Formula body)
  {
    this.body = body;
  }

  public Formula getBody()
  {
    return body;
  }

  @Override
  public FormulaKind getKind()
  {
    return FormulaKind.NEGATION;
  }

  @Override
  public FormulaDecomposition decompose()
  {
    return new FormulaDecomposition(FormulaKind.NEGATION, body.toPrefixNotation(), "");
  }

  @Override
  void appendPrefix(StringBuilder sb)
  {
    sb.append("¬ ");
    body.appendPrefix(sb);
  }

  @Override
  void appendInfix(StringBuilder sb)
  {
    sb.append("(¬");
    body.appendInfix(sb);
    sb.append(")");
  }

}
