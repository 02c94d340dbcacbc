package org.hoare.base.util.formula.grammar;

/**
 * A quantifier binding a variable name over a body <i>formula</i>.  The bound variable is a plain string, not a
 * formula, and is taken verbatim from the token that follows the quantifier symbol.
 *
 * See {@link Formula} for a complete description of the formula hierarchy.
 */
public abstract class QuantifiedFormula extends Formula
{

  private final String  variable;
  private final Formula body;

  QuantifiedFormula(String variable, Formula body)
  {
    this.variable = variable;
    this.body = body;
  }

  public String getVariable()
  {
    return variable;
  }

  public Formula getBody()
  {
    return body;
  }

  @Override
  public FormulaDecomposition decompose()
  {
    return new FormulaDecomposition(getKind(), variable, body.toPrefixNotation());
  }

  @Override
  void appendPrefix(StringBuilder sb)
  {
    sb.append(getKind().getSymbol()).append(' ').append(variable).append(' ');
    body.appendPrefix(sb);
  }

  @Override
  void appendInfix(StringBuilder sb)
  {
    sb.append(getKind().getSymbol()).append(variable).append('(');
    body.appendInfix(sb);
    sb.append(')');
  }

}
