package org.hoare.base.util.hoare;

import java.util.HashSet;
import java.util.Set;

import org.hoare.base.util.formula.grammar.BinaryFormula;
import org.hoare.base.util.formula.grammar.Formula;
import org.hoare.base.util.formula.grammar.FormulaAnd;
import org.hoare.base.util.formula.grammar.FormulaImplies;
import org.hoare.base.util.formula.grammar.FormulaNot;
import org.hoare.base.util.formula.grammar.FormulaPool;
import org.hoare.base.util.formula.grammar.FormulaTerm;
import org.hoare.base.util.formula.grammar.QuantifiedFormula;
import org.hoare.base.util.hoare.exceptions.ConditionMismatchException;
import org.hoare.base.util.hoare.exceptions.InvariantNotPreservedException;
import org.hoare.base.util.hoare.exceptions.MidconditionMismatchException;
import org.hoare.base.util.hoare.exceptions.NotConjunctionException;
import org.hoare.base.util.hoare.exceptions.NotImplicationException;
import org.hoare.base.util.hoare.exceptions.NotImplicationException.Side;
import org.hoare.base.util.hoare.exceptions.PostconditionMismatchException;
import org.hoare.base.util.hoare.exceptions.PreconditionMismatchException;

/**
 * The axioms and inference rules of Hoare logic.
 *
 * Every rule checks that its inputs have exactly the shape it requires and then builds the derived triple.  Nothing
 * is normalised or proved along the way: formulae match only if they are structurally equal.  The inputs are never
 * modified.
 */
public final class HoareRules
{
  /**
   * Command text of the empty statement.
   */
  public static final String SKIP = "skip";

  /**
   * Symbol separating the variable and the expression in an assignment.
   */
  public static final String ASSIGN = "≔";

  private HoareRules()
  {
  }

  /**
   * Empty statement axiom: <code>{P} skip {P}</code>.
   *
   * @param xiCondition - P.
   * @return the axiom instance.
   */
  public static Triple emptyStatementAxiom(Formula xiCondition)
  {
    return new Triple(xiCondition, SKIP, xiCondition);
  }

  /**
   * Assignment axiom: <code>{Q[E/x]} x≔E {Q}</code>.
   *
   * Every free occurrence of <code>x</code> is replaced by <code>E</code>.  An occurrence under a quantifier that
   * binds <code>x</code> isn't free and is left alone.
   *
   * Two postconditions can't be substituted into soundly, and are rejected:
   * <ul>
   *   <li>a free <code>x</code> sits under a quantifier binding an identifier used by <code>E</code>, which would
   *       capture it;
   *   <li>a free term other than <code>x</code> itself mentions <code>x</code>, such as <code>f(x)</code>.  Terms are
   *       opaque, so it can't be rewritten.
   * </ul>
   *
   * @param xiPostcondition - Q.
   * @param xiVariable - x, a single identifier.
   * @param xiExpression - E, a single whitespace-free token.
   * @return the axiom instance.
   *
   * @throws IllegalArgumentException if the substitution can't be done soundly.
   */
  public static Triple assignmentAxiom(Formula xiPostcondition, String xiVariable, String xiExpression)
  {
    FormulaTerm lVariable = FormulaPool.getTerm(xiVariable);
    FormulaTerm lExpression = FormulaPool.getTerm(xiExpression);

    Set<String> lVariableIdentifiers = identifiers(xiVariable);
    if ((lVariableIdentifiers.size() != 1) || !lVariableIdentifiers.contains(xiVariable))
    {
      throw new IllegalArgumentException("Assigned variable '" + xiVariable + "' is not an identifier");
    }

    return new Triple(substitute(xiPostcondition, lVariable, lExpression, new HashSet<String>()),
                      xiVariable + ASSIGN + xiExpression,
                      xiPostcondition);
  }

  /**
   * Rule of composition.
   *
   * <pre>
   *  {P} S {Q}   {Q} T {R}
   *  ---------------------
   *      {P} S;T {R}
   * </pre>
   *
   * @param xiLeft - the triple executed first.
   * @param xiRight - the triple executed second.
   * @return the composed triple.
   *
   * @throws MidconditionMismatchException if the postcondition of the left triple isn't the precondition of the right.
   */
  public static Triple compose(Triple xiLeft, Triple xiRight) throws MidconditionMismatchException
  {
    if (!xiLeft.getPostcondition().equals(xiRight.getPrecondition()))
    {
      throw new MidconditionMismatchException(xiLeft.getPostcondition().toPrefixNotation(),
                                              xiRight.getPrecondition().toPrefixNotation());
    }

    return new Triple(xiLeft.getPrecondition(),
                      xiLeft.getCommand() + ";" + xiRight.getCommand(),
                      xiRight.getPostcondition());
  }

  /**
   * Conditional rule.
   *
   * <pre>
   *  {B ∧ P} S {Q}   {¬B ∧ P} T {Q}
   *  ------------------------------
   *  {P} if B then S else T endif {Q}
   * </pre>
   *
   * The condition B is the first conjunct of each precondition, and is rendered into the command in prefix notation.
   * The precondition of the result is the second conjunct of the left precondition.
   *
   * @param xiLeft - the branch taken when B holds.
   * @param xiRight - the branch taken when B doesn't hold.
   * @return the conditional triple.
   *
   * @throws NotConjunctionException if either precondition isn't a conjunction.
   * @throws ConditionMismatchException if the right condition isn't exactly the negation of the left condition.
   * @throws PostconditionMismatchException if the two postconditions differ.
   */
  public static Triple condition(Triple xiLeft, Triple xiRight)
      throws NotConjunctionException, ConditionMismatchException, PostconditionMismatchException
  {
    FormulaAnd lLeftPre = requireConjunction(xiLeft.getPrecondition());
    FormulaAnd lRightPre = requireConjunction(xiRight.getPrecondition());

    Formula lCondition = lLeftPre.getLeft();
    Formula lNegatedCondition = lRightPre.getLeft();

    // Strip exactly one negation node from the right-hand condition.
    if (!(lNegatedCondition instanceof FormulaNot) ||
        !((FormulaNot)lNegatedCondition).getBody().equals(lCondition))
    {
      throw new ConditionMismatchException(lCondition.toPrefixNotation(), lNegatedCondition.toPrefixNotation());
    }

    if (!xiLeft.getPostcondition().equals(xiRight.getPostcondition()))
    {
      throw new PostconditionMismatchException(xiLeft.getPostcondition().toPrefixNotation(),
                                               xiRight.getPostcondition().toPrefixNotation());
    }

    return new Triple(lLeftPre.getRight(),
                      "if " + lCondition.toPrefixNotation() + " then " + xiLeft.getCommand() +
                          " else " + xiRight.getCommand() + " endif",
                      xiLeft.getPostcondition());
  }

  /**
   * Consequence rule.
   *
   * <pre>
   *  P1 → P2   {P2} S {Q2}   Q2 → Q1
   *  -------------------------------
   *           {P1} S {Q1}
   * </pre>
   *
   * @param xiStrengthen - P1 → P2.
   * @param xiMiddle - {P2} S {Q2}.
   * @param xiWeaken - Q2 → Q1.
   * @return {P1} S {Q1}.
   *
   * @throws NotImplicationException if either formula isn't an implication.
   * @throws PreconditionMismatchException if P2 isn't the precondition of the middle triple.
   * @throws PostconditionMismatchException if Q2 isn't the postcondition of the middle triple.
   */
  public static Triple consequence(Formula xiStrengthen, Triple xiMiddle, Formula xiWeaken)
      throws NotImplicationException, PreconditionMismatchException, PostconditionMismatchException
  {
    FormulaImplies lStrengthen = requireImplication(xiStrengthen, Side.LEFT);
    FormulaImplies lWeaken = requireImplication(xiWeaken, Side.RIGHT);

    if (!lStrengthen.getRight().equals(xiMiddle.getPrecondition()))
    {
      throw new PreconditionMismatchException(lStrengthen.getRight().toPrefixNotation(),
                                              xiMiddle.getPrecondition().toPrefixNotation());
    }

    if (!lWeaken.getLeft().equals(xiMiddle.getPostcondition()))
    {
      throw new PostconditionMismatchException(lWeaken.getLeft().toPrefixNotation(),
                                               xiMiddle.getPostcondition().toPrefixNotation());
    }

    return new Triple(lStrengthen.getLeft(), xiMiddle.getCommand(), lWeaken.getRight());
  }

  /**
   * While rule.
   *
   * <pre>
   *        {P ∧ B} S {P}
   *  --------------------------
   *  {P} while B do S done {¬B ∧ P}
   * </pre>
   *
   * The loop condition is rendered into the command in infix notation.
   *
   * @param xiBody - the loop body, with the invariant as the first conjunct of its precondition.
   * @return the loop triple.
   *
   * @throws NotConjunctionException if the precondition isn't a conjunction.
   * @throws InvariantNotPreservedException if the postcondition isn't the invariant.
   */
  public static Triple loop(Triple xiBody) throws NotConjunctionException, InvariantNotPreservedException
  {
    FormulaAnd lPre = requireConjunction(xiBody.getPrecondition());
    Formula lInvariant = lPre.getLeft();
    Formula lCondition = lPre.getRight();

    if (!lInvariant.equals(xiBody.getPostcondition()))
    {
      throw new InvariantNotPreservedException(lInvariant.toPrefixNotation(),
                                               xiBody.getPostcondition().toPrefixNotation());
    }

    return new Triple(xiBody.getPostcondition(),
                      "while " + lCondition.toInfixNotation() + " do " + xiBody.getCommand() + " done",
                      FormulaPool.getAnd(FormulaPool.getNot(lCondition), xiBody.getPostcondition()));
  }

  private static FormulaAnd requireConjunction(Formula xiFormula) throws NotConjunctionException
  {
    if (!(xiFormula instanceof FormulaAnd))
    {
      throw new NotConjunctionException(xiFormula.toPrefixNotation(), xiFormula.getKind());
    }
    return (FormulaAnd)xiFormula;
  }

  private static FormulaImplies requireImplication(Formula xiFormula, Side xiSide) throws NotImplicationException
  {
    if (!(xiFormula instanceof FormulaImplies))
    {
      throw new NotImplicationException(xiSide, xiFormula.toPrefixNotation(), xiFormula.getKind());
    }
    return (FormulaImplies)xiFormula;
  }

  private static Formula substitute(Formula xiFormula,
                                    FormulaTerm xiVariable,
                                    FormulaTerm xiReplacement,
                                    Set<String> xiBound)
  {
    if (xiFormula instanceof FormulaTerm)
    {
      if (xiFormula.equals(xiVariable))
      {
        for (String lBound : xiBound)
        {
          if (lBound.equals(xiReplacement.getValue()) || identifiers(xiReplacement.getValue()).contains(lBound))
          {
            throw new IllegalArgumentException("Substituting '" + xiReplacement.getValue() + "' for '" +
                                               xiVariable.getValue() + "' would be captured by the quantifier " +
                                               "binding '" + lBound + "'");
          }
        }
        return xiReplacement;
      }

      String lValue = ((FormulaTerm)xiFormula).getValue();
      if (identifiers(lValue).contains(xiVariable.getValue()))
      {
        throw new IllegalArgumentException("Can't substitute for '" + xiVariable.getValue() + "' inside the term '" +
                                           lValue + "'");
      }
      return xiFormula;
    }

    if (xiFormula instanceof FormulaNot)
    {
      return FormulaPool.getNot(substitute(((FormulaNot)xiFormula).getBody(), xiVariable, xiReplacement, xiBound));
    }

    if (xiFormula instanceof BinaryFormula)
    {
      BinaryFormula lBinary = (BinaryFormula)xiFormula;
      return FormulaPool.getBinary(lBinary.getKind(),
                                   substitute(lBinary.getLeft(), xiVariable, xiReplacement, xiBound),
                                   substitute(lBinary.getRight(), xiVariable, xiReplacement, xiBound));
    }

    QuantifiedFormula lQuantified = (QuantifiedFormula)xiFormula;
    if (lQuantified.getVariable().equals(xiVariable.getValue()))
    {
      // x is bound here, so there are no free occurrences below.
      return xiFormula;
    }

    Set<String> lBound = new HashSet<>(xiBound);
    lBound.add(lQuantified.getVariable());
    return FormulaPool.getQuantified(lQuantified.getKind(),
                                     lQuantified.getVariable(),
                                     substitute(lQuantified.getBody(), xiVariable, xiReplacement, lBound));
  }

  /**
   * @return the identifiers (maximal runs of letters, digits and underscores) in the specified token.
   *
   * @param xiToken - the token.
   */
  private static Set<String> identifiers(String xiToken)
  {
    Set<String> lIdentifiers = new HashSet<>();
    int lStart = -1;

    for (int lii = 0; lii <= xiToken.length(); lii++)
    {
      boolean lPartOfIdentifier = (lii < xiToken.length()) &&
                                  (Character.isLetterOrDigit(xiToken.charAt(lii)) || (xiToken.charAt(lii) == '_'));
      if (lPartOfIdentifier && (lStart < 0))
      {
        lStart = lii;
      }
      else if (!lPartOfIdentifier && (lStart >= 0))
      {
        lIdentifiers.add(xiToken.substring(lStart, lii));
        lStart = -1;
      }
    }

    return lIdentifiers;
  }
}
