package org.hoare.base.test;

import java.util.Arrays;

import org.hoare.base.util.formula.factory.FormulaParser;
import org.hoare.base.util.formula.factory.exceptions.FormulaFormatException;
import org.hoare.base.util.formula.factory.exceptions.FormulaFormatException.Reason;
import org.hoare.base.util.formula.grammar.BinaryFormula;
import org.hoare.base.util.formula.grammar.Formula;
import org.hoare.base.util.formula.grammar.FormulaAnd;
import org.hoare.base.util.formula.grammar.FormulaEquals;
import org.hoare.base.util.formula.grammar.FormulaExists;
import org.hoare.base.util.formula.grammar.FormulaForAll;
import org.hoare.base.util.formula.grammar.FormulaImplies;
import org.hoare.base.util.formula.grammar.FormulaKind;
import org.hoare.base.util.formula.grammar.FormulaLessThan;
import org.hoare.base.util.formula.grammar.FormulaNot;
import org.hoare.base.util.formula.grammar.FormulaOr;
import org.hoare.base.util.formula.grammar.FormulaPool;
import org.hoare.base.util.formula.grammar.FormulaTerm;
import org.junit.Assert;
import org.junit.Test;

public class FormulaParsingTests extends Assert
{
  private static final FormulaParser STRICT = new FormulaParser(true, 1000);
  private static final FormulaParser LENIENT = new FormulaParser(false, 1000);

  private static final String WORKED_EXAMPLE = "∧ ∀ x → P(x) ∧ Q(x) ∃ y ∨ R(y) S(y) = ¬ T(x) < U V";

  @Test
  public void testTerm() throws Exception
  {
    Formula lFormula = STRICT.parse("fact(count-1)");
    assertTrue(lFormula instanceof FormulaTerm);
    assertEquals("fact(count-1)", ((FormulaTerm)lFormula).getValue());
    assertEquals(FormulaKind.TERM, lFormula.getKind());
  }

  @Test
  public void testEachConnective() throws Exception
  {
    assertTrue(STRICT.parse("¬ x") instanceof FormulaNot);
    assertTrue(STRICT.parse("∧ x y") instanceof FormulaAnd);
    assertTrue(STRICT.parse("∨ x y") instanceof FormulaOr);
    assertTrue(STRICT.parse("→ x y") instanceof FormulaImplies);
    assertTrue(STRICT.parse("= x y") instanceof FormulaEquals);
    assertTrue(STRICT.parse("< x y") instanceof FormulaLessThan);
    assertTrue(STRICT.parse("∀ x x") instanceof FormulaForAll);
    assertTrue(STRICT.parse("∃ x x") instanceof FormulaExists);
  }

  @Test
  public void testWorkedExampleTree() throws Exception
  {
    Formula lExpected =
        FormulaPool.getAnd(
            FormulaPool.getForAll("x",
                FormulaPool.getImplies(
                    FormulaPool.getTerm("P(x)"),
                    FormulaPool.getAnd(
                        FormulaPool.getTerm("Q(x)"),
                        FormulaPool.getExists("y",
                            FormulaPool.getOr(FormulaPool.getTerm("R(y)"), FormulaPool.getTerm("S(y)")))))),
            FormulaPool.getEquals(
                FormulaPool.getNot(FormulaPool.getTerm("T(x)")),
                FormulaPool.getLessThan(FormulaPool.getTerm("U"), FormulaPool.getTerm("V"))));

    assertEquals(lExpected, STRICT.parse(WORKED_EXAMPLE));
  }

  @Test
  public void testOperandOrder() throws Exception
  {
    BinaryFormula lFormula = (BinaryFormula)STRICT.parse("→ ∧ a b c");
    assertEquals("∧ a b", lFormula.getLeft().toPrefixNotation());
    assertEquals("c", lFormula.getRight().toPrefixNotation());
  }

  @Test
  public void testQuantifierTakesVariableVerbatim() throws Exception
  {
    // The token after a quantifier is the variable, even when it looks like an operator.
    FormulaForAll lFormula = (FormulaForAll)STRICT.parse("∀ ∧ P(∧)");
    assertEquals("∧", lFormula.getVariable());
    assertEquals(FormulaPool.getTerm("P(∧)"), lFormula.getBody());
  }

  @Test
  public void testAnyWhitespaceSeparatesTokens() throws Exception
  {
    assertEquals(STRICT.parse("∧ a b"), STRICT.parse("  ∧\ta\n\n b  "));
  }

  @Test
  public void testEmptyInput()
  {
    assertFailure(STRICT, "", Reason.UNEXPECTED_END, 0);
    assertFailure(STRICT, "   \t ", Reason.UNEXPECTED_END, 0);
  }

  @Test
  public void testMissingOperand()
  {
    assertFailure(STRICT, "¬", Reason.UNEXPECTED_END, 1);
    assertFailure(STRICT, "∧ a", Reason.UNEXPECTED_END, 2);
    assertFailure(STRICT, "→ ∨ a b", Reason.UNEXPECTED_END, 4);
    assertFailure(LENIENT, "< a", Reason.UNEXPECTED_END, 2);
  }

  @Test
  public void testMissingBoundVariable()
  {
    assertFailure(STRICT, "∀", Reason.UNEXPECTED_END, 1);
    assertFailure(STRICT, "∃", Reason.UNEXPECTED_END, 1);
  }

  @Test
  public void testMissingQuantifierBody()
  {
    assertFailure(STRICT, "∀ x", Reason.UNEXPECTED_END, 2);
    assertFailure(STRICT, "∧ a ∃ y", Reason.UNEXPECTED_END, 4);
  }

  @Test
  public void testTrailingTokensRejectedWhenStrict()
  {
    assertFailure(STRICT, "a b", Reason.TRAILING_TOKENS, 1);
    assertFailure(STRICT, "= 2*x + 1 43", Reason.TRAILING_TOKENS, 3);
  }

  @Test
  public void testTrailingTokensIgnoredWhenLenient() throws Exception
  {
    assertEquals(FormulaPool.getTerm("a"), LENIENT.parse("a b"));
    assertEquals("= 2*x +", LENIENT.parse("= 2*x + 1 43").toPrefixNotation());
  }

  @Test
  public void testDepthLimit() throws Exception
  {
    FormulaParser lParser = new FormulaParser(true, 10);

    StringBuilder lText = new StringBuilder();
    for (int lii = 0; lii < 9; lii++)
    {
      lText.append("¬ ");
    }
    lParser.parse(lText + "a");

    lText.append("¬ ");
    assertFailure(lParser, lText + "a", Reason.TOO_DEEP, 10);
  }

  @Test
  public void testDeepFormulaWithinDefaultLimit() throws Exception
  {
    StringBuilder lText = new StringBuilder();
    for (int lii = 0; lii < 500; lii++)
    {
      lText.append("∧ a").append(lii).append(' ');
    }
    lText.append("end");

    Formula lFormula = STRICT.parse(lText.toString());
    assertEquals(FormulaKind.CONJUNCTION, lFormula.getKind());
    assertEquals(lText.toString(), lFormula.toPrefixNotation());
  }

  @Test
  public void testInvalidDepthLimit()
  {
    try
    {
      new FormulaParser(true, 0);
      fail("Expected IllegalArgumentException");
    }
    catch (IllegalArgumentException lEx)
    {
      // Expected
    }
  }

  @Test
  public void testSameTokensSameTree() throws Exception
  {
    Formula lFirst = STRICT.parse(WORKED_EXAMPLE);
    Formula lSecond = STRICT.parse(WORKED_EXAMPLE);
    assertNotSame(lFirst, lSecond);
    assertEquals(lFirst, lSecond);
    assertEquals(lFirst.hashCode(), lSecond.hashCode());
  }

  @Test
  public void testTokenize()
  {
    assertEquals(Arrays.asList("∧", "a", "b"), FormulaParser.tokenize(" ∧  a\tb\n"));
    assertTrue(FormulaParser.tokenize("").isEmpty());
  }

  @Test
  public void testUnicodeWhitespaceSeparatesTokens() throws Exception
  {
    assertEquals(Arrays.asList("∧", "a", "b"), FormulaParser.tokenize("∧ a\u00A0b"));
    assertEquals(Arrays.asList("∧", "a", "b"), FormulaParser.tokenize("∧\u2007a\u202Fb\u3000"));
    assertEquals(Formula.parse("∧ a b"), STRICT.parse("∧\u00A0a\u2028b"));
  }

  private static void assertFailure(FormulaParser xiParser, String xiText, Reason xiReason, int xiTokenIndex)
  {
    try
    {
      xiParser.parse(xiText);
      fail("Expected " + xiReason + " for \"" + xiText + "\"");
    }
    catch (FormulaFormatException lEx)
    {
      assertEquals(xiReason, lEx.getReason());
      assertEquals(xiText, lEx.getSource());
      assertEquals(xiTokenIndex, lEx.getTokenIndex());
    }
  }
}
