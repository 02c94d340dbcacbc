package org.hoare.base.test;

import org.hoare.base.util.formula.grammar.Formula;
import org.hoare.base.util.hoare.HoareRules;
import org.hoare.base.util.hoare.Triple;
import org.hoare.base.util.hoare.exceptions.MidconditionMismatchException;
import org.hoare.base.util.hoare.exceptions.RuleException;
import org.hoare.base.util.proof.Proof;
import org.hoare.base.util.proof.ProofLine;
import org.hoare.base.util.proof.RuleApplication;
import org.junit.Assert;
import org.junit.Test;

public class ProofTests extends Assert
{
  @Test
  public void testFormulaLine() throws Exception
  {
    Formula lFormula = Formula.parse("∧ ∀ x → P(x) ∧ Q(x) ∃ y ∨ R(y) S(y) = ¬ T(x) < U V");
    ProofLine lLine = ProofLine.of(lFormula);

    assertTrue(lLine.isFormula());
    assertFalse(lLine.isTriple());
    assertEquals(lFormula, lLine.asFormula());
    assertNull(lLine.asTriple());
    assertEquals(lFormula.toString(), lLine.toString());
  }

  @Test
  public void testTripleLine() throws Exception
  {
    Triple lTriple = Triple.create("= y 43", "z≔y", "= z 43");
    ProofLine lLine = ProofLine.of(lTriple);

    assertTrue(lLine.isTriple());
    assertFalse(lLine.isFormula());
    assertEquals(lTriple, lLine.asTriple());
    assertNull(lLine.asFormula());
    assertEquals("{(y=43)} z≔y {(z=43)}", lLine.toString());
  }

  @Test
  public void testLineEquality() throws Exception
  {
    assertEquals(ProofLine.of(Formula.parse("a")), ProofLine.of(Formula.parse("a")));
    assertNotEquals(ProofLine.of(Formula.parse("a")), ProofLine.of(Triple.create("a", "S", "a")));
    assertNotEquals(ProofLine.of(Triple.create("a", "S", "a")), ProofLine.of(Formula.parse("a")));
  }

  @Test
  public void testFromRule() throws Exception
  {
    final Triple lFirst = Triple.create("= x+1 43", "y≔x+1", "= y 43");
    final Triple lSecond = Triple.create("= y 43", "z≔y", "= z 43");

    ProofLine lLine = ProofLine.fromRule(new RuleApplication()
    {
      @Override
      public Triple apply() throws RuleException
      {
        return HoareRules.compose(lFirst, lSecond);
      }
    });
    assertEquals(ProofLine.of(Triple.create("= x+1 43", "y≔x+1;z≔y", "= z 43")), lLine);
  }

  @Test
  public void testFromRuleKeepsError() throws Exception
  {
    final Triple lFirst = Triple.create("= x+1 43", "y≔x+1", "= y 43");
    final Triple lSecond = Triple.create("= y 44", "z≔y", "= z 44");

    try
    {
      ProofLine.fromRule(new RuleApplication()
      {
        @Override
        public Triple apply() throws RuleException
        {
          return HoareRules.compose(lFirst, lSecond);
        }
      });
      fail("Expected MidconditionMismatchException");
    }
    catch (MidconditionMismatchException lEx)
    {
      assertEquals("= y 44", lEx.getRightPrecondition());
    }
  }

  @Test
  public void testRejectedRuleLeavesProofUnchanged() throws Exception
  {
    final Proof lProof = new Proof();
    lProof.addTriple("∧ P B", "S", "Q");

    try
    {
      lProof.apply(new RuleApplication()
      {
        @Override
        public Triple apply() throws RuleException
        {
          return HoareRules.loop(lProof.getTriple(0));
        }
      });
      fail("Expected RuleException");
    }
    catch (RuleException lEx)
    {
      // Expected
    }

    assertEquals(1, lProof.size());
    assertEquals(0, lProof.last());
  }

  @Test
  public void testWrongVariantAccess() throws Exception
  {
    Proof lProof = new Proof();
    lProof.addFormula("→ P Q");
    lProof.addTriple("P", "S", "Q");

    assertNull(lProof.get(0).asTriple());
    assertNull(lProof.get(1).asFormula());

    try
    {
      lProof.getTriple(0);
      fail("Expected IllegalArgumentException");
    }
    catch (IllegalArgumentException lEx)
    {
      assertEquals("Line 0 holds a formula, not a triple", lEx.getMessage());
    }

    try
    {
      lProof.getFormula(1);
      fail("Expected IllegalArgumentException");
    }
    catch (IllegalArgumentException lEx)
    {
      assertEquals("Line 1 holds a triple, not a formula", lEx.getMessage());
    }

    try
    {
      lProof.get(2);
      fail("Expected IllegalArgumentException");
    }
    catch (IllegalArgumentException lEx)
    {
      // Expected
    }
  }

  @Test(expected=UnsupportedOperationException.class)
  public void testLinesAreReadOnly() throws Exception
  {
    Proof lProof = new Proof();
    lProof.addFormula("P");
    lProof.getLines().clear();
  }

  @Test
  public void testToString() throws Exception
  {
    Proof lProof = new Proof();
    lProof.addFormula("→ P Q");
    lProof.addTriple("P", "S", "Q");

    assertEquals("0 (P→Q)\n1 {P} S {Q}\n", lProof.toString());
  }

  /**
   * Partial correctness of a loop computing x! by counting down.
   */
  @Test
  public void testFactorialProof() throws Exception
  {
    final Proof lProof = new Proof();

    final int lMultiply = lProof.addTriple(
        "∧ = (result*count)*fact(count-1) fact(x) ∨ < 0 (count-1) = 0 (count-1)",
        "result≔result*count",
        "∧ = result*fact(count-1) fact(x) ∨ < 0 (count-1) = 0 (count-1)");
    final int lDecrement = lProof.addTriple(
        "∧ = result*fact(count-1) fact(x) ∨ < 0 (count-1) = 0 (count-1)",
        "count≔count-1",
        "∧ = result*fact(count) fact(x) ∨ < 0 count = 0 count");
    final int lBody = lProof.apply(new RuleApplication()
    {
      @Override
      public Triple apply() throws RuleException
      {
        return HoareRules.compose(lProof.getTriple(lMultiply), lProof.getTriple(lDecrement));
      }
    });

    final int lStrengthen = lProof.addFormula(
        "→ ∧ ∧ = result*fact(count) fact(x) ∨ < 0 count = 0 count ¬ = 0 count " +
        "∧ = (result*count)*fact(count-1) fact(x) ∨ < 0 (count-1) = 0 (count-1)");
    final Formula lIdentity = Formula.parse("→ " + lProof.getTriple(lBody).getPostcondition().toPrefixNotation() +
                                            " " + lProof.getTriple(lBody).getPostcondition().toPrefixNotation());
    final int lGuardedBody = lProof.apply(new RuleApplication()
    {
      @Override
      public Triple apply() throws RuleException
      {
        return HoareRules.consequence(lProof.getFormula(lStrengthen), lProof.getTriple(lBody), lIdentity);
      }
    });

    final int lLoop = lProof.apply(new RuleApplication()
    {
      @Override
      public Triple apply() throws RuleException
      {
        return HoareRules.loop(lProof.getTriple(lGuardedBody));
      }
    });

    final int lInit = lProof.addFormula(
        "→ ∧ ∧ = count x ∨ < 0 count = 0 count = result 1 ∧ = result*fact(count) fact(x) ∨ < 0 count = 0 count");
    final int lExit = lProof.addFormula(
        "→ ∧ ¬ ¬ = 0 count ∧ = result*fact(count) fact(x) ∨ < 0 count = 0 count = result fact(x)");
    final int lResult = lProof.apply(new RuleApplication()
    {
      @Override
      public Triple apply() throws RuleException
      {
        return HoareRules.consequence(lProof.getFormula(lInit), lProof.getTriple(lLoop), lProof.getFormula(lExit));
      }
    });

    assertEquals(9, lProof.size());
    assertEquals(8, lResult);
    assertEquals(Triple.create("∧ ∧ = count x ∨ < 0 count = 0 count = result 1",
                               "while (¬(0=count)) do result≔result*count;count≔count-1 done",
                               "= result fact(x)"),
                 lProof.getTriple(lResult));
  }
}
