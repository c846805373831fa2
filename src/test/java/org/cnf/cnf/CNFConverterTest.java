package org.cnf.cnf;

import org.cnf.eval.TruthEvaluator;
import org.cnf.eval.TruthTableRow;
import org.cnf.formula.ComputationInterruptedException;
import org.cnf.formula.Formula;
import org.cnf.formula.NotationConverter;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class CNFConverterTest {

    private static final List<String> FORMULAS = Arrays.asList(
            "p",
            "(~p)",
            "(p>q)",
            "(p>q)*(q>q)",
            "(~(p*q))",
            "(~(~(p+q)))",
            "(p+(q*r))",
            "((p*q)+(r*s))",
            "((p>q)>r)",
            "(~((p>q)+(~(r*(~s)))))",
            "(((a*b)+(c*d))+(e*f))");

    private final CNFConverter converter = new CNFConverter();
    private final TruthEvaluator evaluator = new TruthEvaluator();

    private static Formula parse(String infix) {
        return NotationConverter.parse(infix);
    }

    @Test
    public void emptyFormulaPassesThrough() {
        assertThat(converter.toCNF(null), is(nullValue()));
    }

    @Test
    public void eliminatesImplications() {
        assertThat(converter.eliminateImplications(parse("(p>q)")).toString(), is("((~p)+q)"));
        assertThat(converter.eliminateImplications(parse("((p>q)>r)")).toString(), is("((~((~p)+q))+r)"));
    }

    @Test
    public void pushesNegationsToAtoms() {
        assertThat(converter.toNegationNormalForm(parse("(~(p*q))")).toString(), is("((~p)+(~q))"));
        assertThat(converter.toNegationNormalForm(parse("(~(p+q))")).toString(), is("((~p)*(~q))"));
        assertThat(converter.toNegationNormalForm(parse("(~(~p))")).toString(), is("p"));
        assertThat(converter.toNegationNormalForm(parse("(~(~(~p)))")).toString(), is("(~p)"));
    }

    @Test
    public void distributesOrOverAnd() {
        assertThat(converter.toCNF(parse("(p+(q*r))")).toString(), is("((p+q)*(p+r))"));
        assertThat(converter.toCNF(parse("((p*q)+r)")).toString(), is("((p+r)*(q+r))"));
        assertThat(converter.toCNF(parse("((p*q)+(r*s))")).toString(), is("(((p+r)*(p+s))*((q+r)*(q+s)))"));
    }

    @Test
    public void literalsAndClausesAreUnchanged() {
        assertThat(converter.toCNF(parse("p")), is(parse("p")));
        assertThat(converter.toCNF(parse("(~p)")), is(parse("(~p)")));
        assertThat(converter.toCNF(parse("((p+(~q))*r)")), is(parse("((p+(~q))*r)")));
    }

    @Test
    public void exampleFormula() {
        assertThat(converter.toCNF(parse("(p>q)*(q>q)")).toString(), is("(((~p)+q)*((~q)+q))"));
    }

    @Test
    public void eachPassEstablishesItsShape() {
        for (String infix : FORMULAS) {
            Formula f = parse(infix);
            Formula noImplications = converter.eliminateImplications(f);
            assertThat(infix, CNFConverter.isImplicationFree(noImplications), is(true));

            Formula nnf = converter.toNegationNormalForm(noImplications);
            assertThat(infix, CNFConverter.isInNegationNormalForm(nnf), is(true));

            assertThat(infix, CNFConverter.isInCNF(converter.distribute(nnf)), is(true));
            assertThat(infix, CNFConverter.isInCNF(converter.toCNF(f)), is(true));
        }
    }

    @Test
    public void conversionPreservesTruthValues() {
        for (String infix : FORMULAS) {
            Formula f = parse(infix);
            Formula cnf = converter.toCNF(f);
            for (TruthTableRow row : evaluator.truthTable(f)) {
                assertThat(infix + " " + row.assignment(), evaluator.evaluate(cnf, row.assignment()), is(row.value()));
            }
        }
    }

    @Test
    public void conversionDoesNotModifyInput() {
        Formula f = parse("(~((p>q)+r))");
        String before = f.toString();
        converter.toCNF(f);
        assertThat(f.toString(), is(before));
    }

    @Test
    public void shapeChecks() {
        assertThat(CNFConverter.isInCNF(parse("(p+(q*r))")), is(false));
        assertThat(CNFConverter.isInCNF(parse("(~(p+q))")), is(false));
        assertThat(CNFConverter.isInCNF(parse("(p>q)")), is(false));
        assertThat(CNFConverter.isInNegationNormalForm(parse("(p+(q*(~r)))")), is(true));
        assertThat(CNFConverter.isImplicationFree(parse("(~(p>q))")), is(false));
    }

    @Test(expected = IllegalStateException.class)
    public void negationNormalFormRequiresImplicationFreeInput() {
        converter.toNegationNormalForm(parse("(~(p>q))"));
    }

    @Test(expected = IllegalStateException.class)
    public void distributionRequiresImplicationFreeInput() {
        converter.distribute(parse("(p>q)"));
    }

    @Test
    public void interruptedThreadStopsDistribution() {
        Formula f = parse("(((a*b)+(c*d))+(e*f))");

        Thread.currentThread().interrupt();
        try {
            converter.toCNF(f);
            fail();
        } catch (ComputationInterruptedException e) {
            assertThat(e.getMessage(), containsString("distribuzione"));
        } finally {
            Thread.interrupted();
        }
        assertThat(CNFConverter.isInCNF(converter.toCNF(f)), is(true));
    }
}
