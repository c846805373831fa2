package org.cnf.cnf;

import org.cnf.formula.Formula;
import org.cnf.formula.NotationConverter;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class ClauseAnalyzerTest {

    private final CNFConverter converter = new CNFConverter();
    private final ClauseAnalyzer analyzer = new ClauseAnalyzer();

    private Formula cnf(String infix) {
        return converter.toCNF(NotationConverter.parse(infix));
    }

    @Test
    public void exampleFormulaHasOneTautologicalClause() {
        Formula cnf = cnf("(p>q)*(q>q)");

        assertThat(analyzer.flattenToString(cnf), is("~p+q*~q+q"));
        assertThat(analyzer.clauseTokens(cnf), contains("~p+q", "~q+q"));
        assertThat(analyzer.countClauses(cnf), is(2));
        assertThat(analyzer.countTautologicalClauses(cnf), is(1));
        assertThat(analyzer.countNonTautologicalClauses(cnf), is(1));
        assertThat(analyzer.isValidCnf(cnf), is(false));
    }

    @Test
    public void allTautologicalClausesMakeFormulaValid() {
        Formula cnf = cnf("((p+(~p))*((~q)+(r+q)))");

        assertThat(analyzer.countTautologicalClauses(cnf), is(2));
        assertThat(analyzer.countNonTautologicalClauses(cnf), is(0));
        assertThat(analyzer.isValidCnf(cnf), is(true));
    }

    @Test
    public void excludedMiddleAfterConversion() {
        assertThat(analyzer.isValidCnf(cnf("(p>p)")), is(true));
        assertThat(analyzer.isValidCnf(cnf("(p+q)")), is(false));
    }

    @Test
    public void classifiesFlattenedClauses() {
        assertThat(analyzer.isTautologicalClause("p+~p+q"), is(true));
        assertThat(analyzer.isTautologicalClause("p+q+~r"), is(false));
        assertThat(analyzer.isTautologicalClause("~q+r+q"), is(true));
        assertThat(analyzer.isTautologicalClause("p"), is(false));
    }

    @Test
    public void countsAddUpToClauseCount() {
        for (String infix : Arrays.asList("p", "(p+(q*r))", "((p*(~p))+(q*r))", "(~((p>q)*(q>p)))")) {
            Formula cnf = cnf(infix);
            int clauses = analyzer.countClauses(cnf);
            assertThat(infix, clauses, is(greaterThanOrEqualTo(1)));
            assertThat(infix, analyzer.countTautologicalClauses(cnf) + analyzer.countNonTautologicalClauses(cnf),
                    is(clauses));
        }
    }

    @Test
    public void clausesSplitLiterals() {
        Formula cnf = cnf("((p+(~q))*(~p))");

        assertThat(analyzer.clauses(cnf), hasSize(2));
        assertThat(analyzer.clauses(cnf).get(0).asserted(), contains("p"));
        assertThat(analyzer.clauses(cnf).get(0).negated(), contains("q"));
        assertThat(analyzer.clauses(cnf).get(1).negated(), contains("p"));
    }

    @Test
    public void emptyFormulaHasNoClauses() {
        assertThat(analyzer.flattenToString(null), is(""));
        assertThat(analyzer.clauseTokens(null), is(empty()));
        assertThat(analyzer.countClauses(null), is(0));
        assertThat(analyzer.isValidCnf(null), is(true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsFormulaNotInCnf() {
        analyzer.flattenToString(NotationConverter.parse("(p>q)"));
    }

    @Test
    public void summaryMatchesIndividualCounts() {
        Formula cnf = cnf("((p*(~p))+(q*r))");
        ClauseSummary summary = analyzer.summarize(cnf);

        assertThat(summary.total(), is(analyzer.countClauses(cnf)));
        assertThat(summary.tautological(), is(analyzer.countTautologicalClauses(cnf)));
        assertThat(summary.nonTautological(), is(analyzer.countNonTautologicalClauses(cnf)));
        assertThat(summary.isValid(), is(analyzer.isValidCnf(cnf)));
    }

    @Test
    public void summaryOfFlattenedClauses() {
        ClauseSummary summary = analyzer.summarize(Arrays.asList("p+~p", "q+r", "~r+r+s"));

        assertThat(summary, is(new ClauseSummary(2, 1)));
        assertThat(summary.isValid(), is(false));
        assertThat(analyzer.summarize(Arrays.<String>asList()).isValid(), is(true));
    }
}
