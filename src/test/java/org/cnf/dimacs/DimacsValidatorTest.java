package org.cnf.dimacs;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class DimacsValidatorTest {

    private final DimacsValidator validator = new DimacsValidator();

    @Test
    public void complementaryLiteralsMakeClauseTautological() {
        assertThat(validator.isTautologicalClause(Arrays.asList(1, -1)), is(true));
        assertThat(validator.isTautologicalClause(Arrays.asList(2, -3, 5, 3)), is(true));
        assertThat(validator.isTautologicalClause(Arrays.asList(1, 2)), is(false));
        assertThat(validator.isTautologicalClause(Arrays.asList(-1, -1, 2)), is(false));
        assertThat(validator.isTautologicalClause(Collections.emptyList()), is(false));
    }

    @Test
    public void countsClauses() {
        DimacsFormula formula = new DimacsReader().parse("p cnf 3 3\n1 -1 0\n1 2 0\n-3 2 3 0\n");

        assertThat(validator.countTautologicalClauses(formula), is(2));
        assertThat(validator.countNonTautologicalClauses(formula), is(1));
        assertThat(validator.isValid(formula), is(false));
    }

    @Test
    public void validWhenEveryClauseIsTautological() {
        DimacsFormula formula = new DimacsReader().parse("p cnf 2 2\n1 -1 0\n2 1 -2 0\n");
        assertThat(validator.isValid(formula), is(true));
    }

    @Test
    public void formulaWithoutClausesIsValid() {
        assertThat(validator.isValid(new DimacsFormula(0, Collections.emptyList())), is(true));
    }
}
