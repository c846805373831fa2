package org.cnf.cnf;

import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class ClauseTest {

    @Test
    public void parseSeparatesAssertedAndNegated() {
        Clause clause = Clause.parse("r+~q+p");
        assertThat(clause.asserted(), contains("p", "r"));
        assertThat(clause.negated(), contains("q"));
        assertThat(clause.isTautological(), is(false));
        assertThat(clause.complementaryAtoms(), is(empty()));
    }

    @Test
    public void doubleNegationCancels() {
        Clause clause = Clause.parse("~~p+~q");
        assertThat(clause.asserted(), contains("p"));
        assertThat(clause.negated(), contains("q"));
    }

    @Test
    public void complementaryAtoms() {
        Clause clause = Clause.parse("p+~q+~p+q+r");
        assertThat(clause.isTautological(), is(true));
        assertThat(clause.complementaryAtoms(), contains("p", "q"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void literalSetsAreUnmodifiable() {
        Clause.parse("p").asserted().add("q");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsEmptyLiteral() {
        Clause.parse("p++q");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsDanglingNegation() {
        Clause.parse("p+~");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsEmptyClause() {
        Clause.parse("");
    }
}
