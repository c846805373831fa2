package org.cnf.formula;

import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class FormulaTest {

    private static final Formula P = Formula.atom("p");
    private static final Formula Q = Formula.atom("q");
    private static final Formula R = Formula.atom("r");

    @Test
    public void printsCanonicalInfix() {
        assertThat(P.toString(), is("p"));
        assertThat(Formula.not(P).toString(), is("(~p)"));
        assertThat(Formula.and(Formula.or(P, Q), Formula.not(R)).toString(), is("((p+q)*(~r))"));
        assertThat(Formula.implies(P, Formula.not(Formula.not(Q))).toString(), is("(p>(~(~q)))"));
    }

    @Test
    public void heightCountsNodesOnLongestPath() {
        assertThat(P.height(), is(1));
        assertThat(Formula.not(P).height(), is(2));
        assertThat(Formula.and(Formula.or(P, Q), Formula.not(R)).height(), is(3));
        assertThat(Formula.and(Formula.or(P, Q), Formula.not(R)).size(), is(6));
    }

    @Test
    public void atomsAreSortedAndDistinct() {
        Formula f = Formula.and(Formula.or(R, P), Formula.implies(Q, P));
        assertThat(f.atoms(), contains("p", "q", "r"));
    }

    @Test
    public void literals() {
        assertThat(P.isLiteral(), is(true));
        assertThat(Formula.not(P).isLiteral(), is(true));
        assertThat(Formula.not(Formula.not(P)).isLiteral(), is(false));
        assertThat(Formula.or(P, Q).isLiteral(), is(false));
    }

    @Test
    public void equalityIsStructuralAndOrderSensitive() {
        assertThat(Formula.or(Formula.atom("p"), Formula.atom("q")), is(equalTo(Formula.or(P, Q))));
        assertThat(Formula.or(P, Q).hashCode(), is(Formula.or(Formula.atom("p"), Formula.atom("q")).hashCode()));
        assertThat(Formula.or(P, Q), is(not(equalTo(Formula.or(Q, P)))));
        assertThat(Formula.or(P, Q), is(not(equalTo(Formula.and(P, Q)))));
    }

    @Test
    public void symbolsMapToConnectives() {
        assertThat(Formula.Type.fromSymbol('~'), is(Formula.Type.NOT));
        assertThat(Formula.Type.fromSymbol('>'), is(Formula.Type.IMPLIES));
        assertThat(Formula.Type.fromSymbol('&'), is(nullValue()));
        assertThat(Formula.Type.NOT.isBinary(), is(false));
    }

    @Test
    public void atomNames() {
        assertThat(Formula.isAtomName("x1_b"), is(true));
        assertThat(Formula.isAtomName("1x"), is(false));
        assertThat(Formula.isAtomName(""), is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsInvalidAtomName() {
        Formula.atom("p-q");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonBinaryTypeForBinaryNode() {
        Formula.binary(Formula.Type.NOT, P, Q);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMissingChild() {
        Formula.and(P, null);
    }

    @Test(expected = IllegalStateException.class)
    public void atomHasNoChildren() {
        P.getLeft();
    }

    @Test(expected = IllegalStateException.class)
    public void onlyNegationHasOperand() {
        Formula.or(P, Q).getOperand();
    }
}
