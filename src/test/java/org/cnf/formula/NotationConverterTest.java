package org.cnf.formula;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class NotationConverterTest {

    private static final List<String> CANONICAL = Arrays.asList(
            "p",
            "(~p)",
            "(p>q)",
            "(~(~p))",
            "((p+q)*(~r))",
            "((a>(b+c))*((~d)+(e*f)))",
            "(~((p*q)>(~(r+s))))");

    @Test
    public void infixToPrefix() {
        assertThat(NotationConverter.infixToPrefix("(p>q)"), is(">pq"));
        assertThat(NotationConverter.infixToPrefix("((p+q)*(~r))"), is("*+pq~r"));
        assertThat(NotationConverter.infixToPrefix("(~(~p))"), is("~~p"));
        assertThat(NotationConverter.infixToPrefix(""), is(""));
    }

    @Test
    public void buildTree() {
        assertThat(NotationConverter.buildTree(">pq"),
                is(Formula.implies(Formula.atom("p"), Formula.atom("q"))));
        assertThat(NotationConverter.buildTree("~*pq"),
                is(Formula.not(Formula.and(Formula.atom("p"), Formula.atom("q")))));
    }

    @Test
    public void topLevelBinaryMayOmitParentheses() {
        assertThat(NotationConverter.infixToPrefix("(p>q)*(q>q)"), is("*>pq>qq"));
        assertThat(NotationConverter.parse("(p>q)*(q>q)"), is(Formula.and(
                Formula.implies(Formula.atom("p"), Formula.atom("q")),
                Formula.implies(Formula.atom("q"), Formula.atom("q")))));
    }

    @Test
    public void whitespaceIsIgnored() {
        assertThat(NotationConverter.infixToPrefix(" ( p > q ) "), is(">pq"));
    }

    @Test
    public void canonicalFormulasRoundTrip() {
        for (String infix : CANONICAL) {
            String prefix = NotationConverter.infixToPrefix(infix);
            Formula tree = NotationConverter.buildTree(prefix);
            assertThat(NotationConverter.printInfix(tree), is(infix));
            assertThat(NotationConverter.printPrefix(tree), is(prefix));
        }
    }

    @Test
    public void emptyFormula() {
        assertThat(NotationConverter.buildTree(""), is(nullValue()));
        assertThat(NotationConverter.parse(""), is(nullValue()));
        assertThat(NotationConverter.printInfix(null), is(""));
        assertThat(NotationConverter.printPrefix(null), is(""));
        assertThat(NotationConverter.height(null), is(0));
    }

    @Test
    public void height() {
        assertThat(NotationConverter.height(NotationConverter.parse("p")), is(1));
        assertThat(NotationConverter.height(NotationConverter.parse("((p+q)*(~r))")), is(3));
        assertThat(NotationConverter.height(NotationConverter.parse("(~(~(~p)))")), is(4));
    }

    @Test
    public void truncatedPrefix() {
        for (String prefix : Arrays.asList("*p", ">", "~", "+p~")) {
            try {
                NotationConverter.buildTree(prefix);
                fail("Formula troncata accettata: " + prefix);
            } catch (TruncatedFormulaException e) {
                assertThat(e.getPosition(), is(prefix.length()));
            }
        }
    }

    @Test(expected = MalformedFormulaException.class)
    public void extraSymbolsAfterRoot() {
        NotationConverter.buildTree("pq");
    }

    @Test(expected = MalformedFormulaException.class)
    public void unknownPrefixSymbol() {
        NotationConverter.buildTree("*p#");
    }

    @Test
    public void unknownInfixSymbolReportsPosition() {
        try {
            NotationConverter.infixToPrefix("(p&q)");
            fail();
        } catch (MalformedFormulaException e) {
            assertThat(e.getPosition(), is(2));
            assertThat(e.getMessage(), containsString("&"));
        }
    }

    @Test(expected = MalformedFormulaException.class)
    public void unmatchedOpeningParenthesis() {
        NotationConverter.infixToPrefix("(p+q");
    }

    @Test(expected = MalformedFormulaException.class)
    public void unmatchedClosingParenthesis() {
        NotationConverter.infixToPrefix("p+q)");
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullInput() {
        NotationConverter.infixToPrefix(null);
    }

    @Test
    public void misplacedSymbols() {
        for (String infix : Arrays.asList("(pq+)", "(p~+q)", "()", "+p", "(p+q)~", "p(q)", "(p+q)(r)", "(~)")) {
            try {
                NotationConverter.infixToPrefix(infix);
                fail("Formula accettata: " + infix);
            } catch (MalformedFormulaException e) {
                assertThat(e.getPosition(), is(both(greaterThanOrEqualTo(0)).and(lessThan(infix.length()))));
            }
        }
    }

    @Test
    public void misplacedSymbolPosition() {
        try {
            NotationConverter.infixToPrefix("(pq+)");
            fail();
        } catch (MalformedFormulaException e) {
            assertThat(e.getPosition(), is(4));
        }
    }

    @Test
    public void connectivesPerGroupAreNotCounted() {
        assertThat(NotationConverter.infixToPrefix("(p+q+r)"), is("++pqr"));
    }
}
