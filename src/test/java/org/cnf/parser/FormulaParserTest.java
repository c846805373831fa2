package org.cnf.parser;

import org.cnf.formula.Formula;
import org.cnf.formula.MalformedFormulaException;
import org.cnf.formula.NotationConverter;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class FormulaParserTest {

    private final FormulaParser parser = new FormulaParser();

    @Test
    public void agreesWithStackConversion() {
        for (String infix : Arrays.asList(
                "p",
                "(~p)",
                "~p",
                "(p>q)",
                "(p>q)*(q>q)",
                "((p+q)*(~r))",
                "(~(~(a+B)))",
                " ( (a > b) + ( ~ c ) ) ")) {
            assertThat(infix, parser.parse(infix), is(equalTo(NotationConverter.parse(infix))));
        }
    }

    @Test
    public void redundantParenthesesAreTransparent() {
        assertThat(parser.parse("(p)"), is(Formula.atom("p")));
        assertThat(parser.parse("(((p+q)))").toString(), is("(p+q)"));
    }

    @Test
    public void emptyInput() {
        assertThat(parser.parse(""), is(nullValue()));
        assertThat(parser.parse("   "), is(nullValue()));
    }

    @Test
    public void syntaxErrors() {
        for (String infix : Arrays.asList("(p+q", "p+q)", "(p+q+r)", "(p&q)", "p q", "(p+)", "~", "()")) {
            try {
                parser.parse(infix);
                fail("Formula accettata: " + infix);
            } catch (MalformedFormulaException e) {
                assertThat(e.getMessage(), containsString(infix));
            }
        }
    }

    @Test
    public void errorPositionPointsAtOffendingSymbol() {
        try {
            parser.parse("(p&q)");
            fail();
        } catch (MalformedFormulaException e) {
            assertThat(e.getPosition(), is(2));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullInput() {
        parser.parse(null);
    }
}
