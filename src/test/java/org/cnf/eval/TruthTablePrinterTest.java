package org.cnf.eval;

import org.cnf.formula.NotationConverter;
import org.cnf.formula.TooManyAtomsException;
import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class TruthTablePrinterTest {

    private static final String NL = System.lineSeparator();

    @Test
    public void rendersHeaderAndRows() {
        String table = new TruthTablePrinter(new TruthEvaluator()).render(NotationConverter.parse("(b+a)"));

        assertThat(table, is("ab Truth value" + NL
                + "00 0" + NL
                + "01 1" + NL
                + "10 1" + NL
                + "11 1" + NL));
    }

    @Test
    public void singleAtom() {
        String table = new TruthTablePrinter(new TruthEvaluator()).render(NotationConverter.parse("(~p)"));
        assertThat(table, is("p Truth value" + NL + "0 1" + NL + "1 0" + NL));
    }

    @Test(expected = TooManyAtomsException.class)
    public void respectsAtomLimit() {
        new TruthTablePrinter(new TruthEvaluator(1)).render(NotationConverter.parse("(p*q)"));
    }
}
