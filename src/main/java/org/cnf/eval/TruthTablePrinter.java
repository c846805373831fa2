package org.cnf.eval;

import org.cnf.formula.Formula;

/**
 * Stampa testuale della tabella di verità.
 *
 * Formato: intestazione con le variabili concatenate seguite da " Truth value",
 * poi una riga per assegnamento con i bit delle variabili e il valore.
 * <pre>
 * ab Truth value
 * 00 0
 * 01 1
 * </pre>
 */
public class TruthTablePrinter {

    private final TruthEvaluator evaluator;

    public TruthTablePrinter(TruthEvaluator evaluator) {
        if (evaluator == null) {
            throw new IllegalArgumentException("TruthEvaluator non può essere null");
        }
        this.evaluator = evaluator;
    }

    public String render(Formula formula) {
        Iterable<TruthTableRow> rows = evaluator.truthTable(formula);

        StringBuilder out = new StringBuilder();
        for (String atom : evaluator.enumerateAtoms(formula)) {
            out.append(atom);
        }
        out.append(" Truth value").append(System.lineSeparator());

        for (TruthTableRow row : rows) {
            out.append(row.bits()).append(' ').append(row.value()).append(System.lineSeparator());
        }
        return out.toString();
    }
}
