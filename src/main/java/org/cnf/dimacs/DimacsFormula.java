package org.cnf.dimacs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Formula CNF letta da un file DIMACS.
 *
 * @param variableCount numero di variabili dichiarato nell'intestazione
 * @param clauses clausole come liste di letterali con segno (negativo = negato)
 */
public record DimacsFormula(int variableCount, List<List<Integer>> clauses) {

    public DimacsFormula {
        List<List<Integer>> copy = new ArrayList<>(clauses.size());
        for (List<Integer> clause : clauses) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(clause)));
        }
        clauses = Collections.unmodifiableList(copy);
    }

    public int clauseCount() {
        return clauses.size();
    }
}
