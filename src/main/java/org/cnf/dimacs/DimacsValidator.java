package org.cnf.dimacs;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Classificazione delle clausole di una formula DIMACS.
 *
 * Stesso criterio di {@link org.cnf.cnf.ClauseAnalyzer}: una clausola è
 * tautologica se contiene sia v sia -v per qualche variabile v, e la formula
 * è valida se tutte le sue clausole sono tautologiche.
 */
public class DimacsValidator {

    private static final Logger LOGGER = Logger.getLogger(DimacsValidator.class.getName());

    public boolean isTautologicalClause(List<Integer> clause) {
        Set<Integer> seen = new HashSet<>();
        for (int literal : clause) {
            if (seen.contains(-literal)) {
                return true;
            }
            seen.add(literal);
        }
        return false;
    }

    public int countTautologicalClauses(DimacsFormula formula) {
        int count = 0;
        for (List<Integer> clause : formula.clauses()) {
            if (isTautologicalClause(clause)) {
                count++;
            }
        }
        return count;
    }

    public int countNonTautologicalClauses(DimacsFormula formula) {
        return formula.clauseCount() - countTautologicalClauses(formula);
    }

    /**
     * Vera se ogni clausola della formula è tautologica.
     */
    public boolean isValid(DimacsFormula formula) {
        int tautological = countTautologicalClauses(formula);
        LOGGER.fine("Clausole tautologiche DIMACS: " + tautological + "/" + formula.clauseCount());
        return tautological == formula.clauseCount();
    }
}
