package org.cnf.cnf;

/**
 * Conteggio delle clausole di una formula CNF per tipo.
 *
 * @param tautological clausole che contengono una variabile e la sua negazione
 * @param nonTautological clausole rimanenti
 */
public record ClauseSummary(int tautological, int nonTautological) {

    public int total() {
        return tautological + nonTautological;
    }

    /**
     * Vera se ogni clausola è tautologica (anche quando non ci sono clausole).
     */
    public boolean isValid() {
        return nonTautological == 0;
    }
}
