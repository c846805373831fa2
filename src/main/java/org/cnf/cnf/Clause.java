package org.cnf.cnf;

import org.cnf.formula.Formula;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Clausola appiattita: disgiunzione di letterali divisi in variabili affermate
 * e variabili negate.
 *
 * @param asserted variabili che compaiono senza negazione
 * @param negated variabili che compaiono negate
 */
public record Clause(SortedSet<String> asserted, SortedSet<String> negated) {

    public Clause {
        asserted = Collections.unmodifiableSortedSet(new TreeSet<>(asserted));
        negated = Collections.unmodifiableSortedSet(new TreeSet<>(negated));
    }

    /**
     * Analizza una clausola nella forma appiattita "p+~q+r".
     *
     * @param token clausola senza parentesi, letterali separati da '+'
     * @return clausola con gli insiemi di variabili affermate e negate
     * @throws IllegalArgumentException se il token contiene un letterale vuoto o non valido
     */
    public static Clause parse(String token) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Clausola vuota");
        }

        SortedSet<String> asserted = new TreeSet<>();
        SortedSet<String> negated = new TreeSet<>();

        for (String literal : token.split("\\+", -1)) {
            int start = 0;
            boolean negative = false;
            // Più '~' consecutive si annullano a coppie
            while (start < literal.length() && literal.charAt(start) == '~') {
                negative = !negative;
                start++;
            }

            String atom = literal.substring(start);
            if (!Formula.isAtomName(atom)) {
                throw new IllegalArgumentException("Letterale non valido '" + literal + "' nella clausola '" + token + "'");
            }

            if (negative) {
                negated.add(atom);
            } else {
                asserted.add(atom);
            }
        }

        return new Clause(asserted, negated);
    }

    /**
     * Variabili presenti sia affermate sia negate nella clausola.
     */
    public SortedSet<String> complementaryAtoms() {
        SortedSet<String> common = new TreeSet<>(asserted);
        common.retainAll(negated);
        return common;
    }

    /**
     * Una clausola è tautologica se contiene una variabile e la sua negazione.
     */
    public boolean isTautological() {
        for (String atom : asserted) {
            if (negated.contains(atom)) {
                return true;
            }
        }
        return false;
    }
}
