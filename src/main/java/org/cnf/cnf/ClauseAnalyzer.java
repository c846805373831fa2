package org.cnf.cnf;

import org.cnf.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ANALIZZATORE CLAUSOLE - Classificazione delle clausole di una formula in CNF
 *
 * Appiattisce l'albero CNF nella forma testuale interna "p+~q*r+~r" (congiunti
 * separati da '*', letterali separati da '+', nessuna parentesi) e classifica
 * ogni clausola come tautologica o meno.
 *
 * NOTA SULLA VALIDITÀ: {@link #isValidCnf(Formula)} è vera se e solo se TUTTE
 * le clausole sono tautologiche. Non coincide con la validità classica (formula
 * vera per ogni assegnamento) calcolata su formule arbitrarie: è il criterio
 * usato anche dal validatore di file DIMACS.
 */
public class ClauseAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(ClauseAnalyzer.class.getName());

    private static final char CONJUNCTION = '*';

    //region APPIATTIMENTO

    /**
     * Serializza una formula CNF senza parentesi.
     *
     * @param cnf formula in CNF (null per la formula vuota)
     * @return rappresentazione appiattita, stringa vuota per la formula vuota
     * @throws IllegalArgumentException se la formula non è in CNF
     */
    public String flattenToString(Formula cnf) {
        if (cnf == null) {
            return "";
        }
        requireCNF(cnf);

        StringBuilder result = new StringBuilder();
        appendFlattened(cnf, result);
        return result.toString();
    }

    private void appendFlattened(Formula node, StringBuilder out) {
        switch (node.getType()) {
            case ATOM -> out.append(node.getAtom());
            case NOT -> {
                out.append(Formula.Type.NOT.symbol());
                appendFlattened(node.getOperand(), out);
            }
            case AND, OR, IMPLIES -> {
                appendFlattened(node.getLeft(), out);
                out.append(node.getType().symbol());
                appendFlattened(node.getRight(), out);
            }
        }
    }

    /**
     * Clausole della formula nella forma appiattita, in ordine di apparizione.
     */
    public List<String> clauseTokens(Formula cnf) {
        String flattened = flattenToString(cnf);
        if (flattened.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> tokens = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= flattened.length(); i++) {
            if (i == flattened.length() || flattened.charAt(i) == CONJUNCTION) {
                tokens.add(flattened.substring(start, i));
                start = i + 1;
            }
        }
        return tokens;
    }

    /**
     * Clausole della formula come insiemi di variabili affermate e negate.
     */
    public List<Clause> clauses(Formula cnf) {
        List<Clause> clauses = new ArrayList<>();
        for (String token : clauseTokens(cnf)) {
            clauses.add(Clause.parse(token));
        }
        return clauses;
    }

    //endregion

    //region CONTEGGI E CLASSIFICAZIONE

    /**
     * Numero di congiunti di primo livello (0 per la formula vuota).
     */
    public int countClauses(Formula cnf) {
        return clauseTokens(cnf).size();
    }

    /**
     * Verifica se una clausola appiattita contiene una variabile sia affermata sia negata.
     *
     * @param token clausola nella forma "p+~q+r"
     * @return true se la clausola è tautologica
     */
    public boolean isTautologicalClause(String token) {
        return Clause.parse(token).isTautological();
    }

    /**
     * Classifica tutte le clausole con un solo appiattimento della formula.
     *
     * @param cnf formula in CNF (null per la formula vuota)
     * @return conteggi di clausole tautologiche e non tautologiche
     */
    public ClauseSummary summarize(Formula cnf) {
        return summarize(clauseTokens(cnf));
    }

    /**
     * Classifica clausole già appiattite, ad esempio quelle di {@link #clauseTokens(Formula)}.
     */
    public ClauseSummary summarize(List<String> tokens) {
        int tautological = 0;
        for (String token : tokens) {
            if (isTautologicalClause(token)) {
                tautological++;
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest("Clausola tautologica: " + token);
                }
            }
        }

        ClauseSummary summary = new ClauseSummary(tautological, tokens.size() - tautological);
        LOGGER.fine("Clausole tautologiche: " + summary.tautological() + "/" + summary.total());
        return summary;
    }

    /**
     * Numero di clausole tautologiche.
     */
    public int countTautologicalClauses(Formula cnf) {
        return summarize(cnf).tautological();
    }

    /**
     * Numero di clausole non tautologiche.
     */
    public int countNonTautologicalClauses(Formula cnf) {
        return summarize(cnf).nonTautological();
    }

    /**
     * Vera se ogni clausola della formula è tautologica.
     * La formula vuota, priva di clausole, è considerata valida.
     */
    public boolean isValidCnf(Formula cnf) {
        return summarize(cnf).isValid();
    }

    //endregion

    private static void requireCNF(Formula formula) {
        if (!CNFConverter.isInCNF(formula)) {
            throw new IllegalArgumentException("La formula non è in CNF: " + formula);
        }
    }
}
