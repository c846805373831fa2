package org.cnf.eval;

import org.cnf.formula.ComputationInterruptedException;
import org.cnf.formula.Formula;
import org.cnf.formula.TooManyAtomsException;
import org.cnf.formula.UnboundAtomException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * VALUTATORE DI VERITÀ - Calcolo dei valori di verità di una formula
 *
 * Valuta una formula sotto un assegnamento delle variabili e ne enumera la
 * tabella di verità completa. La valutazione è una funzione pura di
 * (formula, assegnamento): l'albero non viene mai modificato.
 *
 * ORDINE CANONICO DELLA TABELLA:
 * le variabili sono ordinate lessicograficamente; per il contatore i da 0 a
 * 2^n - 1 la variabile j-esima assume il bit j della rappresentazione binaria
 * di i su n bit, con il bit più significativo assegnato alla prima variabile.
 */
public class TruthEvaluator {

    private static final Logger LOGGER = Logger.getLogger(TruthEvaluator.class.getName());

    /** Limite predefinito di variabili per la tabella di verità */
    public static final int DEFAULT_MAX_ATOMS = 20;

    /** Limite assoluto: 2^62 righe sono l'ultima potenza di due positiva per un contatore long */
    public static final int MAX_SUPPORTED_ATOMS = 62;

    private final int maxAtoms;

    public TruthEvaluator() {
        this(DEFAULT_MAX_ATOMS);
    }

    /**
     * @param maxAtoms numero massimo di variabili ammesso per le tabelle di verità
     * @throws IllegalArgumentException se il limite è fuori da [1, 62]
     */
    public TruthEvaluator(int maxAtoms) {
        if (maxAtoms < 1 || maxAtoms > MAX_SUPPORTED_ATOMS) {
            throw new IllegalArgumentException("Limite variabili deve essere tra 1 e "
                    + MAX_SUPPORTED_ATOMS + ", ricevuto: " + maxAtoms);
        }
        this.maxAtoms = maxAtoms;
    }

    public int getMaxAtoms() {
        return maxAtoms;
    }

    //region VALUTAZIONE

    /**
     * Valuta la formula sotto un assegnamento.
     *
     * • atomo: valore assegnato
     * • A + B: OR dei figli
     * • A * B: AND dei figli
     * • A > B: (NOT A) OR B
     * • ~A: complemento dell'operando
     *
     * @param formula formula da valutare (non vuota)
     * @param assignment valori delle variabili
     * @return 1 se la formula è vera, 0 altrimenti
     * @throws UnboundAtomException se una variabile della formula non ha valore
     */
    public int evaluate(Formula formula, Map<String, Boolean> assignment) {
        if (formula == null) {
            throw new IllegalArgumentException("Impossibile valutare la formula vuota");
        }
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento non può essere null");
        }
        return evaluateNode(formula, assignment) ? 1 : 0;
    }

    private boolean evaluateNode(Formula node, Map<String, Boolean> assignment) {
        return switch (node.getType()) {
            case ATOM -> {
                Boolean value = assignment.get(node.getAtom());
                if (value == null) {
                    throw new UnboundAtomException(node.getAtom());
                }
                yield value;
            }
            case NOT -> !evaluateNode(node.getOperand(), assignment);
            // Entrambi i figli vengono sempre valutati, così una variabile non assegnata
            // viene segnalata indipendentemente dal valore dell'altro ramo
            case AND -> evaluateNode(node.getLeft(), assignment) & evaluateNode(node.getRight(), assignment);
            case OR -> evaluateNode(node.getLeft(), assignment) | evaluateNode(node.getRight(), assignment);
            case IMPLIES -> !evaluateNode(node.getLeft(), assignment) | evaluateNode(node.getRight(), assignment);
        };
    }

    //endregion

    //region TABELLA DI VERITÀ

    /**
     * Variabili della formula in ordine lessicografico.
     */
    public SortedSet<String> enumerateAtoms(Formula formula) {
        if (formula == null) {
            return new TreeSet<>();
        }
        return new TreeSet<>(formula.atoms());
    }

    /**
     * Enumera la tabella di verità della formula.
     *
     * La sequenza è calcolata in modo pigro: ogni chiamata a iterator() riparte
     * dalla prima riga e produce 2^n righe in ordine crescente di contatore.
     * Ogni riga controlla il flag di interruzione del thread corrente e, se
     * impostato, lancia {@link ComputationInterruptedException}.
     *
     * @param formula formula da tabulare (non vuota)
     * @return sequenza finita e riavviabile delle righe
     * @throws TooManyAtomsException se la formula ha più variabili del limite configurato
     */
    public Iterable<TruthTableRow> truthTable(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Impossibile tabulare la formula vuota");
        }

        List<String> atoms = new ArrayList<>(enumerateAtoms(formula));
        if (atoms.size() > maxAtoms) {
            throw new TooManyAtomsException(atoms.size(), maxAtoms);
        }

        LOGGER.fine("Tabella di verità con " + atoms.size() + " variabili: " + atoms);
        return () -> new RowIterator(formula, atoms);
    }

    /**
     * Numero di righe della tabella di verità (2^n).
     *
     * @throws IllegalArgumentException per la formula vuota
     * @throws TooManyAtomsException se la formula ha più variabili del limite configurato
     */
    public long rowCount(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Impossibile tabulare la formula vuota");
        }
        int atoms = enumerateAtoms(formula).size();
        if (atoms > maxAtoms) {
            throw new TooManyAtomsException(atoms, maxAtoms);
        }
        return 1L << atoms;
    }

    /**
     * Iteratore sulle righe: il contatore scorre da 0 a 2^n - 1.
     */
    private final class RowIterator implements Iterator<TruthTableRow> {
        private final Formula formula;
        private final List<String> atoms;
        private final long rows;
        private long counter;

        RowIterator(Formula formula, List<String> atoms) {
            this.formula = formula;
            this.atoms = atoms;
            this.rows = 1L << atoms.size();
            this.counter = 0;
        }

        @Override
        public boolean hasNext() {
            return counter < rows;
        }

        @Override
        public TruthTableRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Tabella di verità esaurita dopo " + rows + " righe");
            }
            ComputationInterruptedException.checkForInterruption("la tabella di verità");

            int n = atoms.size();
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int j = 0; j < n; j++) {
                // Bit più significativo alla prima variabile
                assignment.put(atoms.get(j), ((counter >>> (n - 1 - j)) & 1L) == 1L);
            }

            TruthTableRow row = new TruthTableRow(counter, assignment, evaluate(formula, assignment));
            counter++;
            return row;
        }
    }

    //endregion
}
