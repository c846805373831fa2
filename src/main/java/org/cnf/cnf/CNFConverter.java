package org.cnf.cnf;

import org.cnf.formula.ComputationInterruptedException;
import org.cnf.formula.Formula;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Trasformazione di formule proposizionali in Forma Normale Congiuntiva (CNF)
 *
 * La conversione avviene in tre passate ordinate, ognuna delle quali presuppone
 * il completamento della precedente:
 * 1. eliminazione delle implicazioni
 * 2. forma normale negativa (NNF) con le leggi di De Morgan
 * 3. distribuzione di OR su AND
 *
 * Ogni passata costruisce un nuovo albero e non modifica quello ricevuto.
 * Eseguire le passate in un ordine diverso o saltarne una non è supportato.
 *
 * ATTENZIONE: la distribuzione può far crescere la formula in modo esponenziale
 * (ad esempio una disgiunzione di n congiunzioni binarie produce 2^n clausole).
 * È una proprietà intrinseca della CNF equivalente, non un difetto. Per questo
 * la distribuzione controlla il flag di interruzione del thread a ogni passo e
 * termina con {@link ComputationInterruptedException} quando è impostato.
 */
public class CNFConverter {

    private static final Logger LOGGER = Logger.getLogger(CNFConverter.class.getName());

    //region INTERFACCIA PUBBLICA CONVERSIONE CNF

    /**
     * METODO PRINCIPALE - Converte la formula in Forma Normale Congiuntiva
     *
     * PIPELINE TRASFORMAZIONE:
     * 1. Eliminazione implicazioni: (A>B) -> ((~A)+B)
     * 2. Normalizzazione negazioni (NNF)
     * 3. Distribuzione OR su AND
     *
     * @param formula formula da convertire (null per la formula vuota)
     * @return formula in CNF logicamente equivalente all'originale (null se vuota)
     */
    public Formula toCNF(Formula formula) {
        if (formula == null) {
            LOGGER.fine("Formula vuota: nessuna conversione CNF necessaria");
            return null;
        }

        try {
            LOGGER.fine("Inizio conversione CNF per: " + formula);

            // Fase 1: Eliminazione implicazioni
            Formula result = eliminateImplications(formula);
            LOGGER.finest("Dopo eliminazione implicazioni: " + result);

            // Fase 2: Normalizzazione negazioni (leggi di De Morgan)
            result = toNegationNormalForm(result);
            LOGGER.finest("Dopo normalizzazione negazioni: " + result);

            // Fase 3: Distribuzione OR su AND
            result = distribute(result);
            LOGGER.fine("Conversione CNF completata: " + result);

            return result;

        } catch (ComputationInterruptedException e) {
            LOGGER.fine("Conversione CNF interrotta per: " + formula);
            throw e;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Errore durante conversione CNF per formula: " + formula, e);
            throw e;
        }
    }

    //endregion

    //region ELIMINAZIONE IMPLICAZIONI

    /**
     * Riscrive ogni implicazione (A>B) come ((~A)+B), ricorsivamente.
     *
     * Postcondizione: nessun nodo IMPLIES rimane nell'albero.
     *
     * @param node radice del sottoalbero
     * @return nuovo albero senza implicazioni
     */
    public Formula eliminateImplications(Formula node) {
        return switch (node.getType()) {
            case ATOM -> node; // Caso base: atomi invariati

            case NOT -> Formula.not(eliminateImplications(node.getOperand()));

            case AND, OR -> Formula.binary(node.getType(),
                    eliminateImplications(node.getLeft()),
                    eliminateImplications(node.getRight()));

            case IMPLIES -> Formula.or(
                    Formula.not(eliminateImplications(node.getLeft())),
                    eliminateImplications(node.getRight()));
        };
    }

    //endregion

    //region NORMALIZZAZIONE NEGAZIONI (LEGGI DE MORGAN)

    /**
     * Spinge le negazioni verso le foglie usando le leggi di De Morgan.
     *
     * TRASFORMAZIONI APPLICATE:
     * • ~(A + B) -> (~A) * (~B)
     * • ~(A * B) -> (~A) + (~B)
     * • ~~A -> A
     * • Negazioni atomiche preservate: ~p rimane ~p
     *
     * Postcondizione: ogni NOT ha come operando un atomo.
     *
     * @param node radice di un albero senza implicazioni
     * @return nuovo albero in forma normale negativa
     * @throws IllegalStateException se l'albero contiene ancora implicazioni
     */
    public Formula toNegationNormalForm(Formula node) {
        return switch (node.getType()) {
            case ATOM -> node;

            case NOT -> applyNegation(node.getOperand());

            case AND, OR -> Formula.binary(node.getType(),
                    toNegationNormalForm(node.getLeft()),
                    toNegationNormalForm(node.getRight()));

            case IMPLIES -> throw implicationNotEliminated(node);
        };
    }

    /**
     * Calcola la NNF di ~inner.
     */
    private Formula applyNegation(Formula inner) {
        return switch (inner.getType()) {
            case ATOM ->
                // ~p rimane ~p (forma normale per letterali)
                    Formula.not(inner);

            case NOT ->
                // ~~A -> A (eliminazione doppia negazione)
                    toNegationNormalForm(inner.getOperand());

            case OR ->
                // ~(A + B) -> (~A) * (~B)
                    Formula.and(applyNegation(inner.getLeft()), applyNegation(inner.getRight()));

            case AND ->
                // ~(A * B) -> (~A) + (~B)
                    Formula.or(applyNegation(inner.getLeft()), applyNegation(inner.getRight()));

            case IMPLIES -> throw implicationNotEliminated(inner);
        };
    }

    //endregion

    //region DISTRIBUZIONE OR SU AND

    /**
     * Ricostruisce l'albero in modo che nessun OR abbia un AND come operando.
     *
     * • letterali: invariati
     * • A * B: distribuzione ricorsiva su entrambi i figli
     * • A + B: distribuzione ricorsiva sui figli, poi {@link #distr(Formula, Formula)}
     *
     * @param node radice di un albero in NNF
     * @return nuovo albero in CNF
     * @throws IllegalStateException se l'albero contiene ancora implicazioni
     */
    public Formula distribute(Formula node) {
        ComputationInterruptedException.checkForInterruption("la distribuzione");
        return switch (node.getType()) {
            case ATOM -> node;

            case NOT -> {
                if (node.getOperand().isAtom()) {
                    yield node;
                }
                // Dovrebbe essere già risolto da toNegationNormalForm
                LOGGER.warning("Negazione non atomica trovata durante distribuzione: " + node);
                yield distribute(toNegationNormalForm(node));
            }

            case AND -> Formula.and(distribute(node.getLeft()), distribute(node.getRight()));

            case OR -> distr(distribute(node.getLeft()), distribute(node.getRight()));

            case IMPLIES -> throw implicationNotEliminated(node);
        };
    }

    /**
     * Costruisce la disgiunzione di due formule già in CNF distribuendo OR su AND.
     *
     * PROPRIETÀ DISTRIBUTIVA APPLICATA:
     * • (L * R) + B -> (L + B) * (R + B)
     * • A + (L * R) -> (A + L) * (A + R)
     * • letterale + letterale rimane invariato
     *
     * @param a primo disgiunto, in CNF
     * @param b secondo disgiunto, in CNF
     * @return formula in CNF equivalente ad (a + b)
     */
    public Formula distr(Formula a, Formula b) {
        ComputationInterruptedException.checkForInterruption("la distribuzione");
        if (a.isLiteral() && b.isLiteral()) {
            return Formula.or(a, b);
        }

        if (a.getType() == Formula.Type.AND) {
            return Formula.and(distr(a.getLeft(), b), distr(a.getRight(), b));
        }

        if (b.getType() == Formula.Type.AND) {
            return Formula.and(distr(a, b.getLeft()), distr(a, b.getRight()));
        }

        // Entrambi clausole (OR di letterali): nessun AND da distribuire
        return Formula.or(a, b);
    }

    //endregion

    //region VERIFICHE DI FORMA

    /**
     * @return true se l'albero non contiene implicazioni
     */
    public static boolean isImplicationFree(Formula node) {
        return switch (node.getType()) {
            case ATOM -> true;
            case NOT -> isImplicationFree(node.getOperand());
            case AND, OR -> isImplicationFree(node.getLeft()) && isImplicationFree(node.getRight());
            case IMPLIES -> false;
        };
    }

    /**
     * @return true se l'albero non contiene implicazioni e ogni NOT nega un atomo
     */
    public static boolean isInNegationNormalForm(Formula node) {
        return switch (node.getType()) {
            case ATOM -> true;
            case NOT -> node.getOperand().isAtom();
            case AND, OR -> isInNegationNormalForm(node.getLeft()) && isInNegationNormalForm(node.getRight());
            case IMPLIES -> false;
        };
    }

    /**
     * Verifica la forma CNF: NNF e nessun OR con un AND come operando.
     */
    public static boolean isInCNF(Formula node) {
        return switch (node.getType()) {
            case ATOM -> true;
            case NOT -> node.getOperand().isAtom();
            case AND -> isInCNF(node.getLeft()) && isInCNF(node.getRight());
            case OR -> isClause(node.getLeft()) && isClause(node.getRight());
            case IMPLIES -> false;
        };
    }

    /**
     * Una clausola è un letterale o una disgiunzione di clausole.
     */
    private static boolean isClause(Formula node) {
        return switch (node.getType()) {
            case ATOM -> true;
            case NOT -> node.getOperand().isAtom();
            case OR -> isClause(node.getLeft()) && isClause(node.getRight());
            case AND, IMPLIES -> false;
        };
    }

    private static IllegalStateException implicationNotEliminated(Formula node) {
        return new IllegalStateException("Implicazione non eliminata prima della passata corrente: " + node);
    }

    //endregion
}
