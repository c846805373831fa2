package org.cnf.formula;

/**
 * Elaborazione interrotta perché il thread che la eseguiva ha ricevuto una
 * richiesta di interruzione (tipicamente allo scadere del timeout).
 *
 * Non descrive un errore della formula: per questo non estende {@link FormulaException}.
 */
public class ComputationInterruptedException extends RuntimeException {

    public ComputationInterruptedException(String message) {
        super(message);
    }

    /**
     * Interrompe l'elaborazione corrente se il thread è stato interrotto.
     * Il flag di interruzione del thread resta impostato.
     *
     * @param stage fase in corso, riportata nel messaggio
     * @throws ComputationInterruptedException se è stata richiesta l'interruzione
     */
    public static void checkForInterruption(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ComputationInterruptedException("Elaborazione interrotta durante " + stage);
        }
    }
}
