package org.cnf.formula;

/**
 * Errore di validazione di una formula fornita dal chiamante.
 *
 * Tutte le sottoclassi descrivono input non validi: l'elaborazione è
 * deterministica e non esistono errori transitori da ritentare.
 */
public abstract class FormulaException extends RuntimeException {

    protected FormulaException(String message) {
        super(message);
    }

    protected FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
