package org.cnf.formula;

/**
 * Formula sintatticamente non valida: parentesi sbilanciate, simbolo
 * sconosciuto o simboli in eccesso dopo la fine della formula.
 */
public class MalformedFormulaException extends FormulaException {

    /** Posizione (0-based) del simbolo incriminato, -1 se non nota */
    private final int position;

    public MalformedFormulaException(String message, int position) {
        super(position >= 0 ? message + " (posizione " + position + ")" : message);
        this.position = position;
    }

    public MalformedFormulaException(String message, int position, Throwable cause) {
        super(position >= 0 ? message + " (posizione " + position + ")" : message, cause);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
