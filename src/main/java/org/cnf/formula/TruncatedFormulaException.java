package org.cnf.formula;

/**
 * La sequenza prefissa è terminata mentre era ancora atteso un sottoalbero.
 */
public class TruncatedFormulaException extends FormulaException {

    private final int position;

    public TruncatedFormulaException(String prefix, int position) {
        super("Formula prefissa incompleta: atteso un sottoalbero alla posizione "
                + position + " di '" + prefix + "'");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
