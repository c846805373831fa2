package org.cnf.formula;

/**
 * La valutazione ha incontrato una variabile senza valore di verità assegnato.
 */
public class UnboundAtomException extends FormulaException {

    private final String atom;

    public UnboundAtomException(String atom) {
        super("Nessun valore assegnato alla variabile '" + atom + "'");
        this.atom = atom;
    }

    public String getAtom() {
        return atom;
    }
}
