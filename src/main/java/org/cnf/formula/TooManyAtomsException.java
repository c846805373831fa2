package org.cnf.formula;

/**
 * La tabella di verità richiederebbe più variabili di quante il contatore
 * di enumerazione possa rappresentare entro il limite configurato.
 */
public class TooManyAtomsException extends FormulaException {

    private final int atomCount;
    private final int maxAtoms;

    public TooManyAtomsException(int atomCount, int maxAtoms) {
        super("Tabella di verità con " + atomCount + " variabili non supportata (massimo " + maxAtoms + ")");
        this.atomCount = atomCount;
        this.maxAtoms = maxAtoms;
    }

    public int getAtomCount() {
        return atomCount;
    }

    public int getMaxAtoms() {
        return maxAtoms;
    }
}
