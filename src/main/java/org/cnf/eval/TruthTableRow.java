package org.cnf.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Riga della tabella di verità.
 *
 * @param index valore del contatore di enumerazione che ha generato la riga
 * @param assignment assegnamento delle variabili, in ordine lessicografico
 * @param value valore di verità della formula (0 o 1)
 */
public record TruthTableRow(long index, Map<String, Boolean> assignment, int value) {

    public TruthTableRow {
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    /**
     * Valori delle variabili come stringa binaria, la prima variabile a sinistra.
     */
    public String bits() {
        StringBuilder bits = new StringBuilder(assignment.size());
        for (Boolean bit : assignment.values()) {
            bits.append(bit ? '1' : '0');
        }
        return bits.toString();
    }

    public boolean isTrue() {
        return value == 1;
    }
}
