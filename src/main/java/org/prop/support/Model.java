package org.prop.support;

import org.prop.syntax.Formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * MODELLO - Assegnamento di valori di verità a nomi di variabile
 *
 * Contenitore immutabile: le chiavi sono nomi di variabile validi, l'ordine di
 * inserimento viene preservato (è quello prodotto dall'enumerazione dei modelli).
 *
 * Un modello è valido su una formula se ne copre tutte le variabili; può assegnare
 * anche variabili che la formula non usa.
 *
 * Uguaglianza e hash coincidono con quelli della mappa sottostante, quindi un modello
 * è uguale a un altro indipendentemente dall'ordine delle chiavi.
 */
public final class Model {

    /** Assegnamento variabile → valore, non modificabile */
    private final Map<String, Boolean> assignment;

    /**
     * Costruisce un modello validando chiavi e valori.
     *
     * @param assignment mappa nome variabile → valore di verità
     * @throws IllegalArgumentException se una chiave non è una variabile o un valore è null
     */
    public Model(Map<String, Boolean> assignment) {
        if (assignment == null) {
            throw new IllegalArgumentException("L'assegnamento non può essere null");
        }
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            if (!Tokens.isVariable(entry.getKey())) {
                throw new IllegalArgumentException("Chiave del modello non è una variabile: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Valore null per la variabile " + entry.getKey());
            }
        }

        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    /**
     * @return modello vuoto (nessuna variabile assegnata)
     */
    public static Model empty() {
        return new Model(Collections.emptyMap());
    }

    /**
     * @param name nome di variabile
     * @return valore assegnato
     * @throws IllegalArgumentException se la variabile non è assegnata dal modello
     */
    public boolean get(String name) {
        Boolean value = assignment.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Variabile non assegnata dal modello: " + name);
        }
        return value;
    }

    /**
     * @return nomi delle variabili su cui il modello è definito, in ordine di inserimento
     */
    public Set<String> variables() {
        return assignment.keySet();
    }

    /**
     * @return true se il modello assegna tutte le variabili della formula
     */
    public boolean isValidOver(Formula formula) {
        return assignment.keySet().containsAll(formula.variables());
    }

    /**
     * @return vista non modificabile dell'assegnamento
     */
    public Map<String, Boolean> asMap() {
        return assignment;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Model)) return false;
        return assignment.equals(((Model) obj).assignment);
    }

    @Override
    public int hashCode() {
        return assignment.hashCode();
    }

    @Override
    public String toString() {
        return assignment.toString();
    }
}
