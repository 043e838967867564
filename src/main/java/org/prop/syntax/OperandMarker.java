package org.prop.syntax;

/**
 * Parametri formali dei modelli usati nella sostituzione di operatori.
 *
 * Un modello come ~(~p|~q) descrive un operatore in funzione dei propri operandi:
 * p sta per il primo operando, q per il secondo.
 */
public enum OperandMarker {

    FIRST("p"),
    SECOND("q");

    private final String variableName;

    OperandMarker(String variableName) {
        this.variableName = variableName;
    }

    /**
     * @return nome di variabile riservato al parametro
     */
    public String variableName() {
        return variableName;
    }

    /**
     * @return true se il nome indicato è uno dei due parametri formali
     */
    public static boolean isMarker(String name) {
        for (OperandMarker marker : values()) {
            if (marker.variableName.equals(name)) {
                return true;
            }
        }
        return false;
    }
}
