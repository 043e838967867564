package org.prop.syntax;

/**
 * ESITO DI PARSING - Formula letta e suffisso residuo, oppure messaggio di errore
 *
 * Prodotto dai parser a basso livello, che non sollevano mai eccezioni per input
 * malformati. Esattamente uno dei due casi è valorizzato:
 * • successo: formula non null, remainder = suffisso non consumato (eventualmente vuoto)
 * • fallimento: formula null, errorMessage leggibile dall'utente
 */
public final class ParseResult {

    private final Formula formula;
    private final String remainder;
    private final String errorMessage;

    private ParseResult(Formula formula, String remainder, String errorMessage) {
        this.formula = formula;
        this.remainder = remainder;
        this.errorMessage = errorMessage;
    }

    /**
     * @param formula formula letta (non null)
     * @param remainder suffisso non consumato (non null)
     */
    public static ParseResult success(Formula formula, String remainder) {
        if (formula == null || remainder == null) {
            throw new IllegalArgumentException("Un esito positivo richiede formula e suffisso non null");
        }
        return new ParseResult(formula, remainder, null);
    }

    /**
     * @param errorMessage diagnostica leggibile (non null)
     */
    public static ParseResult failure(String errorMessage) {
        if (errorMessage == null) {
            throw new IllegalArgumentException("Un esito negativo richiede un messaggio di errore");
        }
        return new ParseResult(null, null, errorMessage);
    }

    public boolean isSuccess() {
        return formula != null;
    }

    /**
     * @return true se la lettura è riuscita e non resta nulla da consumare
     */
    public boolean isComplete() {
        return isSuccess() && remainder.isEmpty();
    }

    /**
     * @return formula letta, null in caso di fallimento
     */
    public Formula getFormula() {
        return formula;
    }

    /**
     * @return suffisso non consumato, null in caso di fallimento
     */
    public String getRemainder() {
        return remainder;
    }

    /**
     * @return messaggio di errore, null in caso di successo
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ParseResult[formula=" + formula + ", remainder='" + remainder + "']"
                : "ParseResult[error=" + errorMessage + "]";
    }
}
