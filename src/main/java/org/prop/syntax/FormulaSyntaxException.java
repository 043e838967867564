package org.prop.syntax;

/**
 * Errore di sintassi rilevato durante il parsing, con la diagnostica da restituire
 * nell'esito negativo. Interrompe la discesa al primo errore; non esce mai dai parser.
 */
final class FormulaSyntaxException extends RuntimeException {

    FormulaSyntaxException(String message) {
        super(message);
    }
}
