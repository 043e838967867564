package org.prop.syntax;

import org.prop.support.Tokens;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * MOTORE DI SOSTITUZIONE - Riscritture strutturali dell'albero sintattico
 *
 * Entrambe le operazioni producono una nuova formula e lasciano intatta quella di
 * partenza. Le sostituzioni sono a singolo passaggio: solo le occorrenze originate
 * nella formula di partenza vengono riscritte, mai quelle introdotte dalle sostituzioni.
 *
 * SOSTITUZIONE DI VARIABILI:
 * Ogni occorrenza di una variabile presente nella mappa viene rimpiazzata dalla formula
 * associata. Costanti e variabili non mappate restano invariate.
 * Esempio: ((p-&gt;p)|r) con {p: (q&amp;r), r: p} diventa (((q&amp;r)-&gt;(q&amp;r))|p)
 *
 * SOSTITUZIONE DI OPERATORI:
 * Ogni costante o operatore presente nella mappa viene rimpiazzato dal modello associato,
 * in cui p indica il primo operando e q il secondo ({@link OperandMarker}).
 * La riscrittura procede dal basso: prima i figli, poi il nodo corrente.
 * Esempio: ((x&amp;y)&amp;~z) con {&amp;: ~(~p|~q)} diventa ~(~~(~x|~y)|~~z)
 */
public final class FormulaSubstitution {

    private static final Logger LOGGER = Logger.getLogger(FormulaSubstitution.class.getName());

    private FormulaSubstitution() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region SOSTITUZIONE DI VARIABILI

    /**
     * Sostituisce ogni variabile chiave della mappa con la formula corrispondente.
     *
     * @param formula formula di partenza
     * @param substitutionMap mappa nome variabile → formula sostitutiva
     * @return formula risultante dalle sostituzioni
     * @throws IllegalArgumentException se una chiave non è un nome di variabile
     */
    public static Formula substituteVariables(Formula formula, Map<String, Formula> substitutionMap) {
        requireFormula(formula);
        if (substitutionMap == null) {
            throw new IllegalArgumentException("La mappa di sostituzione non può essere null");
        }
        for (Map.Entry<String, Formula> entry : substitutionMap.entrySet()) {
            if (!Tokens.isVariable(entry.getKey())) {
                throw new IllegalArgumentException("Chiave di sostituzione non è una variabile: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Formula sostitutiva null per la variabile " + entry.getKey());
            }
        }

        Formula result = rewriteVariables(formula, substitutionMap);
        LOGGER.fine(() -> "Sostituzione variabili: " + formula + " -> " + result);
        return result;
    }

    private static Formula rewriteVariables(Formula formula, Map<String, Formula> substitutionMap) {
        return switch (formula.getType()) {
            case VARIABLE -> substitutionMap.getOrDefault(formula.getRoot(), formula);
            case CONSTANT -> formula;
            case UNARY -> new Formula(formula.getRoot(),
                    rewriteVariables(formula.getFirst(), substitutionMap));
            case BINARY -> new Formula(formula.getRoot(),
                    rewriteVariables(formula.getFirst(), substitutionMap),
                    rewriteVariables(formula.getSecond(), substitutionMap));
        };
    }

    //endregion

    //region SOSTITUZIONE DI OPERATORI

    /**
     * Sostituisce ogni costante od operatore chiave della mappa con il modello associato,
     * applicato agli operandi (già riscritti) del nodo.
     *
     * @param formula formula di partenza
     * @param substitutionMap mappa simbolo → modello sulle sole variabili p e q
     * @return formula risultante dalle sostituzioni
     * @throws IllegalArgumentException se una chiave non è costante od operatore, o se un
     *         modello usa variabili diverse dai parametri formali
     */
    public static Formula substituteOperators(Formula formula, Map<String, Formula> substitutionMap) {
        requireFormula(formula);
        if (substitutionMap == null) {
            throw new IllegalArgumentException("La mappa di sostituzione non può essere null");
        }
        for (Map.Entry<String, Formula> entry : substitutionMap.entrySet()) {
            String key = entry.getKey();
            if (!Tokens.isConstant(key) && !Tokens.isUnary(key) && !Tokens.isBinary(key)) {
                throw new IllegalArgumentException("Chiave di sostituzione non è costante né operatore: " + key);
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Modello null per il simbolo " + key);
            }
            for (String variable : entry.getValue().variables()) {
                if (!OperandMarker.isMarker(variable)) {
                    throw new IllegalArgumentException("Il modello per '" + key
                            + "' usa la variabile " + variable + " che non è un parametro formale");
                }
            }
        }

        Formula result = rewriteOperators(formula, substitutionMap);
        LOGGER.fine(() -> "Sostituzione operatori: " + formula + " -> " + result);
        return result;
    }

    private static Formula rewriteOperators(Formula formula, Map<String, Formula> substitutionMap) {
        if (formula.getType() == Formula.Type.VARIABLE) {
            return formula;
        }

        // Prima i figli
        Formula first = formula.getFirst() != null
                ? rewriteOperators(formula.getFirst(), substitutionMap) : null;
        Formula second = formula.getSecond() != null
                ? rewriteOperators(formula.getSecond(), substitutionMap) : null;

        Formula template = substitutionMap.get(formula.getRoot());
        if (template == null) {
            return new Formula(formula.getRoot(), first, second);
        }

        // Istanziazione del modello: p -> primo operando, q -> secondo operando
        Map<String, Formula> bindings = new HashMap<>();
        if (first != null) {
            bindings.put(OperandMarker.FIRST.variableName(), first);
        }
        if (second != null) {
            bindings.put(OperandMarker.SECOND.variableName(), second);
        }
        return rewriteVariables(template, bindings);
    }

    //endregion

    private static void requireFormula(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("La formula non può essere null");
        }
    }
}
