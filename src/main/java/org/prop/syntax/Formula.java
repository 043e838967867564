package org.prop.syntax;

import org.prop.support.Operator;
import org.prop.support.Tokens;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero i cui nodi sono
 * variabili, costanti, applicazioni dell'operatore unario o di uno dei sette operatori
 * binari. Ogni nodo possiede in esclusiva i propri sottoalberi: niente condivisione
 * mutabile, niente cicli.
 *
 * INVARIANTI DI FORMA:
 * • VARIABLE / CONSTANT: nessun figlio
 * • UNARY: esattamente un figlio (first)
 * • BINARY: esattamente due figli (first, second)
 * La violazione è un errore di programmazione e solleva IllegalArgumentException.
 *
 * RAPPRESENTAZIONI TESTUALI:
 * • Standard (infissa): ogni applicazione binaria è completamente parentesizzata,
 *   ad esempio ~(p&amp;q76) oppure ((p-&gt;q)|~r). Nessuna precedenza né associatività.
 * • Polacca (prefissa): nessuna parentesi né separatore, ad esempio ~&amp;pq76.
 *
 * UGUAGLIANZA:
 * Strutturale e ricorsiva. Poiché la notazione standard è non ambigua, due formule sono
 * uguali se e solo se le loro stringhe standard coincidono carattere per carattere.
 *
 * Gli insiemi derivati (variabili, operatori) sono calcolati una sola volta in
 * costruzione; la stringa standard è calcolata alla prima richiesta e poi riusata.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipologie di nodo dell'albero.
     */
    public enum Type {
        VARIABLE,   // p, q76
        CONSTANT,   // T, F
        UNARY,      // ~A
        BINARY      // (A op B)
    }

    /** Tipologia del nodo */
    private final Type type;

    /** Nome variabile, simbolo costante o simbolo operatore */
    private final String root;

    /** Primo operando (solo UNARY e BINARY) */
    private final Formula first;

    /** Secondo operando (solo BINARY) */
    private final Formula second;

    /** Variabili presenti nel sottoalbero, immutabile */
    private final Set<String> variables;

    /** Operatori e costanti presenti nel sottoalbero, immutabile */
    private final Set<String> operators;

    /** Hash strutturale precalcolato */
    private final int hash;

    /** Rappresentazione standard, calcolata alla prima richiesta */
    private String standardString;

    //endregion

    //region COSTRUTTORI E FACTORY

    /**
     * Costruisce un nodo foglia (variabile o costante).
     *
     * @param root nome variabile o costante
     * @throws IllegalArgumentException se root non è una variabile né una costante
     */
    public Formula(String root) {
        this(root, null, null);
    }

    /**
     * Costruisce un nodo unario.
     *
     * @param root operatore unario
     * @param first operando
     * @throws IllegalArgumentException se la forma non è valida
     */
    public Formula(String root, Formula first) {
        this(root, first, null);
    }

    /**
     * Costruisce un nodo generico verificando l'invariante di forma.
     *
     * @param root radice (variabile, costante o operatore)
     * @param first primo operando, null per le foglie
     * @param second secondo operando, null per foglie e nodi unari
     * @throws IllegalArgumentException se root non è riconosciuta o l'arietà non corrisponde
     */
    public Formula(String root, Formula first, Formula second) {
        if (root == null) {
            throw new IllegalArgumentException("La radice della formula non può essere null");
        }

        if (Tokens.isVariable(root) || Tokens.isConstant(root)) {
            requireShape(root, first == null && second == null, "nessun operando");
            this.type = Tokens.isVariable(root) ? Type.VARIABLE : Type.CONSTANT;
        } else if (Tokens.isUnary(root)) {
            requireShape(root, first != null && second == null, "esattamente un operando");
            this.type = Type.UNARY;
        } else if (Tokens.isBinary(root)) {
            requireShape(root, first != null && second != null, "esattamente due operandi");
            this.type = Type.BINARY;
        } else {
            throw new IllegalArgumentException("Radice non riconosciuta: " + root);
        }

        this.root = root;
        this.first = first;
        this.second = second;
        this.variables = collectVariables();
        this.operators = collectOperators();
        this.hash = computeHash();
    }

    private static void requireShape(String root, boolean valid, String expected) {
        if (!valid) {
            throw new IllegalArgumentException("La radice '" + root + "' richiede " + expected);
        }
    }

    /**
     * @param name nome di variabile
     * @return formula atomica
     */
    public static Formula variable(String name) {
        return new Formula(name);
    }

    /**
     * @param value valore di verità
     * @return costante T o F
     */
    public static Formula constant(boolean value) {
        return new Formula(value ? Tokens.TRUE : Tokens.FALSE);
    }

    /**
     * @return negazione della formula indicata
     */
    public static Formula not(Formula operand) {
        return new Formula(Operator.NEGATION.symbol(), operand);
    }

    /**
     * @param operator operatore binario
     * @return applicazione binaria (left operator right)
     * @throws IllegalArgumentException se l'operatore non è binario
     */
    public static Formula binary(Operator operator, Formula left, Formula right) {
        if (operator == null || !operator.isBinary()) {
            throw new IllegalArgumentException("Operatore binario richiesto, ricevuto: " + operator);
        }
        return new Formula(operator.symbol(), left, right);
    }

    //endregion

    //region PARSING (DELEGA AI PARSER)

    /**
     * @return true se la stringa è una rappresentazione standard valida
     * @see StandardNotationParser#isFormula(String)
     */
    public static boolean isFormula(String string) {
        return StandardNotationParser.isFormula(string);
    }

    /**
     * @return formula la cui rappresentazione standard è la stringa indicata
     * @see StandardNotationParser#parse(String)
     */
    public static Formula parse(String string) {
        return StandardNotationParser.parse(string);
    }

    /**
     * @return formula la cui rappresentazione polacca è la stringa indicata
     * @see PolishNotationParser#parse(String)
     */
    public static Formula parsePolish(String string) {
        return PolishNotationParser.parse(string);
    }

    //endregion

    //region SOSTITUZIONI (DELEGA AL MOTORE)

    /**
     * @see FormulaSubstitution#substituteVariables(Formula, Map)
     */
    public Formula substituteVariables(Map<String, Formula> substitutionMap) {
        return FormulaSubstitution.substituteVariables(this, substitutionMap);
    }

    /**
     * @see FormulaSubstitution#substituteOperators(Formula, Map)
     */
    public Formula substituteOperators(Map<String, Formula> substitutionMap) {
        return FormulaSubstitution.substituteOperators(this, substitutionMap);
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    /**
     * @return nome variabile, simbolo costante o simbolo operatore della radice
     */
    public String getRoot() {
        return root;
    }

    /**
     * @return primo operando, null per le foglie
     */
    public Formula getFirst() {
        return first;
    }

    /**
     * @return secondo operando, null per foglie e nodi unari
     */
    public Formula getSecond() {
        return second;
    }

    /**
     * @return operatore della radice, null per variabili e costanti
     */
    public Operator getOperator() {
        return Operator.fromSymbol(root);
    }

    /**
     * @return insieme immutabile dei nomi di variabile presenti nella formula
     */
    public Set<String> variables() {
        return variables;
    }

    /**
     * @return insieme immutabile di operatori e costanti presenti nella formula
     */
    public Set<String> operators() {
        return operators;
    }

    //endregion

    //region INSIEMI DERIVATI

    private Set<String> collectVariables() {
        return switch (type) {
            case VARIABLE -> Collections.singleton(root);
            case CONSTANT -> Collections.emptySet();
            case UNARY -> first.variables;
            case BINARY -> {
                Set<String> union = new LinkedHashSet<>(first.variables);
                union.addAll(second.variables);
                yield Collections.unmodifiableSet(union);
            }
        };
    }

    private Set<String> collectOperators() {
        Set<String> result = new LinkedHashSet<>();
        switch (type) {
            case VARIABLE -> {
                return Collections.emptySet();
            }
            case CONSTANT -> result.add(root);
            case UNARY -> {
                result.add(root);
                result.addAll(first.operators);
            }
            case BINARY -> {
                result.add(root);
                result.addAll(first.operators);
                result.addAll(second.operators);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    //endregion

    //region RAPPRESENTAZIONI TESTUALI

    /**
     * Rappresentazione standard (infissa, completamente parentesizzata).
     *
     * @return stringa che, riletta da {@link #parse(String)}, produce una formula uguale
     */
    public String toStandardString() {
        String cached = standardString;
        if (cached == null) {
            StringBuilder builder = new StringBuilder();
            appendStandard(builder);
            cached = builder.toString();
            standardString = cached;
        }
        return cached;
    }

    private void appendStandard(StringBuilder builder) {
        switch (type) {
            case VARIABLE, CONSTANT -> builder.append(root);
            case UNARY -> {
                builder.append(root);
                first.appendStandard(builder);
            }
            case BINARY -> {
                builder.append(Tokens.OPEN_PARENTHESIS);
                first.appendStandard(builder);
                builder.append(root);
                second.appendStandard(builder);
                builder.append(Tokens.CLOSE_PARENTHESIS);
            }
        }
    }

    /**
     * Rappresentazione polacca (prefissa), senza parentesi né separatori.
     *
     * @return stringa che, riletta da {@link #parsePolish(String)}, produce una formula uguale
     */
    public String toPolishString() {
        StringBuilder builder = new StringBuilder();
        appendPolish(builder);
        return builder.toString();
    }

    private void appendPolish(StringBuilder builder) {
        builder.append(root);
        if (first != null) {
            first.appendPolish(builder);
        }
        if (second != null) {
            second.appendPolish(builder);
        }
    }

    @Override
    public String toString() {
        return toStandardString();
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza sintattica: stessa radice e operandi uguali ricorsivamente.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula)) return false;

        Formula other = (Formula) obj;
        return hash == other.hash
                && root.equals(other.root)
                && Objects.equals(first, other.first)
                && Objects.equals(second, other.second);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    private int computeHash() {
        int result = root.hashCode();
        result = 31 * result + (first != null ? first.hash : 0);
        result = 31 * result + (second != null ? second.hash : 0);
        return result;
    }

    //endregion
}
