package org.prop.semantics;

import org.prop.support.InferenceRule;
import org.prop.support.Model;
import org.prop.support.Tokens;
import org.prop.syntax.Formula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * VALUTATORE SEMANTICO - Valori di verità, enumerazione dei modelli, classificazione
 *
 * Tutte le operazioni sono visite ricorsive pure dell'albero immutabile: nessuno stato
 * condiviso, nessun I/O.
 *
 * OPERAZIONI:
 * • evaluate: valore di verità di una formula in un modello che ne copre le variabili
 * • allModels: tutti i 2^n assegnamenti su n variabili, in ordine di contatore binario
 * • truthValues: valutazione pigra su una sequenza di modelli
 * • isTautology / isContradiction / isSatisfiable: enumerazione esaustiva con
 *   interruzione al primo modello decisivo
 * • evaluateInference / isSoundInference: correttezza semantica di una regola
 *
 * COMPLESSITÀ:
 * L'enumerazione è esponenziale nel numero di variabili (2^n modelli). È il limite
 * combinatorio intrinseco della verifica per forza bruta; con più di
 * {@value #MAX_ENUMERABLE_VARIABLES} variabili il contatore non è rappresentabile.
 */
public final class Evaluator {

    private static final Logger LOGGER = Logger.getLogger(Evaluator.class.getName());

    /** Numero massimo di variabili enumerabili con un contatore long */
    public static final int MAX_ENUMERABLE_VARIABLES = 62;

    private Evaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region VALUTAZIONE

    /**
     * Calcola il valore di verità della formula nel modello.
     *
     * Entrambi gli operandi di un nodo binario vengono sempre valutati, il sinistro prima
     * del destro.
     *
     * @param formula formula da valutare
     * @param model modello sulle variabili della formula (eventualmente più ampio)
     * @return valore di verità della formula nel modello
     * @throws IllegalArgumentException se il modello non copre tutte le variabili
     */
    public static boolean evaluate(Formula formula, Model model) {
        if (formula == null || model == null) {
            throw new IllegalArgumentException("Formula e modello non possono essere null");
        }
        if (!model.isValidOver(formula)) {
            Set<String> missing = new HashSet<>(formula.variables());
            missing.removeAll(model.variables());
            throw new IllegalArgumentException("Il modello " + model
                    + " non assegna le variabili " + missing + " di " + formula);
        }
        return evaluateNode(formula, model);
    }

    private static boolean evaluateNode(Formula formula, Model model) {
        return switch (formula.getType()) {
            case VARIABLE -> model.get(formula.getRoot());
            case CONSTANT -> Tokens.TRUE.equals(formula.getRoot());
            case UNARY -> !evaluateNode(formula.getFirst(), model);
            case BINARY -> {
                boolean left = evaluateNode(formula.getFirst(), model);
                boolean right = evaluateNode(formula.getSecond(), model);
                yield formula.getOperator().apply(left, right);
            }
        };
    }

    //endregion

    //region ENUMERAZIONE DEI MODELLI

    /**
     * Enumera tutti i modelli sui nomi di variabile indicati.
     *
     * L'ordine è quello di un contatore binario a n bit da tutti falsi a tutti veri
     * (falso = 0, vero = 1), con la prima variabile come bit più significativo.
     * Per ["p", "q"]: {p=F,q=F}, {p=F,q=T}, {p=T,q=F}, {p=T,q=T}.
     * Con zero variabili si ottiene un solo modello, vuoto.
     *
     * La sequenza è pigra e riavviabile: ogni chiamata a iterator() riparte dall'inizio.
     *
     * @param variableNames nomi di variabile distinti, nell'ordine dei bit
     * @return sequenza dei 2^n modelli
     * @throws IllegalArgumentException se un nome non è una variabile, è ripetuto, o le
     *         variabili sono più di {@value #MAX_ENUMERABLE_VARIABLES}
     */
    public static Iterable<Model> allModels(List<String> variableNames) {
        if (variableNames == null) {
            throw new IllegalArgumentException("La lista di variabili non può essere null");
        }
        Set<String> seen = new HashSet<>();
        for (String name : variableNames) {
            if (!Tokens.isVariable(name)) {
                throw new IllegalArgumentException("Non è un nome di variabile: " + name);
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Variabile ripetuta: " + name);
            }
        }
        if (variableNames.size() > MAX_ENUMERABLE_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili da enumerare: " + variableNames.size());
        }

        List<String> names = Collections.unmodifiableList(new ArrayList<>(variableNames));
        return () -> new ModelIterator(names);
    }

    /**
     * Contatore binario sui modelli.
     */
    private static final class ModelIterator implements Iterator<Model> {
        private final List<String> names;
        private final long total;
        private long mask;

        ModelIterator(List<String> names) {
            this.names = names;
            this.total = 1L << names.size();
            this.mask = 0;
        }

        @Override
        public boolean hasNext() {
            return mask < total;
        }

        @Override
        public Model next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Modelli esauriti");
            }

            int n = names.size();
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int i = 0; i < n; i++) {
                assignment.put(names.get(i), ((mask >> (n - 1 - i)) & 1L) == 1L);
            }
            mask++;
            return new Model(assignment);
        }
    }

    /**
     * Valuta pigramente la formula su ogni modello, preservandone l'ordine.
     *
     * @param formula formula da valutare
     * @param models sequenza di modelli validi sulla formula
     * @return sequenza dei valori di verità, della stessa lunghezza di models
     */
    public static Iterable<Boolean> truthValues(Formula formula, Iterable<Model> models) {
        if (formula == null || models == null) {
            throw new IllegalArgumentException("Formula e modelli non possono essere null");
        }
        return () -> new Iterator<Boolean>() {
            private final Iterator<Model> source = models.iterator();

            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public Boolean next() {
                return evaluate(formula, source.next());
            }
        };
    }

    //endregion

    //region CLASSIFICAZIONE

    /**
     * @return true se la formula è vera in ogni modello sulle sue variabili
     */
    public static boolean isTautology(Formula formula) {
        boolean result = !existsModel(formula, false);
        LOGGER.fine(() -> "Tautologia " + formula + ": " + result);
        return result;
    }

    /**
     * @return true se la formula è falsa in ogni modello sulle sue variabili
     */
    public static boolean isContradiction(Formula formula) {
        boolean result = !existsModel(formula, true);
        LOGGER.fine(() -> "Contraddizione " + formula + ": " + result);
        return result;
    }

    /**
     * @return true se la formula è vera in almeno un modello sulle sue variabili
     */
    public static boolean isSatisfiable(Formula formula) {
        boolean result = existsModel(formula, true);
        LOGGER.fine(() -> "Soddisfacibile " + formula + ": " + result);
        return result;
    }

    /**
     * Cerca, in ordine alfabetico delle variabili, un modello in cui la formula assume il
     * valore indicato; si ferma al primo trovato.
     */
    private static boolean existsModel(Formula formula, boolean wanted) {
        if (formula == null) {
            throw new IllegalArgumentException("La formula non può essere null");
        }
        for (Model model : allModels(sortedVariables(formula.variables()))) {
            if (evaluateNode(formula, model) == wanted) {
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest("Modello decisivo per " + formula + ": " + model);
                }
                return true;
            }
        }
        return false;
    }

    /**
     * @return nomi di variabile in ordine alfabetico, l'ordine usato per l'enumerazione
     */
    static List<String> sortedVariables(Collection<String> variables) {
        List<String> sorted = new ArrayList<>(variables);
        Collections.sort(sorted);
        return sorted;
    }

    //endregion

    //region REGOLE DI INFERENZA

    /**
     * Verifica se la regola vale nel modello: qualche assunzione è falsa, oppure la
     * conclusione è vera.
     *
     * @param rule regola da verificare
     * @param model modello valido su tutte le formule della regola
     * @return true se la regola vale nel modello
     * @throws IllegalArgumentException se il modello non copre le variabili della regola
     */
    public static boolean evaluateInference(InferenceRule rule, Model model) {
        if (rule == null || model == null) {
            throw new IllegalArgumentException("Regola e modello non possono essere null");
        }
        if (!model.variables().containsAll(rule.variables())) {
            throw new IllegalArgumentException("Il modello " + model + " non copre le variabili di " + rule);
        }

        for (Formula assumption : rule.getAssumptions()) {
            if (!evaluateNode(assumption, model)) {
                return true;
            }
        }
        return evaluateNode(rule.getConclusion(), model);
    }

    /**
     * Verifica se la conclusione segue semanticamente dalle assunzioni: la regola deve
     * valere in ogni modello sulle variabili della regola.
     *
     * @param rule regola da verificare
     * @return true se la regola è corretta
     */
    public static boolean isSoundInference(InferenceRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("La regola non può essere null");
        }
        for (Model model : allModels(sortedVariables(rule.variables()))) {
            if (!evaluateInference(rule, model)) {
                LOGGER.fine(() -> "Regola non corretta " + rule + ", controesempio " + model);
                return false;
            }
        }
        LOGGER.fine(() -> "Regola corretta " + rule);
        return true;
    }

    //endregion
}
