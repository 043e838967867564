package org.prop.semantics;

import org.prop.support.Model;
import org.prop.support.Operator;
import org.prop.syntax.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SINTESI DI FORMULE - Da tavola di verità a forma normale (DNF o CNF)
 *
 * Data una lista di variabili e un valore per ciascuno dei 2^n modelli, nell'ordine di
 * {@link Evaluator#allModels(List)}, costruisce una formula con esattamente quella
 * tavola di verità.
 *
 * DNF ({@link #synthesize}):
 * • per ogni modello in cui il valore è vero, una clausola congiuntiva di letterali
 *   (variabile se vera nel modello, negata altrimenti) ordinati per nome
 * • disgiunzione di tutte le clausole, associata a sinistra
 * • nessun valore vero: (v&amp;~v) sulla prima variabile
 *
 * CNF ({@link #synthesizeCnf}):
 * • per ogni modello in cui il valore è falso, una clausola disgiuntiva che è falsa
 *   esattamente in quel modello (variabile negata se vera nel modello)
 * • congiunzione di tutte le clausole, associata a sinistra
 * • nessun valore falso: (v|~v) sulla prima variabile
 *
 * Esempio: synthesize([p, q], [T, T, T, F]) produce
 * (((~p&amp;~q)|(~p&amp;q))|(p&amp;~q))
 */
public final class FormulaSynthesizer {

    private static final Logger LOGGER = Logger.getLogger(FormulaSynthesizer.class.getName());

    private FormulaSynthesizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region SINTESI DNF

    /**
     * Sintetizza una formula in DNF con la tavola di verità indicata.
     *
     * @param variableNames variabili della formula, almeno una
     * @param values valori di verità nei modelli di allModels(variableNames), in ordine
     * @return formula in DNF con la tavola di verità indicata
     * @throws IllegalArgumentException se le variabili sono vuote o i valori non sono 2^n
     */
    public static Formula synthesize(List<String> variableNames, List<Boolean> values) {
        List<Model> models = pairModels(variableNames, values);

        List<Formula> clauses = new ArrayList<>();
        for (int i = 0; i < models.size(); i++) {
            if (values.get(i)) {
                clauses.add(conjunctiveClause(models.get(i)));
            }
        }

        if (clauses.isEmpty()) {
            Formula v = Formula.variable(variableNames.get(0));
            LOGGER.fine(() -> "Nessun modello vero: sintetizzata la contraddizione su " + v);
            return Formula.binary(Operator.AND, v, Formula.not(v));
        }

        Formula result = foldLeft(Operator.OR, clauses);
        LOGGER.fine(() -> "DNF sintetizzata con " + clauses.size() + " clausole: " + result);
        return result;
    }

    /**
     * Clausola congiuntiva vera esattamente nel modello indicato.
     */
    private static Formula conjunctiveClause(Model model) {
        List<Formula> literals = new ArrayList<>();
        for (String name : Evaluator.sortedVariables(model.variables())) {
            Formula variable = Formula.variable(name);
            literals.add(model.get(name) ? variable : Formula.not(variable));
        }
        return foldLeft(Operator.AND, literals);
    }

    //endregion

    //region SINTESI CNF

    /**
     * Sintetizza una formula in CNF con la tavola di verità indicata.
     *
     * @param variableNames variabili della formula, almeno una
     * @param values valori di verità nei modelli di allModels(variableNames), in ordine
     * @return formula in CNF con la tavola di verità indicata
     * @throws IllegalArgumentException se le variabili sono vuote o i valori non sono 2^n
     */
    public static Formula synthesizeCnf(List<String> variableNames, List<Boolean> values) {
        List<Model> models = pairModels(variableNames, values);

        List<Formula> clauses = new ArrayList<>();
        for (int i = 0; i < models.size(); i++) {
            if (!values.get(i)) {
                clauses.add(disjunctiveClause(models.get(i)));
            }
        }

        if (clauses.isEmpty()) {
            Formula v = Formula.variable(variableNames.get(0));
            LOGGER.fine(() -> "Nessun modello falso: sintetizzata la tautologia su " + v);
            return Formula.binary(Operator.OR, v, Formula.not(v));
        }

        Formula result = foldLeft(Operator.AND, clauses);
        LOGGER.fine(() -> "CNF sintetizzata con " + clauses.size() + " clausole: " + result);
        return result;
    }

    /**
     * Clausola disgiuntiva falsa esattamente nel modello indicato.
     */
    private static Formula disjunctiveClause(Model model) {
        List<Formula> literals = new ArrayList<>();
        for (String name : Evaluator.sortedVariables(model.variables())) {
            Formula variable = Formula.variable(name);
            literals.add(model.get(name) ? Formula.not(variable) : variable);
        }
        return foldLeft(Operator.OR, literals);
    }

    //endregion

    //region UTILITY

    /**
     * Valida l'input e materializza i modelli nell'ordine di enumerazione.
     */
    private static List<Model> pairModels(List<String> variableNames, List<Boolean> values) {
        if (variableNames == null || variableNames.isEmpty()) {
            throw new IllegalArgumentException("La sintesi richiede almeno una variabile");
        }
        if (values == null) {
            throw new IllegalArgumentException("I valori di verità non possono essere null");
        }
        for (Boolean value : values) {
            if (value == null) {
                throw new IllegalArgumentException("I valori di verità non possono contenere null");
            }
        }

        List<Model> models = new ArrayList<>();
        for (Model model : Evaluator.allModels(variableNames)) {
            models.add(model);
        }

        if (values.size() != models.size()) {
            throw new IllegalArgumentException("Attesi " + models.size() + " valori di verità per "
                    + variableNames.size() + " variabili, ricevuti " + values.size());
        }
        return models;
    }

    /**
     * Combina le formule con l'operatore indicato, associando a sinistra.
     */
    private static Formula foldLeft(Operator operator, List<Formula> formulas) {
        Formula result = formulas.get(0);
        for (int i = 1; i < formulas.size(); i++) {
            result = Formula.binary(operator, result, formulas.get(i));
        }
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Combinazione " + operator + " di " + formulas.size() + " formule: " + result);
        }
        return result;
    }

    //endregion
}
