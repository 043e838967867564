package org.prop.support;

import org.prop.syntax.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * REGOLA DI INFERENZA - Sequenza ordinata di assunzioni e una conclusione
 *
 * Contenitore immutabile consumato dal controllo semantico di correttezza
 * ({@code Evaluator.isSoundInference}). Le assunzioni possono essere zero:
 * in tal caso la regola è corretta se e solo se la conclusione è una tautologia.
 */
public final class InferenceRule {

    private final List<Formula> assumptions;
    private final Formula conclusion;

    /**
     * @param assumptions assunzioni in ordine (non null, senza elementi null)
     * @param conclusion conclusione (non null)
     * @throws IllegalArgumentException se un parametro è null
     */
    public InferenceRule(List<Formula> assumptions, Formula conclusion) {
        if (assumptions == null) {
            throw new IllegalArgumentException("Le assunzioni non possono essere null");
        }
        for (Formula assumption : assumptions) {
            if (assumption == null) {
                throw new IllegalArgumentException("Le assunzioni non possono contenere null");
            }
        }
        if (conclusion == null) {
            throw new IllegalArgumentException("La conclusione non può essere null");
        }

        this.assumptions = Collections.unmodifiableList(new ArrayList<>(assumptions));
        this.conclusion = conclusion;
    }

    public List<Formula> getAssumptions() {
        return assumptions;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    /**
     * @return unione delle variabili di assunzioni e conclusione
     */
    public Set<String> variables() {
        Set<String> variables = new LinkedHashSet<>();
        for (Formula assumption : assumptions) {
            variables.addAll(assumption.variables());
        }
        variables.addAll(conclusion.variables());
        return Collections.unmodifiableSet(variables);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InferenceRule)) return false;

        InferenceRule other = (InferenceRule) obj;
        return assumptions.equals(other.assumptions) && conclusion.equals(other.conclusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assumptions, conclusion);
    }

    /**
     * @return rappresentazione [a1, a2] ==&gt; c
     */
    @Override
    public String toString() {
        return assumptions + " ==> " + conclusion;
    }
}
