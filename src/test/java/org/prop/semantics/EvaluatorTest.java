package org.prop.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.prop.support.InferenceRule;
import org.prop.support.Model;
import org.prop.syntax.Formula;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test del valutatore: tavole degli operatori, enumerazione, classificazione e regole.
 */
@DisplayName("Evaluator")
class EvaluatorTest {

    private static Model model(Map<String, Boolean> assignment) {
        return new Model(assignment);
    }

    @Nested
    @DisplayName("Valutazione")
    class EvaluationTests {

        @ParameterizedTest(name = "{0}: FF={1} FT={2} TF={3} TT={4}")
        @CsvSource({
                "&,   false, false, false, true",
                "|,   false, true,  true,  true",
                "->,  true,  true,  false, true",
                "+,   false, true,  true,  false",
                "<->, true,  false, false, true",
                "-&,  true,  true,  true,  false",
                "-|,  true,  false, false, false"
        })
        @DisplayName("Tavola di verità di ogni operatore binario")
        void testBinaryOperators(String operator, boolean ff, boolean ft, boolean tf, boolean tt) {
            Formula formula = Formula.parse("(p" + operator + "q)");

            assertEquals(ff, Evaluator.evaluate(formula, model(Map.of("p", false, "q", false))));
            assertEquals(ft, Evaluator.evaluate(formula, model(Map.of("p", false, "q", true))));
            assertEquals(tf, Evaluator.evaluate(formula, model(Map.of("p", true, "q", false))));
            assertEquals(tt, Evaluator.evaluate(formula, model(Map.of("p", true, "q", true))));
        }

        @Test
        @DisplayName("Negazione e costanti")
        void testNegationAndConstants() {
            assertTrue(Evaluator.evaluate(Formula.parse("~p"), model(Map.of("p", false))));
            assertFalse(Evaluator.evaluate(Formula.parse("~p"), model(Map.of("p", true))));
            assertTrue(Evaluator.evaluate(Formula.parse("T"), Model.empty()));
            assertFalse(Evaluator.evaluate(Formula.parse("F"), Model.empty()));
            assertTrue(Evaluator.evaluate(Formula.parse("~~(F->x)"), model(Map.of("x", false))));
        }

        @Test
        @DisplayName("Un modello più ampio è accettato")
        void testLargerModel() {
            assertTrue(Evaluator.evaluate(Formula.parse("(p&q)"),
                    model(Map.of("p", true, "q", true, "r", false))));
        }

        @Test
        @DisplayName("Un modello che non copre la formula è violazione di contratto")
        void testMissingVariable() {
            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                    () -> Evaluator.evaluate(Formula.parse("(p|s)"), model(Map.of("p", true))));
            assertTrue(exception.getMessage().contains("s"));
        }
    }

    @Nested
    @DisplayName("Enumerazione dei modelli")
    class EnumerationTests {

        @Test
        @DisplayName("Ordine di contatore binario con la prima variabile più significativa")
        void testOrder() {
            List<Model> models = new ArrayList<>();
            Evaluator.allModels(List.of("p", "q")).forEach(models::add);

            assertEquals(List.of(
                    model(Map.of("p", false, "q", false)),
                    model(Map.of("p", false, "q", true)),
                    model(Map.of("p", true, "q", false)),
                    model(Map.of("p", true, "q", true))), models);
        }

        @Test
        @DisplayName("L'ordine dei bit segue la lista, non l'alfabeto")
        void testListOrder() {
            Iterator<Model> iterator = Evaluator.allModels(List.of("q", "p")).iterator();
            iterator.next();

            assertEquals(model(Map.of("q", false, "p", true)), iterator.next());
        }

        @Test
        @DisplayName("Zero variabili producono un solo modello vuoto")
        void testNoVariables() {
            Iterator<Model> iterator = Evaluator.allModels(List.of()).iterator();

            assertTrue(iterator.hasNext());
            assertEquals(Model.empty(), iterator.next());
            assertFalse(iterator.hasNext());
            assertThrows(NoSuchElementException.class, iterator::next);
        }

        @Test
        @DisplayName("La sequenza è riavviabile e ha 2^n elementi")
        void testRestartable() {
            Iterable<Model> models = Evaluator.allModels(List.of("x1", "x2", "x3"));

            int first = 0;
            for (Model ignored : models) {
                first++;
            }
            int second = 0;
            for (Model ignored : models) {
                second++;
            }
            assertEquals(8, first);
            assertEquals(8, second);
        }

        @Test
        @DisplayName("Nomi non validi o ripetuti sono rifiutati")
        void testInvalidNames() {
            assertThrows(IllegalArgumentException.class, () -> Evaluator.allModels(List.of("p", "a")));
            assertThrows(IllegalArgumentException.class, () -> Evaluator.allModels(List.of("p", "p")));
            assertThrows(IllegalArgumentException.class, () -> Evaluator.allModels(null));
        }

        @Test
        @DisplayName("I valori di verità seguono l'ordine dei modelli")
        void testTruthValues() {
            Formula formula = Formula.parse("~(p&q76)");
            List<Boolean> values = new ArrayList<>();
            Evaluator.truthValues(formula, Evaluator.allModels(List.of("p", "q76"))).forEach(values::add);

            assertEquals(List.of(true, true, true, false), values);
        }
    }

    @Nested
    @DisplayName("Classificazione")
    class ClassificationTests {

        @ParameterizedTest
        @ValueSource(strings = {"(p|~p)", "((p->q)<->(~q->~p))", "T", "((p&(p->q))->q)", "~(p+p)"})
        @DisplayName("Tautologie")
        void testTautologies(String input) {
            Formula formula = Formula.parse(input);

            assertTrue(Evaluator.isTautology(formula));
            assertTrue(Evaluator.isSatisfiable(formula));
            assertFalse(Evaluator.isContradiction(formula));
        }

        @ParameterizedTest
        @ValueSource(strings = {"(p&~p)", "F", "~(q->q)", "((p<->q)&(p+q))"})
        @DisplayName("Contraddizioni")
        void testContradictions(String input) {
            Formula formula = Formula.parse(input);

            assertTrue(Evaluator.isContradiction(formula));
            assertFalse(Evaluator.isSatisfiable(formula));
            assertFalse(Evaluator.isTautology(formula));
        }

        @ParameterizedTest
        @ValueSource(strings = {"p", "(p&q)", "(x-|y)", "~(p&q76)", "((p->q)->r)"})
        @DisplayName("Formule contingenti")
        void testContingent(String input) {
            Formula formula = Formula.parse(input);

            assertFalse(Evaluator.isTautology(formula));
            assertFalse(Evaluator.isContradiction(formula));
            assertTrue(Evaluator.isSatisfiable(formula));
        }

        @ParameterizedTest
        @ValueSource(strings = {"(p|~p)", "(p&~p)", "(p-&q)", "((p+q)+r)", "F", "T", "~x"})
        @DisplayName("Le tre classificazioni sono coerenti con la negazione")
        void testConsistency(String input) {
            Formula formula = Formula.parse(input);
            Formula negated = Formula.not(formula);

            assertEquals(Evaluator.isTautology(formula), !Evaluator.isSatisfiable(negated));
            assertEquals(Evaluator.isContradiction(formula), !Evaluator.isSatisfiable(formula));
        }
    }

    @Nested
    @DisplayName("Regole di inferenza")
    class InferenceTests {

        private InferenceRule rule(String conclusion, String... assumptions) {
            List<Formula> parsed = new ArrayList<>();
            for (String assumption : assumptions) {
                parsed.add(Formula.parse(assumption));
            }
            return new InferenceRule(parsed, Formula.parse(conclusion));
        }

        @Test
        @DisplayName("Modus ponens e sillogismo ipotetico sono corretti")
        void testSoundRules() {
            assertTrue(Evaluator.isSoundInference(rule("q", "p", "(p->q)")));
            assertTrue(Evaluator.isSoundInference(rule("(p->r)", "(p->q)", "(q->r)")));
            assertTrue(Evaluator.isSoundInference(rule("(p|~p)")));
        }

        @Test
        @DisplayName("Regole con controesempio non sono corrette")
        void testUnsoundRules() {
            assertFalse(Evaluator.isSoundInference(rule("q", "p")));
            assertFalse(Evaluator.isSoundInference(rule("p", "q", "(p->q)")));
            assertFalse(Evaluator.isSoundInference(rule("p")));
        }

        @Test
        @DisplayName("Assunzioni contraddittorie rendono corretta ogni regola")
        void testExplosion() {
            assertTrue(Evaluator.isSoundInference(rule("r", "p", "~p")));
        }

        @Test
        @DisplayName("Valutazione di una regola in un singolo modello")
        void testEvaluateInference() {
            InferenceRule modusPonens = rule("q", "p", "(p->q)");

            assertTrue(Evaluator.evaluateInference(modusPonens, model(Map.of("p", false, "q", false))));
            assertTrue(Evaluator.evaluateInference(modusPonens, model(Map.of("p", true, "q", true))));
            assertFalse(Evaluator.evaluateInference(rule("q", "p"), model(Map.of("p", true, "q", false))));
            assertThrows(IllegalArgumentException.class,
                    () -> Evaluator.evaluateInference(modusPonens, model(Map.of("p", true))));
        }
    }
}
