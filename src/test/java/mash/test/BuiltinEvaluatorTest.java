// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.test;

import java.util.ArrayList;
import mash.document.Address;
import mash.evaluation.BuiltinEvaluator;
import mash.evaluation.EvaluationException;
import mash.evaluation.Fragment;
import mash.evaluation.Scope;
import mash.tree.Frame;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class BuiltinEvaluatorTest {
    @BeforeEach
    void setUp() {
        output = new ArrayList<>();
        evaluator = new BuiltinEvaluator(output::add);
        scope = new Scope();
    }

    @Test
    void assignsAndPrints() throws EvaluationException {
        evaluate("name = world\ngreeting = hello, ${name}\nprint ${greeting}!");
        assertThat(scope.get("greeting")).isEqualTo("hello, world");
        assertThat(output).containsExactly("hello, world!");
    }

    @Test
    void skipsBlankLinesAndComments() throws EvaluationException {
        evaluate("\n# print nothing\n   \nprint something\n");
        assertThat(output).containsExactly("something");
    }

    @Test
    void unsetRemovesVariables() throws EvaluationException {
        scope.put("stale", "value");
        evaluate("unset stale");
        assertThat(scope.contains("stale")).isFalse();
    }

    @Test
    void conditionalsCompareInterpolatedValues() throws EvaluationException {
        scope.put("mode", "fast");
        evaluate("if ${mode} == fast: print taken\nif ${mode} == slow: print not taken");
        assertThat(output).containsExactly("taken");
    }

    @Test
    void conditionalsMayAssign() throws EvaluationException {
        evaluate("a = 1\nif ${a} == 1: b = 2");
        assertThat(scope.get("b")).isEqualTo("2");
    }

    @Test
    void failReportsItsLine() {
        assertThatExceptionOfType(EvaluationException.class)
            .isThrownBy(() -> evaluate("a = 1\n\nfail broken ${a}"))
            .satisfies(e -> {
                assertThat(e.getMessage()).isEqualTo("broken 1");
                assertThat(e.fragmentLine()).isEqualTo(3);
            });
    }

    @Test
    void undefinedVariablesAreErrors() {
        assertThatExceptionOfType(EvaluationException.class)
            .isThrownBy(() -> evaluate("print fine\nprint ${missing}"))
            .satisfies(e -> {
                assertThat(e.getMessage()).contains("missing");
                assertThat(e.fragmentLine()).isEqualTo(2);
            });
        assertThat(output).containsExactly("fine");
    }

    @Test
    void unknownStatementsAreErrors() {
        assertThatExceptionOfType(EvaluationException.class)
            .isThrownBy(() -> evaluate("frobnicate"))
            .satisfies(e -> assertThat(e.fragmentLine()).isEqualTo(1));
    }

    @Test
    void restartOutsideOfRunIsAnError() {
        assertThatExceptionOfType(EvaluationException.class)
            .isThrownBy(() -> evaluate("restart"))
            .withMessageContaining("outside of a restartable run");
    }

    @Test
    void frameTextIsAvailable() throws EvaluationException {
        evaluate("print [${_}]");
        assertThat(output).containsExactly("[]");
    }

    private void evaluate(final String source) throws EvaluationException {
        final var address = new Address("test.mash", 1, 1);
        evaluator.evaluate(new Fragment(source, address, Frame.root(address)), scope);
    }

    private ArrayList<String> output;
    private BuiltinEvaluator evaluator;
    private Scope scope;
}
