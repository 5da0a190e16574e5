package org.quarry.formula.functions;

import org.quarry.formula.api.FormulaErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.quarry.formula.functions.FunctionTestSupport.assertFails;

/**
 * Unit tests for {@link FunctionRegistry}: lookup semantics and the metadata of the built-ins.
 */
@Tag("unit")
class FunctionRegistryTest {

    @Test
    void lookupIgnoresCase() {
        assertThat(FunctionRegistry.getFunction("sum")).isPresent();
        assertThat(FunctionRegistry.getFunction("SUM")).isPresent();
        assertThat(FunctionRegistry.getFunction("Sum").orElseThrow().name()).isEqualTo("Sum");
        assertThat(FunctionRegistry.hasFunction("mentionsoftype")).isTrue();
    }

    @Test
    void unknownFunctionIsAbsent() {
        assertThat(FunctionRegistry.getFunction("DoesNotExist")).isEmpty();
        assertThat(FunctionRegistry.getFunction(null)).isEmpty();
        assertThat(FunctionRegistry.hasFunction("DoesNotExist")).isFalse();
    }

    @Test
    void allBuiltinsAreRegistered() {
        List<FunctionDefinition> all = FunctionRegistry.getAll();

        assertThat(all).hasSize(33);
        assertThat(all).extracting(FunctionDefinition::name).startsWith("Sum", "Average", "Min", "Max", "Round", "Abs");
        assertThat(all).extracting(FunctionDefinition::name).doesNotHaveDuplicates();
    }

    @Test
    void functionsAreGroupedByCategory() {
        assertThat(FunctionRegistry.getFunctionsByCategory(FunctionCategory.STRING))
                .extracting(FunctionDefinition::name)
                .containsExactly("Concat", "Upper", "Lower", "Length", "Trim", "Replace");
        assertThat(FunctionRegistry.getFunctionsByCategory("travel"))
                .extracting(FunctionDefinition::name)
                .containsExactly("Route", "Weather", "Distance");
        assertThat(FunctionRegistry.getFunctionsByCategory(FunctionCategory.LOOKUP)).isEmpty();
        assertThat(FunctionRegistry.getFunctionsByCategory("no-such-category")).isEmpty();
    }

    @Test
    void metadataDescribesParameters() {
        FunctionDefinition round = FunctionRegistry.getFunction("Round").orElseThrow();

        assertThat(round.category()).isEqualTo(FunctionCategory.MATH);
        assertThat(round.requiredArity()).isEqualTo(1);
        assertThat(round.parameters()).extracting(ParamInfo::name).containsExactly("value", "decimals");
        assertThat(round.parameters().get(1).defaultValue()).isEqualTo(0.0);
        assertThat(round.returnType()).isEqualTo("number");
        assertThat(round.example()).contains("Round(");
        assertThat(round.async()).isFalse();
        assertThat(FunctionRegistry.getFunction("Route").orElseThrow().async()).isTrue();
    }

    @Test
    void missingRequiredArgumentsAreRejected() {
        assertFails(FormulaErrorCode.INVALID_ARGUMENTS, "Round");
        assertFails(FormulaErrorCode.INVALID_ARGUMENTS, "Replace", "text", "x");
        assertFails(FormulaErrorCode.INVALID_ARGUMENTS, "Duration", "2024-01-01");
    }
}
