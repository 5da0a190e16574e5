package org.quarry.formula.functions;

import org.quarry.formula.api.FormulaErrorCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.quarry.formula.functions.FunctionTestSupport.assertFails;
import static org.quarry.formula.functions.FunctionTestSupport.call;

@Tag("unit")
class LogicFunctionsTest {

    @Test
    void ifPicksByTruthiness() {
        assertThat(call("If", true, "yes", "no")).isEqualTo("yes");
        assertThat(call("If", 0.0, "yes", "no")).isEqualTo("no");
        assertThat(call("If", "", "yes", "no")).isEqualTo("no");
        assertThat(call("If", "text", "yes", "no")).isEqualTo("yes");
        assertThat(call("If", Double.NaN, "yes", "no")).isEqualTo("no");
    }

    @Test
    void andOrNot() {
        assertThat(call("And", true, 1.0, "x")).isEqualTo(true);
        assertThat(call("And", true, 0.0)).isEqualTo(false);
        assertThat(call("And")).isEqualTo(true);
        assertThat(call("Or", false, "x")).isEqualTo(true);
        assertThat(call("Or", false, 0.0, "")).isEqualTo(false);
        assertThat(call("Or")).isEqualTo(false);
        assertThat(call("Not", false)).isEqualTo(true);
        assertThat(call("Not", (Object) null)).isEqualTo(true);
        assertThat(call("Not", "x")).isEqualTo(false);
    }

    @Test
    void isEmptyRecognisesBlankAndEmptyValues() {
        assertThat(call("IsEmpty", (Object) null)).isEqualTo(true);
        assertThat(call("IsEmpty", "   ")).isEqualTo(true);
        assertThat(call("IsEmpty", List.of())).isEqualTo(true);
        assertThat(call("IsEmpty", Map.of())).isEqualTo(true);
        assertThat(call("IsEmpty", 0.0)).isEqualTo(false);
        assertThat(call("IsEmpty", "x")).isEqualTo(false);
    }

    @Test
    void coalesceReturnsFirstNonEmptyValue() {
        assertThat(call("Coalesce", "", "default")).isEqualTo("default");
        assertThat(call("Coalesce", (Object) null, 0.0, "x")).isEqualTo(0.0);
        assertThat(call("Coalesce")).isNull();
    }

    @Test
    void ifRequiresAllThreeArguments() {
        assertFails(FormulaErrorCode.INVALID_ARGUMENTS, "If", true, "yes");
    }
}
