package org.quarry.formula.batch;

import org.quarry.formula.FormulaEngine;
import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.api.FormulaErrorCode;
import org.quarry.formula.api.FormulaResult;
import org.quarry.formula.api.MentionResolver;
import org.quarry.formula.config.FormulaEngineConfig;
import org.quarry.formula.junit.extensions.logging.ExpectLog;
import org.quarry.formula.junit.extensions.logging.LogLevel;
import org.quarry.formula.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class FormulaRecomputerTest {

    private FormulaRecomputer recomputer;
    private FormulaContext base;

    @BeforeEach
    void setUp() {
        recomputer = new FormulaRecomputer(new FormulaEngine(MentionResolver.NONE, FormulaEngineConfig.defaults()));
        base = FormulaContext.builder().field("price", 10).field("qty", 3).build();
    }

    private Map<String, FormulaResult> recompute(Map<String, String> formulas) {
        return recomputer.recompute(formulas, base).join();
    }

    @Test
    void evaluatesInDependencyOrderAndKeepsInputOrder() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("total", "subtotal + tax");
        formulas.put("subtotal", "price * qty");
        formulas.put("tax", "subtotal / 10");

        Map<String, FormulaResult> results = recompute(formulas);

        assertThat(results.keySet()).containsExactly("total", "subtotal", "tax");
        assertThat(results.get("subtotal").value()).isEqualTo(30.0);
        assertThat(results.get("tax").value()).isEqualTo(3.0);
        assertThat(results.get("total").value()).isEqualTo(33.0);
        assertThat(results.get("total").dependencies()).containsExactly("subtotal", "tax");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Circular formula references between fields \\[a, b\\]")
    void cyclesAndTheirDependentsFail() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("a", "b + 1");
        formulas.put("b", "a + 1");
        formulas.put("c", "a * 2");
        formulas.put("d", "5");

        Map<String, FormulaResult> results = recompute(formulas);

        assertThat(results.get("a").errorCode()).isEqualTo(FormulaErrorCode.CIRCULAR_REFERENCE);
        assertThat(results.get("b").errorCode()).isEqualTo(FormulaErrorCode.CIRCULAR_REFERENCE);
        assertThat(results.get("c").errorCode()).isEqualTo(FormulaErrorCode.CIRCULAR_REFERENCE);
        assertThat(results.get("c").error()).contains("depends on a circular reference");
        assertThat(results.get("d").success()).isTrue();
        assertThat(results.get("d").value()).isEqualTo(5.0);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Circular formula references between fields \\[counter\\]")
    void selfReferenceIsCircular() {
        Map<String, FormulaResult> results = recompute(Map.of("counter", "counter + 1"));

        assertThat(results.get("counter").errorCode()).isEqualTo(FormulaErrorCode.CIRCULAR_REFERENCE);
        assertThat(results.get("counter").displayValue()).isEqualTo("Error");
    }

    @Test
    void parseErrorDoesNotStopTheBatch() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("bad", "1 +");
        formulas.put("good", "price + 1");
        formulas.put("guarded", "Coalesce(bad, 0) + 1");

        Map<String, FormulaResult> results = recompute(formulas);

        assertThat(results.get("bad").errorCode()).isEqualTo(FormulaErrorCode.PARSE_ERROR);
        assertThat(results.get("good").value()).isEqualTo(11.0);
        assertThat(results.get("guarded").value()).isEqualTo(1.0);
    }

    @Test
    void failedFieldReadsAsNullDownstream() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("ratio", "price / 0");
        formulas.put("label", "IsEmpty(ratio) ? \"n/a\" : ratio");

        Map<String, FormulaResult> results = recompute(formulas);

        assertThat(results.get("ratio").errorCode()).isEqualTo(FormulaErrorCode.DIVISION_BY_ZERO);
        assertThat(results.get("label").value()).isEqualTo("n/a");
    }

    @Test
    void computedValueShadowsInputField() {
        Map<String, FormulaResult> results = recompute(Map.of("price", "qty * 2"));

        assertThat(results.get("price").value()).isEqualTo(6.0);
    }

    @Test
    void deeplyNestedFormulaDoesNotStopTheBatch() {
        Map<String, String> formulas = new LinkedHashMap<>();
        formulas.put("deep", "(".repeat(1000) + "1" + ")".repeat(1000));
        formulas.put("good", "price + 1");

        Map<String, FormulaResult> results = recompute(formulas);

        assertThat(results.get("deep").errorCode()).isEqualTo(FormulaErrorCode.PARSE_ERROR);
        assertThat(results.get("good").value()).isEqualTo(11.0);
    }
}
