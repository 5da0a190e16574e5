package org.quarry.formula.suggest;

import org.quarry.formula.api.FormulaContext;
import org.quarry.formula.api.MentionEntity;
import org.quarry.formula.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@Tag("unit")
class FormulaSuggesterTest {

    private final FormulaSuggester suggester = new FormulaSuggester();

    @Test
    void emptyContextGetsDateSuggestionsOnly() {
        assertThat(suggester.suggestFormulas(FormulaContext.create())).containsExactly("Now()", "Today()");
    }

    @Test
    void twoPlacesSuggestRouteAndDistance() {
        FormulaContext context = FormulaContext.builder()
                .mentions(List.of(
                        MentionEntity.of("person", "Ada", Map.of()),
                        MentionEntity.of("place", "Paris", Map.of()),
                        MentionEntity.of("Place", "Berlin", Map.of())))
                .build();

        assertThat(suggester.suggestFormulas(context))
                .contains("Route(@Paris, @Berlin)", "Distance(@Paris, @Berlin)");
    }

    @Test
    void singlePlaceSuggestsNoRoute() {
        FormulaContext context = FormulaContext.builder()
                .mentions(List.of(MentionEntity.of("place", "Paris", Map.of())))
                .build();

        assertThat(suggester.suggestFormulas(context)).noneMatch(s -> s.startsWith("Route"));
    }

    @Test
    void numericFieldsSuggestSumAndAverage() {
        FormulaContext context = FormulaContext.builder()
                .field("hotel", 120)
                .field("title", "Trip")
                .field("flight", 300.5)
                .build();

        assertThat(suggester.suggestFormulas(context)).contains("Sum(hotel, flight)", "Average(hotel, flight)");
    }

    @Test
    void siblingsSuggestCountAndSumField() {
        FormulaContext context = FormulaContext.builder()
                .siblings(List.of(Map.of("fields", Map.of("title", "Day 1", "cost", 40))))
                .build();

        assertThat(suggester.suggestFormulas(context))
                .containsExactly("Now()", "Today()", "Count(siblings)", "SumField(siblings, \"cost\")");
    }

    @Test
    void labelsThatAreNotIdentifiersUseMentionCalls() {
        FormulaContext context = FormulaContext.builder()
                .mentions(List.of(
                        MentionEntity.of("place", "New York", Map.of()),
                        MentionEntity.of("place", "Paris", Map.of())))
                .build();

        assertThat(suggester.suggestFormulas(context))
                .contains("Route(Mention(\"New York\"), @Paris)", "Distance(Mention(\"New York\"), @Paris)");
    }

    @Test
    void fieldNamesThatAreNotIdentifiersUseGetCalls() {
        FormulaContext context = FormulaContext.builder()
                .field("unit price", 12)
                .field("qty", 3)
                .build();

        assertThat(suggester.suggestFormulas(context)).contains("Sum(Get(\"unit price\"), qty)");
    }

    @Test
    void everySuggestionParses() {
        FormulaContext context = FormulaContext.builder()
                .mentions(List.of(
                        MentionEntity.of("place", "São Paulo", Map.of()),
                        MentionEntity.of("place", "2nd \"Avenue\"", Map.of())))
                .field("unit price", 12)
                .field("tax-rate", 0.2)
                .siblings(List.of(Map.of("fields", Map.of("cost \"net\"", 40))))
                .build();

        List<String> suggestions = suggester.suggestFormulas(context);

        assertThat(suggestions).hasSize(8);
        for (String suggestion : suggestions) {
            assertThatCode(() -> Parser.parseFormula(suggestion)).as(suggestion).doesNotThrowAnyException();
        }
    }
}
