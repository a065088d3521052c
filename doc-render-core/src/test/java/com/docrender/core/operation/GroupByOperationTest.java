package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.CallbackException;
import com.docrender.core.error.OperationException;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.TableContent;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GroupByOperation}.
 */
class GroupByOperationTest extends OperationTestBase {

    @Test
    void apply_emitsOneRowPerDistinctKeyInFirstSeenOrder() {
        GroupByOperation groupBy = GroupByOperation.by("region").aggregate("count", Aggregates.count());

        TableContent result = (TableContent) groupBy.apply(sales(), CancellationToken.none());

        assertThat(column(result, "region")).containsExactly("EU", "US", "APAC");
        assertThat(column(result, "count")).containsExactly(2, 2, 1);
    }

    @Test
    void apply_outputSchemaIsGroupColumnsThenAggregatesInRegistrationOrder() {
        GroupByOperation groupBy = GroupByOperation.by("region")
            .aggregate("total", Aggregates.sum("amount"))
            .aggregate("count", Aggregates.count())
            .aggregate("avg", Aggregates.average("amount"));

        TableContent result = (TableContent) groupBy.apply(sales(), CancellationToken.none());

        assertThat(result.schema().keyOrder()).containsExactly("region", "total", "count", "avg");
        assertThat(result.rows().get(0)).containsExactly(
            entry("region", "EU"), entry("total", 40.0), entry("count", 2), entry("avg", 20.0));
    }

    @Test
    void apply_withMultipleColumns_groupsByTuple() {
        TableContent table = table("t", List.of("a", "b"),
            row("a", 1, "b", "x"), row("a", 1, "b", "y"), row("a", 1, "b", "x"), row("a", null, "b", "x"));

        TableContent result = (TableContent) GroupByOperation.by("a", "b")
            .aggregate("n", Aggregates.count())
            .apply(table, CancellationToken.none());

        assertThat(result.rows()).hasSize(3);
        assertThat(column(result, "n")).containsExactly(2, 1, 1);
        assertThat(column(result, "a")).containsExactly(1, 1, null);
    }

    @Test
    void apply_groupSizesSumToInputSize() {
        TableContent result = (TableContent) GroupByOperation.by("product")
            .aggregate("n", Aggregates.count())
            .apply(sales(), CancellationToken.none());

        int total = column(result, "n").stream().mapToInt(n -> (Integer) n).sum();
        assertThat(total).isEqualTo(sales().rows().size());
    }

    @Test
    void apply_withMissingColumn_throwsOperationException() {
        GroupByOperation groupBy = GroupByOperation.by("missing").aggregate("n", Aggregates.count());

        assertThatThrownBy(() -> groupBy.apply(sales(), CancellationToken.none()))
            .isInstanceOf(OperationException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void apply_withThrowingAggregate_throwsCallbackExceptionNamingAggregate() {
        GroupByOperation groupBy = GroupByOperation.by("region").aggregate("broken", rows -> {
            throw new ArithmeticException("overflow");
        });

        assertThatThrownBy(() -> groupBy.apply(sales(), CancellationToken.none()))
            .isInstanceOf(CallbackException.class)
            .hasMessageContaining("aggregate 'broken'");
    }

    @Test
    void validate_withoutColumns_throwsValidationException() {
        GroupByOperation groupBy = new GroupByOperation(List.of(), Map.of("n", Aggregates.count()));

        assertThatThrownBy(groupBy::validate)
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("at least one grouping column");
    }

    @Test
    void validate_withoutAggregates_throwsValidationException() {
        assertThatThrownBy(() -> GroupByOperation.by("region").validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("at least one aggregate function");
    }

    @Test
    void validate_withBlankColumn_throwsValidationException() {
        assertThatThrownBy(() -> GroupByOperation.by("region", "").aggregate("n", Aggregates.count()).validate())
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void validate_withAggregateNamedLikeGroupColumn_throwsValidationException() {
        assertThatThrownBy(() -> GroupByOperation.by("region").aggregate("region", Aggregates.count()).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("collides");
    }

    @Test
    void constructor_keepsIterationOrderOfGivenMap() {
        Map<String, AggregateFunction> aggregates = new LinkedHashMap<>();
        aggregates.put("z", Aggregates.count());
        aggregates.put("a", Aggregates.sum("amount"));

        TableContent result = (TableContent) new GroupByOperation(List.of("region"), aggregates)
            .apply(sales(), CancellationToken.none());

        assertThat(result.schema().keyOrder()).containsExactly("region", "z", "a");
    }
}
