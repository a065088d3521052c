package com.docrender.core.operation;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.CallbackException;
import com.docrender.core.error.CancelledException;
import com.docrender.core.error.OperationException;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.TableContent;
import com.docrender.core.model.TextContent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FilterOperation}.
 */
class FilterOperationTest extends OperationTestBase {

    @Test
    void apply_withPredicate_keepsMatchingRowsInOrder() {
        TableContent table = sales();
        FilterOperation filter = new FilterOperation(row -> "EU".equals(row.get("region")));

        TableContent result = (TableContent) filter.apply(table, CancellationToken.none());

        assertThat(column(result, "product")).containsExactly("a", "c");
        assertThat(result.schema().keyOrder()).containsExactly("region", "product", "amount");
        assertThat(result.id()).isEqualTo(table.id());
    }

    @Test
    void apply_withNoMatches_returnsEmptyTableWithSameSchema() {
        TableContent result = (TableContent) new FilterOperation(row -> false)
            .apply(sales(), CancellationToken.none());

        assertThat(result.rows()).isEmpty();
        assertThat(result.schema().keyOrder()).containsExactly("region", "product", "amount");
    }

    @Test
    void apply_neverModifiesInput() {
        TableContent table = sales();
        List<Object> before = column(table, "product");

        new FilterOperation(row -> false).apply(table, CancellationToken.none());

        assertThat(column(table, "product")).isEqualTo(before);
    }

    @Test
    void apply_resultRowsAreNotAliasesOfInput() {
        TableContent table = sales();

        TableContent result = (TableContent) new FilterOperation(row -> true).apply(table, CancellationToken.none());

        assertThat(result.rows()).isNotSameAs(table.rows());
        for (int i = 0; i < result.rows().size(); i++) {
            assertThat(result.rows().get(i)).isEqualTo(table.rows().get(i)).isNotSameAs(table.rows().get(i));
        }
    }

    @Test
    void validate_withNullPredicate_throwsValidationException() {
        assertThatThrownBy(() -> new FilterOperation(null).validate())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("predicate");
    }

    @Test
    void apply_withThrowingPredicate_throwsCallbackException() {
        FilterOperation filter = new FilterOperation(row -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> filter.apply(sales(), CancellationToken.none()))
            .isInstanceOf(CallbackException.class)
            .hasMessageContaining("filter predicate failed")
            .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void apply_withNonTableContent_throwsOperationException() {
        assertThatThrownBy(() -> new FilterOperation(row -> true).apply(TextContent.of("hi"), CancellationToken.none()))
            .isInstanceOf(OperationException.class)
            .hasMessageContaining("requires table content");
    }

    @Test
    void apply_withCancelledToken_throwsCancelledException() {
        assertThatThrownBy(() -> new FilterOperation(row -> true).apply(sales(), CancellationToken.cancelled()))
            .isInstanceOf(CancelledException.class)
            .hasMessageContaining("sales");
    }

    @Test
    void canOptimize_isTrueOnlyForAnotherFilter() {
        FilterOperation filter = new FilterOperation(row -> true);

        assertThat(filter.canOptimize(new FilterOperation(row -> false))).isTrue();
        assertThat(filter.canOptimize(new LimitOperation(1))).isFalse();
    }
}
