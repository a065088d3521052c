package com.docrender.core.pipeline;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.CancelledException;
import com.docrender.core.error.OperationException;
import com.docrender.core.error.PipelineException;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.Content;
import com.docrender.core.model.TableContent;
import com.docrender.core.model.TextContent;
import com.docrender.core.operation.FilterOperation;
import com.docrender.core.operation.LimitOperation;
import com.docrender.core.operation.Operation;
import com.docrender.core.operation.OperationTestBase;
import com.docrender.core.operation.SortKey;
import com.docrender.core.operation.SortOperation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TransformationPipeline}.
 */
class TransformationPipelineTest extends OperationTestBase {

    private final TransformationPipeline pipeline = new TransformationPipeline();

    @Test
    void applyTransformations_withoutOperations_returnsSameInstance() {
        TableContent table = sales();
        TextContent text = TextContent.of("hello");

        assertThat(pipeline.applyTransformations(CancellationToken.none(), table)).isSameAs(table);
        assertThat(pipeline.applyTransformations(CancellationToken.none(), text)).isSameAs(text);
    }

    @Test
    void applyTransformations_appliesOperationsInOrder() {
        TableContent table = sales().withOperations(
            new SortOperation(SortKey.descending("amount")),
            new LimitOperation(2));

        TableContent result = (TableContent) pipeline.applyTransformations(CancellationToken.none(), table);

        assertThat(column(result, "amount")).containsExactly(50, 40);
    }

    @Test
    void applyTransformations_neverModifiesInput() {
        TableContent table = sales().withOperations(
            new FilterOperation(row -> false),
            new SortOperation(SortKey.descending("amount")));
        List<Object> before = new ArrayList<>(column(table, "product"));

        pipeline.applyTransformations(CancellationToken.none(), table);

        assertThat(column(table, "product")).isEqualTo(before);
        assertThat(table.rows()).hasSize(5);
    }

    @Test
    void applyTransformations_withInvalidOperation_stopsBeforeApplyingAnything() {
        AtomicInteger applied = new AtomicInteger();
        Operation counting = new CountingOperation(applied);
        TableContent table = sales().withOperations(counting, new LimitOperation(-1), counting);

        assertThatThrownBy(() -> pipeline.applyTransformations(CancellationToken.none(), table))
            .isInstanceOfSatisfying(PipelineException.class, e -> {
                assertThat(e.contentId()).isEqualTo("sales");
                assertThat(e.operationIndex()).isEqualTo(1);
                assertThat(e.operationName()).isEqualTo("limit");
                assertThat(e.stage()).isEqualTo(PipelineException.Stage.VALIDATE);
                assertThat(e.getCause()).isInstanceOf(ValidationException.class);
            });
        assertThat(applied).hasValue(1);
    }

    @Test
    void applyTransformations_withFailingApply_reportsApplyStage() {
        TableContent table = sales().withOperations(
            new LimitOperation(3),
            new SortOperation(SortKey.ascending("missing")));

        assertThatThrownBy(() -> pipeline.applyTransformations(CancellationToken.none(), table))
            .isInstanceOfSatisfying(PipelineException.class, e -> {
                assertThat(e.operationIndex()).isEqualTo(1);
                assertThat(e.stage()).isEqualTo(PipelineException.Stage.APPLY);
                assertThat(e.getCause()).isInstanceOf(OperationException.class);
            })
            .hasMessageContaining("content 'sales'")
            .hasMessageContaining("operation 1 (sort) failed to apply");
    }

    @Test
    void applyTransformations_withCancelledToken_runsNoOperation() {
        AtomicInteger applied = new AtomicInteger();
        TableContent table = sales().withOperations(new CountingOperation(applied));

        assertThatThrownBy(() -> pipeline.applyTransformations(CancellationToken.cancelled(), table))
            .isInstanceOfSatisfying(CancelledException.class, e -> {
                assertThat(e.scope()).isEqualTo(CancelledException.Scope.CONTENT);
                assertThat(e.name()).isEqualTo("sales");
                assertThat(e.getCause()).isInstanceOf(CancellationException.class);
                assertThat(e.isDeadlineExceeded()).isFalse();
            });
        assertThat(applied).hasValue(0);
    }

    @Test
    void applyTransformations_cancelledBetweenOperations_stopsChain() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger applied = new AtomicInteger();
        Operation cancelling = new CountingOperation(applied) {
            @Override
            public Content apply(Content content, CancellationToken t) {
                token.cancel();
                return super.apply(content, t);
            }
        };
        TableContent table = sales().withOperations(cancelling, new CountingOperation(applied));

        assertThatThrownBy(() -> pipeline.applyTransformations(token, table))
            .isInstanceOf(CancelledException.class);
        assertThat(applied).hasValue(1);
    }

    @Test
    void applyTransformations_cancelledInsideOperation_propagatesCancellation() {
        CancellationToken token = CancellationToken.create();
        TableContent table = sales().withOperations(new FilterOperation(row -> {
            token.cancel();
            return true;
        }));

        assertThatThrownBy(() -> pipeline.applyTransformations(token, table))
            .isInstanceOf(CancelledException.class)
            .isNotInstanceOf(PipelineException.class);
    }

    /**
     * Passes content through unchanged and counts invocations.
     */
    private static class CountingOperation implements Operation {

        private final AtomicInteger applied;

        CountingOperation(AtomicInteger applied) {
            this.applied = applied;
        }

        @Override
        public String name() {
            return "counting";
        }

        @Override
        public void validate() {
        }

        @Override
        public Content apply(Content content, CancellationToken token) {
            applied.incrementAndGet();
            return content;
        }
    }
}
