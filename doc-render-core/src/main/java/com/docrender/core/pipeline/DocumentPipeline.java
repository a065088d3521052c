package com.docrender.core.pipeline;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.ValidationException;
import com.docrender.core.model.Content;
import com.docrender.core.model.Document;
import com.docrender.core.model.TableContent;
import com.docrender.core.operation.AddColumnOperation;
import com.docrender.core.operation.AggregateFunction;
import com.docrender.core.operation.FilterOperation;
import com.docrender.core.operation.GroupByOperation;
import com.docrender.core.operation.LimitOperation;
import com.docrender.core.operation.Operation;
import com.docrender.core.operation.SortDirection;
import com.docrender.core.operation.SortKey;
import com.docrender.core.operation.SortOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Fluent builder that applies one operation chain to every table of a document.
 *
 * <p>Before execution the chain is reordered so that cheap, row-reducing operations run first:
 * filter, add column, group by, sort, limit, then anything else. The order within each group is
 * kept. Non-table content passes through unchanged.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * Document result = new DocumentPipeline(document)
 *     .filter(row -> ((Number) row.get("age")).intValue() >= 18)
 *     .sortBy("name", SortDirection.ASCENDING)
 *     .limit(10)
 *     .execute(CancellationToken.create());
 * }</pre>
 *
 * <p>Instances are not thread-safe; build and execute on one thread.
 */
public class DocumentPipeline {

    private static final Logger log = LoggerFactory.getLogger(DocumentPipeline.class);

    /** Metadata key of the {@link TransformStats} attached to executed documents. */
    public static final String STATS_METADATA_KEY = "transform_stats";

    private final Document document;
    private final List<Operation> operations = new ArrayList<>();
    private PipelineOptions options = PipelineOptions.defaults();

    public DocumentPipeline(Document document) {
        this.document = Objects.requireNonNull(document, "document must not be null");
    }

    public DocumentPipeline filter(Predicate<Map<String, Object>> predicate) {
        return add(new FilterOperation(predicate));
    }

    public DocumentPipeline sort(SortKey... keys) {
        return add(new SortOperation(keys));
    }

    public DocumentPipeline sortBy(String column, SortDirection direction) {
        return add(new SortOperation(new SortKey(column, direction)));
    }

    public DocumentPipeline sortWith(Comparator<Map<String, Object>> comparator) {
        return add(SortOperation.comparing(comparator));
    }

    public DocumentPipeline limit(int count) {
        return add(new LimitOperation(count));
    }

    public DocumentPipeline groupBy(List<String> columns, Map<String, AggregateFunction> aggregates) {
        return add(new GroupByOperation(columns, aggregates));
    }

    public DocumentPipeline addColumn(String column, Function<Map<String, Object>, Object> function) {
        return add(new AddColumnOperation(column, function));
    }

    public DocumentPipeline addColumnAt(String column, Function<Map<String, Object>, Object> function, int position) {
        return add(new AddColumnOperation(column, function, position));
    }

    public DocumentPipeline withOptions(PipelineOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        return this;
    }

    /**
     * Appends an arbitrary operation.
     *
     * @param operation operation to append
     * @return this pipeline
     */
    public DocumentPipeline add(Operation operation) {
        operations.add(Objects.requireNonNull(operation, "operation must not be null"));
        return this;
    }

    public List<Operation> operations() {
        return List.copyOf(operations);
    }

    /**
     * Checks that the document has a table, that the chain respects
     * {@link PipelineOptions#maxOperations()} and that every operation is valid.
     */
    public void validate() {
        if (document.contents().stream().noneMatch(TableContent.class::isInstance)) {
            throw new ValidationException("document", null, "document must contain at least one table");
        }
        if (operations.size() > options.maxOperations()) {
            throw new ValidationException("operations", operations.size(),
                "pipeline exceeds maximum of " + options.maxOperations() + " operations");
        }
        operations.forEach(Operation::validate);
    }

    /**
     * Validates and runs the chain on every table within {@link PipelineOptions#maxExecutionTime()}.
     *
     * @param token cancellation token
     * @return new document whose metadata carries {@link TransformStats}
     */
    public Document execute(CancellationToken token) {
        Objects.requireNonNull(token, "token must not be null");
        CancellationToken bounded = token.withTimeout(options.maxExecutionTime());
        validate();

        List<Operation> ordered = optimizedOrder();
        long started = System.nanoTime();
        List<OperationStat> stats = new ArrayList<>();
        List<Content> contents = new ArrayList<>(document.contents().size());
        int inputRows = 0;
        int outputRows = 0;

        for (Content content : document.contents()) {
            if (!(content instanceof TableContent table)) {
                contents.add(content);
                continue;
            }
            inputRows += table.rows().size();
            Content current = table;
            for (int i = 0; i < ordered.size(); i++) {
                Operation operation = ordered.get(i);
                int before = ((TableContent) current).rows().size();
                long opStarted = System.nanoTime();
                current = TransformationPipeline.step(bounded, table.id(), current, i, operation);
                stats.add(new OperationStat(table.id(), operation.name(), before,
                    ((TableContent) current).rows().size(), Duration.ofNanos(System.nanoTime() - opStarted)));
            }
            outputRows += ((TableContent) current).rows().size();
            contents.add(current);
        }

        TransformStats transformStats = new TransformStats(inputRows, outputRows,
            Math.max(0, inputRows - outputRows), Duration.ofNanos(System.nanoTime() - started), stats);
        log.debug("Document pipeline ran {} operations: {} rows in, {} rows out",
            ordered.size(), inputRows, outputRows);
        return new Document(contents, document.metadata()).withMetadata(STATS_METADATA_KEY, transformStats);
    }

    List<Operation> optimizedOrder() {
        List<Operation> ordered = new ArrayList<>(operations);
        ordered.sort(Comparator.comparingInt(DocumentPipeline::rank));
        return ordered;
    }

    private static int rank(Operation operation) {
        if (operation instanceof FilterOperation) {
            return 0;
        }
        if (operation instanceof AddColumnOperation) {
            return 1;
        }
        if (operation instanceof GroupByOperation) {
            return 2;
        }
        if (operation instanceof SortOperation) {
            return 3;
        }
        if (operation instanceof LimitOperation) {
            return 4;
        }
        return 5;
    }
}
