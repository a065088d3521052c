package com.docrender.core.pipeline;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.CancelledException;
import com.docrender.core.error.PipelineException;
import com.docrender.core.model.Content;
import com.docrender.core.operation.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the operations attached to one {@link Content} in order, validating each before applying it.
 *
 * <p>Execution is fail-fast. The token is checked before every operation; a cancelled token stops
 * the chain with a {@link CancelledException}. A validation or apply failure stops the chain with a
 * {@link PipelineException} naming the content, the operation index and the stage. The pipeline
 * copies nothing itself: every operation returns new content.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * Content transformed = new TransformationPipeline().applyTransformations(token, table);
 * }</pre>
 */
public class TransformationPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransformationPipeline.class);

    /**
     * Applies the operations of {@code content}.
     *
     * @param token cancellation token
     * @param content input content, left untouched
     * @return transformed content, or {@code content} itself when it has no operations
     */
    public Content applyTransformations(CancellationToken token, Content content) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(content, "content must not be null");
        List<Operation> operations = content.operations();
        if (operations.isEmpty()) {
            return content;
        }

        Content current = content;
        for (int i = 0; i < operations.size(); i++) {
            current = step(token, content.id(), current, i, operations.get(i));
        }
        log.debug("Applied {} operations to content '{}'", operations.size(), content.id());
        return current;
    }

    /**
     * Checks the token, validates and applies a single operation.
     *
     * @param token cancellation token
     * @param contentId id used in diagnostics
     * @param content current content
     * @param index position of the operation in its chain
     * @param operation the operation
     * @return result of the operation
     */
    static Content step(CancellationToken token, String contentId, Content content, int index, Operation operation) {
        if (token.isCancelled()) {
            throw CancelledException.forContent(contentId, token.cause());
        }
        try {
            operation.validate();
        } catch (RuntimeException e) {
            throw new PipelineException(contentId, index, operation.name(), PipelineException.Stage.VALIDATE, e);
        }
        log.debug("Applying operation {} ({}) to content '{}'", index, operation.name(), contentId);
        try {
            return operation.apply(content, token);
        } catch (CancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PipelineException(contentId, index, operation.name(), PipelineException.Stage.APPLY, e);
        }
    }
}
