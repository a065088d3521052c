package com.docrender.core.render.impl;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.CancelledException;
import com.docrender.core.model.CollapsibleSection;
import com.docrender.core.model.Content;
import com.docrender.core.model.Document;
import com.docrender.core.model.SectionContent;
import com.docrender.core.pipeline.TransformationPipeline;
import com.docrender.core.render.Renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for renderers that serialize a document content by content.
 *
 * <p>For every top-level content the token is checked and the transformation pipeline is run,
 * including on nested section content, before the fully transformed item is handed to
 * {@link #renderContent}.
 *
 * @param <S> per-render output state, e.g. a {@link StringBuilder}
 */
public abstract class AbstractContentRenderer<S> implements Renderer {

    private final TransformationPipeline pipeline = new TransformationPipeline();
    private volatile List<FormatterFailure> formatterFailures = List.of();

    @Override
    public final byte[] render(CancellationToken token, Document document) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(document, "document must not be null");
        RenderContext context = new RenderContext(token, format());
        S state = begin(document);
        for (Content content : document.contents()) {
            renderContent(state, transform(token, content), context);
        }
        formatterFailures = context.failures();
        return finish(state, document);
    }

    /**
     * Returns the formatter failures recovered during the most recent render.
     *
     * @return failures, empty when every formatter succeeded
     */
    public List<FormatterFailure> formatterFailures() {
        return formatterFailures;
    }

    /**
     * Creates the output state for one render.
     *
     * @param document document being rendered
     * @return fresh state
     */
    protected abstract S begin(Document document);

    /**
     * Serializes one transformed content item into the state.
     *
     * @param state output state
     * @param content content whose operations, and those of nested content, have been applied
     * @param context render context
     */
    protected abstract void renderContent(S state, Content content, RenderContext context);

    /**
     * Produces the final bytes.
     *
     * @param state output state
     * @param document document being rendered
     * @return rendered bytes
     */
    protected abstract byte[] finish(S state, Document document);

    private Content transform(CancellationToken token, Content content) {
        if (token.isCancelled()) {
            throw CancelledException.forContent(content.id(), token.cause());
        }
        Content transformed = pipeline.applyTransformations(token, content);
        if (transformed instanceof SectionContent section) {
            return new SectionContent(section.id(), section.title(), section.level(), transformAll(token, section.contents()));
        }
        if (transformed instanceof CollapsibleSection section) {
            return new CollapsibleSection(section.id(), section.title(), transformAll(token, section.contents()), section.expanded());
        }
        return transformed;
    }

    private List<Content> transformAll(CancellationToken token, List<Content> contents) {
        List<Content> result = new ArrayList<>(contents.size());
        for (Content child : contents) {
            result.add(transform(token, child));
        }
        return result;
    }
}
