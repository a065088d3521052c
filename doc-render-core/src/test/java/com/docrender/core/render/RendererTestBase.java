package com.docrender.core.render;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.model.Document;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for render orchestration tests.
 *
 * <p>Provides in-memory renderers, writers, transformers and a recording progress sink.
 */
public abstract class RendererTestBase {

    protected static OutputFormat format(String name) {
        return new OutputFormat(name, new FixedRenderer(name, name + "-output"));
    }

    protected static String text(byte[] data) {
        return new String(data, StandardCharsets.UTF_8);
    }

    /**
     * Renderer that always returns the same bytes and counts its calls.
     */
    protected static class FixedRenderer implements Renderer {

        private final String format;
        private final byte[] output;
        final AtomicInteger calls = new AtomicInteger();

        FixedRenderer(String format, String output) {
            this.format = format;
            this.output = output.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String format() {
            return format;
        }

        @Override
        public byte[] render(CancellationToken token, Document document) {
            calls.incrementAndGet();
            return output.clone();
        }
    }

    /**
     * Renderer that always fails.
     */
    protected static class FailingRenderer implements Renderer {

        @Override
        public String format() {
            return "broken";
        }

        @Override
        public byte[] render(CancellationToken token, Document document) {
            throw new IllegalStateException("renderer exploded");
        }
    }

    /**
     * A write observed by {@link RecordingWriter}.
     *
     * @param writer writer name
     * @param format format name
     * @param data written text
     */
    protected record Write(String writer, String format, String data) {
    }

    /**
     * Thread-safe writer that records every write.
     */
    protected static class RecordingWriter implements OutputWriter {

        private final String name;
        final List<Write> writes = new CopyOnWriteArrayList<>();

        RecordingWriter(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void write(CancellationToken token, String format, byte[] data) {
            writes.add(new Write(name, format, text(data)));
        }

        List<String> formats() {
            return writes.stream().map(Write::format).toList();
        }
    }

    /**
     * Writer that fails for every format, or only for the given one.
     */
    protected static class FailingWriter implements OutputWriter {

        private final String failingFormat;
        final List<Write> writes = new CopyOnWriteArrayList<>();

        FailingWriter(String failingFormat) {
            this.failingFormat = failingFormat;
        }

        @Override
        public void write(CancellationToken token, String format, byte[] data) {
            if (failingFormat == null || failingFormat.equals(format)) {
                throw new IllegalStateException("disk full");
            }
            writes.add(new Write(name(), format, text(data)));
        }
    }

    /**
     * Transformer that appends a suffix.
     */
    protected static class SuffixTransformer implements Transformer {

        private final String name;
        private final int priority;
        private final String format;

        SuffixTransformer(String name, int priority, String format) {
            this.name = name;
            this.priority = priority;
            this.format = format;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public boolean canTransform(String format) {
            return this.format == null || this.format.equals(format);
        }

        @Override
        public byte[] transform(CancellationToken token, byte[] data, String format) {
            return (text(data) + "+" + name).getBytes(StandardCharsets.UTF_8);
        }
    }

    /**
     * Progress sink that records every call.
     */
    protected static class RecordingProgress implements Progress {

        volatile int total = -1;
        final List<Integer> currents = new CopyOnWriteArrayList<>();
        volatile boolean completed;
        volatile Throwable failure;
        volatile boolean closed;

        @Override
        public void setTotal(int total) {
            this.total = total;
        }

        @Override
        public void setCurrent(int current) {
            currents.add(current);
        }

        @Override
        public void increment() {
            currents.add(currents.size() + 1);
        }

        @Override
        public void setStatus(String status) {
        }

        @Override
        public void complete() {
            completed = true;
        }

        @Override
        public void fail(Throwable error) {
            failure = error;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    protected static Document emptyDocument() {
        return new Document(List.of(), Map.of());
    }
}
