package com.docrender.core.render;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.CancelledException;
import com.docrender.core.error.ConfigurationException;
import com.docrender.core.error.DocRenderException;
import com.docrender.core.error.ErrorSource;
import com.docrender.core.error.MultiRenderException;
import com.docrender.core.error.RenderException;
import com.docrender.core.error.TransformException;
import com.docrender.core.error.WriterException;
import com.docrender.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Renders a document to several formats concurrently and hands every result to every writer.
 *
 * <p>Each render call snapshots the configuration under a read lock and then works on the
 * snapshot, so formats, writers and transformers may be added concurrently without affecting a
 * render in flight. One worker per format renders, applies matching transformers in ascending
 * priority and writes to all writers in registration order. A failure ends only its own format;
 * the other formats continue. All failures are reported together as a {@link MultiRenderException}.
 * Output already written is never rolled back.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderOrchestrator orchestrator = RenderOrchestrator.builder()
 *     .format(OutputFormat.of(new JsonRenderer()))
 *     .format(OutputFormat.of(new MarkdownRenderer()))
 *     .writer(new FileSystemWriter(Path.of("out"), "report"))
 *     .progress(new LoggingProgress())
 *     .build();
 *
 * orchestrator.render(CancellationToken.create().withTimeout(Duration.ofSeconds(30)), document);
 * }</pre>
 */
public class RenderOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RenderOrchestrator.class);

    private final ReadWriteLock configLock = new ReentrantReadWriteLock();
    private final List<OutputFormat> formats;
    private final List<OutputWriter> writers;
    private final List<Transformer> transformers;
    private final Progress progress;

    private RenderOrchestrator(Builder builder) {
        this.formats = new ArrayList<>(builder.formats);
        this.writers = new ArrayList<>(builder.writers);
        this.transformers = new ArrayList<>(builder.transformers);
        this.progress = builder.progress;
    }

    public static Builder builder() {
        return new Builder();
    }

    public void addFormat(OutputFormat format) {
        Objects.requireNonNull(format, "format must not be null");
        configLock.writeLock().lock();
        try {
            formats.add(format);
        } finally {
            configLock.writeLock().unlock();
        }
    }

    public void addWriter(OutputWriter writer) {
        Objects.requireNonNull(writer, "writer must not be null");
        configLock.writeLock().lock();
        try {
            writers.add(writer);
        } finally {
            configLock.writeLock().unlock();
        }
    }

    public void addTransformer(Transformer transformer) {
        Objects.requireNonNull(transformer, "transformer must not be null");
        configLock.writeLock().lock();
        try {
            transformers.add(transformer);
        } finally {
            configLock.writeLock().unlock();
        }
    }

    /**
     * Renders the document to every configured format and writes each result to every writer.
     *
     * @param token cancellation token, checked before rendering and before every write
     * @param document document to render, never modified
     * @throws ConfigurationException if no format or no writer is configured
     * @throws MultiRenderException if any format or writer failed
     */
    public void render(CancellationToken token, Document document) {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(document, "document must not be null");
        Snapshot snapshot = snapshot();

        if (snapshot.formats().isEmpty()) {
            throw new ConfigurationException("no output formats configured");
        }
        if (snapshot.writers().isEmpty()) {
            throw new ConfigurationException("no writers configured");
        }

        int total = snapshot.formats().size() * snapshot.writers().size();
        progress.setTotal(total);
        log.info("Rendering {} formats to {} writers", snapshot.formats().size(), snapshot.writers().size());

        BlockingQueue<Failure> failures = new ArrayBlockingQueue<>(total);
        WriteCounter counter = new WriteCounter();
        ExecutorService executor = Executors.newFixedThreadPool(snapshot.formats().size(), new WorkerThreadFactory());
        try {
            List<CompletableFuture<Void>> workers = new ArrayList<>();
            for (int i = 0; i < snapshot.formats().size(); i++) {
                int index = i;
                OutputFormat format = snapshot.formats().get(i);
                workers.add(CompletableFuture.runAsync(() -> {
                    DocRenderException failure;
                    try {
                        failure = processFormat(token, document, format, snapshot, counter);
                    } catch (RuntimeException e) {
                        failure = new RenderException(format.name(), rendererType(format), 0, e);
                    }
                    if (failure != null && !failures.offer(new Failure(index, failure))) {
                        log.warn("Failure queue full, dropping failure for format {}", format.name());
                    }
                }, executor));
            }
            CompletableFuture.allOf(workers.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdown();
        }

        if (failures.isEmpty()) {
            progress.complete();
            log.info("Rendered {} formats, {} writes", snapshot.formats().size(), counter.value());
            return;
        }

        List<Failure> collected = new ArrayList<>(failures);
        collected.sort(Comparator.comparingInt(Failure::formatIndex));
        MultiRenderException aggregate = new MultiRenderException(
            collected.stream().map(failure -> ErrorSource.classify(failure.error())).toList());
        progress.fail(aggregate);
        throw aggregate;
    }

    @Override
    public void close() {
        progress.close();
    }

    private DocRenderException processFormat(
            CancellationToken token, Document document, OutputFormat format, Snapshot snapshot, WriteCounter counter) {
        if (token.isCancelled()) {
            return CancelledException.forFormat(format.name(), token.cause());
        }

        byte[] data;
        try {
            data = format.renderer().render(token, document);
        } catch (CancelledException e) {
            return CancelledException.forFormat(format.name(), e.getCause());
        } catch (RuntimeException e) {
            return new RenderException(format.name(), rendererType(format), 0, e);
        }
        if (data == null) {
            return new RenderException(format.name(), rendererType(format), 0,
                new IllegalStateException("renderer returned no output"));
        }
        log.debug("Rendered format {} ({} bytes)", format.name(), data.length);

        for (Transformer transformer : snapshot.transformers()) {
            byte[] transformed;
            try {
                if (!transformer.canTransform(format.name())) {
                    continue;
                }
                transformed = transformer.transform(token, data, format.name());
            } catch (CancelledException e) {
                return CancelledException.forFormat(format.name(), e.getCause());
            } catch (RuntimeException e) {
                return new TransformException(transformer.name(), format.name(), data.length, e);
            }
            if (transformed == null) {
                return new TransformException(transformer.name(), format.name(), data.length,
                    new IllegalStateException("transformer returned no output"));
            }
            data = transformed;
        }

        for (OutputWriter writer : snapshot.writers()) {
            if (token.isCancelled()) {
                return CancelledException.forFormat(format.name(), token.cause());
            }
            try {
                writer.write(token, format.name(), data);
            } catch (CancelledException e) {
                return CancelledException.forFormat(format.name(), e.getCause());
            } catch (RuntimeException e) {
                return new WriterException(writer.name(), format.name(), data.length, e);
            }
            counter.advance();
        }
        return null;
    }

    private static String rendererType(OutputFormat format) {
        Class<?> type = format.renderer().getClass();
        return type.getSimpleName().isBlank() ? type.getName() : type.getSimpleName();
    }

    private Snapshot snapshot() {
        configLock.readLock().lock();
        try {
            List<Transformer> ordered = new ArrayList<>(transformers);
            ordered.sort(Comparator.comparingInt(Transformer::priority));
            return new Snapshot(List.copyOf(formats), List.copyOf(writers), List.copyOf(ordered));
        } finally {
            configLock.readLock().unlock();
        }
    }

    private record Snapshot(List<OutputFormat> formats, List<OutputWriter> writers, List<Transformer> transformers) {
    }

    private record Failure(int formatIndex, DocRenderException error) {
    }

    private final class WriteCounter {

        private final Object lock = new Object();
        private int completed;

        void advance() {
            synchronized (lock) {
                completed++;
                progress.setCurrent(completed);
            }
        }

        int value() {
            synchronized (lock) {
                return completed;
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger POOL = new AtomicInteger();

        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger thread = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread worker = new Thread(runnable, "docrender-" + pool + "-format-" + thread.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        }
    }

    /**
     * Builder for {@link RenderOrchestrator}.
     */
    public static final class Builder {

        private final List<OutputFormat> formats = new ArrayList<>();
        private final List<OutputWriter> writers = new ArrayList<>();
        private final List<Transformer> transformers = new ArrayList<>();
        private Progress progress = NoOpProgress.INSTANCE;

        private Builder() {
        }

        public Builder format(OutputFormat format) {
            formats.add(Objects.requireNonNull(format, "format must not be null"));
            return this;
        }

        public Builder formats(List<OutputFormat> formats) {
            formats.forEach(this::format);
            return this;
        }

        public Builder writer(OutputWriter writer) {
            writers.add(Objects.requireNonNull(writer, "writer must not be null"));
            return this;
        }

        public Builder writers(List<? extends OutputWriter> writers) {
            writers.forEach(this::writer);
            return this;
        }

        public Builder transformer(Transformer transformer) {
            transformers.add(Objects.requireNonNull(transformer, "transformer must not be null"));
            return this;
        }

        public Builder transformers(List<? extends Transformer> transformers) {
            transformers.forEach(this::transformer);
            return this;
        }

        public Builder progress(Progress progress) {
            this.progress = Objects.requireNonNull(progress, "progress must not be null");
            return this;
        }

        public RenderOrchestrator build() {
            return new RenderOrchestrator(this);
        }
    }
}
