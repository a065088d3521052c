package com.docrender.core.render;

import com.docrender.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Discovers {@link Renderer} implementations via {@link ServiceLoader} and resolves format names.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RendererRegistry registry = RendererRegistry.load();
 * List<OutputFormat> formats = registry.resolve(List.of("json", "markdown"));
 * }</pre>
 */
public class RendererRegistry {

    private static final Logger log = LoggerFactory.getLogger(RendererRegistry.class);

    private final Map<String, Renderer> renderers;

    public RendererRegistry(List<Renderer> renderers) {
        Map<String, Renderer> byFormat = new LinkedHashMap<>();
        for (Renderer renderer : renderers) {
            Renderer previous = byFormat.putIfAbsent(renderer.format(), renderer);
            if (previous != null) {
                log.warn("Ignoring renderer {} for format {}: already provided by {}",
                    renderer.getClass().getName(), renderer.format(), previous.getClass().getName());
            }
        }
        this.renderers = Collections.unmodifiableMap(byFormat);
    }

    /**
     * Loads all renderers registered on the class path.
     *
     * @return registry
     */
    public static RendererRegistry load() {
        List<Renderer> found = new ArrayList<>();
        ServiceLoader.load(Renderer.class).forEach(found::add);
        log.debug("Discovered {} renderers", found.size());
        return new RendererRegistry(found);
    }

    /**
     * Returns the available format names in discovery order.
     *
     * @return format names
     */
    public List<String> formats() {
        return List.copyOf(renderers.keySet());
    }

    public Optional<Renderer> find(String format) {
        return Optional.ofNullable(renderers.get(format.toLowerCase()));
    }

    /**
     * Resolves format names to output formats.
     *
     * @param names format names
     * @return output formats in the given order
     * @throws ConfigurationException if a name is unknown
     */
    public List<OutputFormat> resolve(List<String> names) {
        List<OutputFormat> resolved = new ArrayList<>(names.size());
        for (String name : names) {
            Renderer renderer = find(name).orElseThrow(() -> new ConfigurationException(
                "Unknown format '" + name + "', available: " + formats()));
            resolved.add(new OutputFormat(renderer.format(), renderer));
        }
        return resolved;
    }
}
