package com.docrender.cli;

import com.docrender.core.config.ConfigLoader;
import com.docrender.core.config.RenderConfig;
import com.docrender.core.error.DocRenderException;
import com.docrender.core.render.RendererRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file: syntax, values and format names.
 */
@Command(
    name = "validate",
    description = "Validate configuration file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        try {
            RenderConfig config = ConfigLoader.loadStrict(configFile);
            RendererRegistry.load().resolve(config.formats());
            spec.commandLine().getOut().printf("Configuration %s is valid (formats: %s)%n",
                configFile, String.join(", ", config.formats()));
            return 0;
        } catch (DocRenderException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }
    }
}
