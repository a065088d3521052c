package com.docrender.core.render.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Renders documents as YAML.
 */
public class YamlRenderer extends StructuredRenderer {

    public YamlRenderer() {
        super(new ObjectMapper(new YAMLFactory()));
    }

    @Override
    public String format() {
        return "yaml";
    }
}
