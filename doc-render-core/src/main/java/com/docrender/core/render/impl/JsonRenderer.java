package com.docrender.core.render.impl;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders documents as pretty-printed JSON.
 */
public class JsonRenderer extends StructuredRenderer {

    public JsonRenderer() {
        super(new ObjectMapper());
    }

    @Override
    public String format() {
        return "json";
    }
}
