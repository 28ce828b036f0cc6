package com.tzbucket.cli;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Serializes command results as compact (one record per line) or pretty-printed JSON.
 */
@Component
public class OutputRenderer {

    private final ObjectWriter compactWriter;
    private final ObjectWriter prettyWriter;

    public OutputRenderer(ObjectMapper objectMapper) {
        this.compactWriter = objectMapper.writer();
        this.prettyWriter = objectMapper.writer(new TwoSpacePrettyPrinter());
    }

    public String compact(Object value) {
        return write(compactWriter, value);
    }

    public String pretty(Object value) {
        return write(prettyWriter, value);
    }

    private static String write(ObjectWriter writer, Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Two-space indentation for objects and arrays, {@code "name": value} separators.
     */
    static final class TwoSpacePrettyPrinter extends DefaultPrettyPrinter {

        TwoSpacePrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        private TwoSpacePrettyPrinter(TwoSpacePrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new TwoSpacePrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }
    }
}
