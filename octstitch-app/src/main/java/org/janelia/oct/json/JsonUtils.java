package org.janelia.oct.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.File;
import java.io.IOException;
import java.io.Reader;

/**
 * Utilities for working with JSON data.
 *
 * Scan configuration, dimension metadata, and parameter records are all (de)serialized
 * through field access so that classes can keep immutable-looking getters without setters.
 *
 * @author Eric Trautman
 */
public class JsonUtils {

    public static DefaultPrettyPrinter getArraysOnNewLinePrettyPrinter() {
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentArraysWith(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);
        return printer;
    }

    public static final ObjectMapper FAST_MAPPER = new ObjectMapper().
            setSerializationInclusion(JsonInclude.Include.NON_NULL).
            setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
            setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false).
            configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false);

    public static final ObjectMapper MAPPER = FAST_MAPPER.copy().
            setDefaultPrettyPrinter(getArraysOnNewLinePrettyPrinter()).
            enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Typed wrapper around {@link #MAPPER} that converts Jackson's checked exceptions
     * into {@link IllegalArgumentException}s for string based conversions.
     */
    public static class Helper<T> {

        private final ObjectMapper mapper;
        private final Class<T> valueType;

        public Helper(final Class<T> valueType) {
            this(MAPPER, valueType);
        }

        public Helper(final ObjectMapper mapper,
                      final Class<T> valueType) {
            this.mapper = mapper;
            this.valueType = valueType;
        }

        public String toJson(final T value)
                throws IllegalArgumentException {
            try {
                return mapper.writeValueAsString(value);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public T fromJson(final Reader json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public T fromJsonFile(final File file)
                throws IOException {
            try {
                return mapper.readValue(file, valueType);
            } catch (final IOException e) {
                throw new IOException("failed to parse " + file.getAbsolutePath(), e);
            }
        }

    }

}
