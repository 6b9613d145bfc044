package com.sqconfig.core.writer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.Writer;
import java.util.function.Function;

/**
 * JSON output: a single array, one element per record.
 */
public class JsonArrayRecordFormat<T> implements RecordFormat<T> {

    private final ObjectMapper mapper;
    private final Function<T, JsonNode> toJson;
    private JsonGenerator generator;

    public JsonArrayRecordFormat(ObjectMapper mapper, Function<T, JsonNode> toJson) {
        this.mapper = mapper;
        this.toJson = toJson;
    }

    @Override
    public void begin(Writer out) throws IOException {
        generator = mapper.getFactory().createGenerator(out);
        generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        generator.useDefaultPrettyPrinter();
        generator.writeStartArray();
    }

    @Override
    public void write(T record) throws IOException {
        mapper.writeTree(generator, toJson.apply(record));
    }

    @Override
    public void end() throws IOException {
        generator.writeEndArray();
        generator.writeRaw('\n');
        generator.flush();
    }
}
