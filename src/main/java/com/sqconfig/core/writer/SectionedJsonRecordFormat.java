package com.sqconfig.core.writer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.Writer;
import java.util.HashSet;
import java.util.Set;

/**
 * JSON output as one top-level object of sections. Entries of a section must be
 * submitted contiguously; reopening a closed section is rejected.
 */
public class SectionedJsonRecordFormat implements RecordFormat<SectionEntry> {

    private final ObjectMapper mapper;
    private final Set<String> closedSections = new HashSet<>();
    private JsonGenerator generator;
    private String openSection;

    public SectionedJsonRecordFormat(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void begin(Writer out) throws IOException {
        generator = mapper.getFactory().createGenerator(out);
        generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        generator.useDefaultPrettyPrinter();
        generator.writeStartObject();
    }

    @Override
    public void write(SectionEntry entry) throws IOException {
        if (!entry.section().equals(openSection)) {
            closeSection();
            if (!closedSections.add(entry.section())) {
                throw new IllegalStateException("Section '" + entry.section() + "' was already written");
            }
            if (entry.key() == null) {
                generator.writeFieldName(entry.section());
                mapper.writeTree(generator, entry.value());
                return;
            }
            generator.writeObjectFieldStart(entry.section());
            openSection = entry.section();
        } else if (entry.key() == null) {
            throw new IllegalStateException("Section '" + entry.section() + "' mixes keyed and whole entries");
        }
        generator.writeFieldName(entry.key());
        mapper.writeTree(generator, entry.value());
    }

    @Override
    public void end() throws IOException {
        closeSection();
        generator.writeEndObject();
        generator.writeRaw('\n');
        generator.flush();
    }

    private void closeSection() throws IOException {
        if (openSection != null) {
            generator.writeEndObject();
            openSection = null;
        }
    }
}
