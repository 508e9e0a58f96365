package com.cloud.costspike.service;

import com.cloud.costspike.exception.CsvFormatException;
import com.cloud.costspike.exception.SchemaException;
import com.cloud.costspike.model.RawCostTable;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads an uploaded billing CSV into a {@link RawCostTable}. Every cell stays a string;
 * typing and validation happen in the normalizer.
 */
@Component
public class CsvCostTableReader {

    private final CsvMapper mapper;

    public CsvCostTableReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public RawCostTable read(InputStream in) {
        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(in)) {
            while (it.hasNextValue()) {
                lines.add(it.nextValue());
            }
        } catch (IOException | RuntimeException e) {
            throw new CsvFormatException("Uploaded file could not be read as CSV: " + e.getMessage(), e);
        }

        if (lines.isEmpty()) {
            throw new SchemaException("Uploaded CSV is empty; expected a header with date, service, cost");
        }

        List<String> header = Arrays.asList(lines.get(0));
        List<List<Object>> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            rows.add(new ArrayList<>(Arrays.asList((Object[]) lines.get(i))));
        }

        return RawCostTable.builder()
                .columns(new ArrayList<>(header))
                .rows(rows)
                .build();
    }
}
