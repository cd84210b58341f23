package io.sqlrpc.worker;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class SeedLoader {
    static final String INTEGER = "integer";
    static final String REAL = "real";
    static final String TEXT = "text";

    private SeedLoader() {
    }

    static SeedData read(Path file) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .build();
        List<String> columns;
        List<List<String>> raw = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, format)) {
            columns = new ArrayList<>(parser.getHeaderNames());
            for (CSVRecord record : parser) {
                List<String> values = new ArrayList<>(columns.size());
                for (int i = 0; i < columns.size(); i++) {
                    values.add(i < record.size() ? record.get(i) : "");
                }
                raw.add(values);
            }
        }
        if (columns.isEmpty()) {
            throw new IOException("Seed file " + file.getFileName() + " has no header row");
        }
        List<String> types = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            types.add(inferType(raw, i));
        }
        List<List<Object>> rows = new ArrayList<>(raw.size());
        for (List<String> values : raw) {
            List<Object> row = new ArrayList<>(values.size());
            for (int i = 0; i < values.size(); i++) {
                row.add(convert(values.get(i), types.get(i)));
            }
            rows.add(row);
        }
        return new SeedData(columns, types, rows);
    }

    private static String inferType(List<List<String>> rows, int column) {
        boolean integral = true;
        boolean numeric = true;
        boolean sawValue = false;
        for (List<String> row : rows) {
            String value = row.get(column);
            if (value.isEmpty()) {
                continue;
            }
            sawValue = true;
            if (integral && !isLong(value)) {
                integral = false;
            }
            if (!integral && !isDouble(value)) {
                numeric = false;
                break;
            }
        }
        if (!sawValue) {
            return TEXT;
        }
        if (integral) {
            return INTEGER;
        }
        return numeric ? REAL : TEXT;
    }

    private static Object convert(String value, String type) {
        if (value.isEmpty()) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return Long.parseLong(value);
            case REAL:
                return Double.parseDouble(value);
            default:
                return value;
        }
    }

    private static boolean isLong(String value) {
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDouble(String value) {
        try {
            double parsed = Double.parseDouble(value);
            return !Double.isNaN(parsed) && !Double.isInfinite(parsed);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    record SeedData(List<String> columns, List<String> types, List<List<Object>> rows) {
    }
}
