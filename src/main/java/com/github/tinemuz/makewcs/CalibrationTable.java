/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.makewcs;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A calibration table (IDCTAB or OFFTAB): a few header cards plus a list of
 * rows with named columns.
 *
 * <p>Column names are case-insensitive and stored upper case. Cells are kept
 * as strings and converted on access, which keeps the on-disk column names and
 * the {@code -999} chip wildcard exactly as written.</p>
 *
 * <p>The text form read by {@link #load(Path)} looks like:</p>
 * <pre>
 * # comment
 * NORDER = 4
 * DETECTOR = WFC
 * COLUMNS DETCHIP DIRECTION FILTER1 FILTER2 XREF YREF ...
 * 1 FORWARD CLEAR CLEAR 2048.0 1024.0 ...
 * </pre>
 */
public final class CalibrationTable {
    private static final Logger log = LoggerFactory.getLogger(CalibrationTable.class);

    private final String name;
    private final Map<String, String> header;
    private final List<String> columns;
    private final Map<String, Integer> columnIndex;
    private final List<String[]> rows;

    private CalibrationTable(
            String name, Map<String, String> header, List<String> columns, List<String[]> rows) {
        this.name = name;
        this.header = Collections.unmodifiableMap(new LinkedHashMap<>(header));
        this.columns = List.copyOf(columns);
        this.columnIndex = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) columnIndex.put(columns.get(i), i);
        this.rows = List.copyOf(rows);
    }

    /**
     * Read a table from a text file.
     *
     * @throws IOException if the file is missing or cannot be parsed; the
     *     message names the file
     */
    public static CalibrationTable load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "calibration table not found");
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(path.getFileName().toString(), in);
        }
    }

    /** Read a table from a classpath resource. */
    public static CalibrationTable fromResource(String resource) throws IOException {
        InputStream in = CalibrationTable.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new NoSuchFileException(resource, null, "calibration table not on classpath");
        }
        try (in) {
            return read(resource, in);
        }
    }

    /**
     * Parse the text form. Header cards ({@code KEY = value}) come before the
     * {@code COLUMNS} line; every non-blank line after it is a row.
     */
    static CalibrationTable read(String name, InputStream in) throws IOException {
        Map<String, String> header = new LinkedHashMap<>();
        List<String> columns = new ArrayList<>();
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader br =
                new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                if (columns.isEmpty()) {
                    if (line.regionMatches(true, 0, "COLUMNS", 0, 7)) {
                        String[] toks = line.split("\\s+");
                        for (int i = 1; i < toks.length; i++) columns.add(toks[i].toUpperCase());
                        continue;
                    }
                    int eq = line.indexOf('=');
                    if (eq <= 0) {
                        throw new IOException(
                                name + ": line " + lineNo + " is neither a header card nor COLUMNS");
                    }
                    header.put(line.substring(0, eq).trim().toUpperCase(), unquote(line.substring(eq + 1)));
                    continue;
                }
                String[] toks = line.split("\\s+");
                if (toks.length != columns.size()) {
                    throw new IOException(
                            name + ": line " + lineNo + " has " + toks.length + " values for "
                                    + columns.size() + " columns");
                }
                rows.add(toks);
            }
        }
        if (columns.isEmpty()) {
            throw new IOException(name + ": no COLUMNS line");
        }
        log.debug("Read calibration table {} ({} rows)", name, rows.size());
        return new CalibrationTable(name, header, columns, rows);
    }

    private static String unquote(String raw) {
        String s = raw.trim();
        if (s.length() >= 2 && s.startsWith("'") && s.endsWith("'")) {
            s = s.substring(1, s.length() - 1).trim();
        }
        return s;
    }

    public String name() {
        return name;
    }

    public int rowCount() {
        return rows.size();
    }

    public List<String> columns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column.toUpperCase());
    }

    /** Header card value, or {@code null}. */
    public String headerValue(String key) {
        return header.get(key.toUpperCase());
    }

    public boolean hasHeader(String key) {
        return header.containsKey(key.toUpperCase());
    }

    /** Raw cell text. */
    public String getString(int row, String column) {
        Integer idx = columnIndex.get(column.toUpperCase());
        if (idx == null) {
            throw new IllegalArgumentException(name + " has no column " + column);
        }
        return rows.get(row)[idx];
    }

    public double getDouble(int row, String column) {
        return Double.parseDouble(getString(row, column));
    }

    /** Builder for tables assembled in memory. */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, String> header = new LinkedHashMap<>();
        private final List<String> columns = new ArrayList<>();
        private final List<String[]> rows = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder header(String key, Object value) {
            header.put(key.toUpperCase(), String.valueOf(value));
            return this;
        }

        public Builder columns(String... names) {
            for (String n : names) columns.add(n.toUpperCase());
            return this;
        }

        public Builder row(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException(
                        "Row has " + values.length + " values for " + columns.size() + " columns");
            }
            rows.add(Arrays.stream(values).map(String::valueOf).toArray(String[]::new));
            return this;
        }

        public CalibrationTable build() {
            return new CalibrationTable(name, header, columns, rows);
        }
    }
}
