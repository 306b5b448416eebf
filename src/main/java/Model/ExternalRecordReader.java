package Model;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Loads the archive export: a CSV with a header row and columns
 * {@code recordId, accessionNumber, inventoryNumber} plus an optional {@code suffix}.
 */
public final class ExternalRecordReader {

    private static final Logger log = LoggerFactory.getLogger(ExternalRecordReader.class);

    public static final String RECORD_ID = "recordId";
    public static final String ACCESSION = "accessionNumber";
    public static final String INVENTORY = "inventoryNumber";
    public static final String SUFFIX = "suffix";

    // the archive export wraps multi-valued cells in line-break markup
    private static final Pattern MARKUP = Pattern.compile("(?i)<br\\s*/?>|</?b>");

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    public ExternalRecordTable read(Path csv) {
        try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read external records from " + csv, e);
        }
    }

    /** Rows with more non-blank cells than the header are skipped; unparseable CSV fails the whole read. */
    public ExternalRecordTable read(Reader reader) throws IOException {
        List<ExternalRecord> records = new ArrayList<>();

        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
            if (!it.hasNextValue()) return ExternalRecordTable.empty();
            List<String> header = new ArrayList<>();
            for (String name : it.nextValue()) header.add(name.trim());

            int row = 1;
            while (it.hasNextValue()) {
                row++;
                String[] cells = it.nextValue();
                if (hasStrayCells(cells, header.size())) {
                    log.warn("Skipping row {}: {} cells but only {} columns", row, cells.length, header.size());
                    continue;
                }

                String id = clean(cell(cells, header, RECORD_ID));
                String accession = clean(cell(cells, header, ACCESSION));
                String inventory = clean(cell(cells, header, INVENTORY));

                if (id == null || inventory == null) {
                    log.warn("Skipping row {}: recordId and inventoryNumber are required", row);
                    continue;
                }
                try {
                    records.add(ExternalRecord.of(id, accession, inventory, clean(cell(cells, header, SUFFIX))));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping row {} ({}): {}", row, id, e.getMessage());
                }
            }
        }

        log.info("Loaded {} external records", records.size());
        return ExternalRecordTable.of(records);
    }

    private static boolean hasStrayCells(String[] cells, int columns) {
        for (int i = columns; i < cells.length; i++) {
            if (!cells[i].isBlank()) return true;
        }
        return false;
    }

    private static String cell(String[] cells, List<String> header, String column) {
        int i = header.indexOf(column);
        return i < 0 || i >= cells.length ? null : cells[i];
    }

    static String clean(String cell) {
        if (cell == null) return null;
        String v = MARKUP.matcher(cell).replaceAll(",").trim();
        int from = 0;
        int to = v.length();
        while (from < to && v.charAt(from) == ',') from++;
        while (to > from && v.charAt(to - 1) == ',') to--;
        v = v.substring(from, to).trim();
        return v.isEmpty() ? null : v;
    }
}
