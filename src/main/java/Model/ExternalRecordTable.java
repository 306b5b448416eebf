package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

public final class ExternalRecordTable {

    private static final Logger log = LoggerFactory.getLogger(ExternalRecordTable.class);

    private static final ExternalRecordTable EMPTY = new ExternalRecordTable(List.of(), Map.of());

    private final List<ExternalRecord> records;
    private final Map<String, ExternalRecord> byKey;

    private ExternalRecordTable(List<ExternalRecord> records, Map<String, ExternalRecord> byKey) {
        this.records = records;
        this.byKey = byKey;
    }

    public static ExternalRecordTable empty() {
        return EMPTY;
    }

    public static ExternalRecordTable of(Collection<ExternalRecord> records) {
        Map<String, ExternalRecord> byKey = new HashMap<>();
        for (ExternalRecord r : records) {
            ExternalRecord previous = byKey.putIfAbsent(r.codeAndNumber(), r);
            if (previous != null) {
                log.warn("Records {} and {} share key {}, keeping {}",
                        previous.recordId(), r.recordId(), r.codeAndNumber(), previous.recordId());
            }
        }
        return new ExternalRecordTable(List.copyOf(records), Map.copyOf(byKey));
    }

    public Optional<ExternalRecord> findByCodeAndNumber(String codeAndNumber) {
        return codeAndNumber == null ? Optional.empty() : Optional.ofNullable(byKey.get(codeAndNumber));
    }

    public List<ExternalRecord> records() {
        return records;
    }
}
