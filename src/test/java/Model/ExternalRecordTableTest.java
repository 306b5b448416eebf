package Model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExternalRecordTableTest {

    @Test
    void looksUpByDerivedKey() {
        ExternalRecordTable table = ExternalRecordTable.of(List.of(
                ExternalRecord.of("R1", "270", "045"),
                ExternalRecord.of("R2", "ACC123", "INV45")));

        assertThat(table.findByCodeAndNumber("270\\45")).map(ExternalRecord::recordId).contains("R1");
        assertThat(table.findByCodeAndNumber("ACC123\\INV45")).map(ExternalRecord::recordId).contains("R2");
        assertThat(table.findByCodeAndNumber("nope")).isEmpty();
        assertThat(table.findByCodeAndNumber(null)).isEmpty();
        assertThat(table.records()).hasSize(2);
    }

    @Test
    void firstRecordWinsWhenKeysCollide() {
        ExternalRecordTable table = ExternalRecordTable.of(List.of(
                ExternalRecord.of("R1", "270", "45"),
                ExternalRecord.of("R9", "0270", "0045")));

        assertThat(table.findByCodeAndNumber("270\\45")).map(ExternalRecord::recordId).contains("R1");
        assertThat(table.records()).hasSize(2);
    }

    @Test
    void emptyTableFindsNothing() {
        assertThat(ExternalRecordTable.empty().records()).isEmpty();
        assertThat(ExternalRecordTable.empty().findByCodeAndNumber("270\\45")).isEmpty();
    }
}
