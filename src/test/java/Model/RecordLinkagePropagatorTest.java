package Model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static Model.Records.hashed;
import static Model.Records.image;
import static org.assertj.core.api.Assertions.assertThat;

class RecordLinkagePropagatorTest {

    private final RecordLinkagePropagator propagator = new RecordLinkagePropagator(new FileNameCodeAndNumberExtractor());
    private final ExactDuplicateClassifier exact = new ExactDuplicateClassifier();
    private final SimilarityClassifier similar = new SimilarityClassifier();

    private LinkageReport link(List<ImageRecord> records, ExternalRecordTable table) {
        return propagator.link(records, exact.classify(records).groups(), similar.classify(records), table);
    }

    private static LinkageResult result(LinkageReport report, String path) {
        return report.find(path).orElseThrow();
    }

    @Test
    @DisplayName("an unlabelled exact duplicate inherits the record of its labelled sibling")
    void propagatesThroughExactDuplicateGroup() {
        List<ImageRecord> records = List.of(
                hashed("/scans/ACC123_INV45.jpg", "c1", "01"),
                hashed("/scans/scan002.jpg", "c1", "01"));
        ExternalRecordTable table = ExternalRecordTable.of(List.of(ExternalRecord.of("R1", "ACC123", "INV45")));

        LinkageReport report = link(records, table);

        assertThat(result(report, "/scans/ACC123_INV45.jpg"))
                .isEqualTo(LinkageResult.direct("/scans/ACC123_INV45.jpg", "ACC123\\INV45", "R1"));
        LinkageResult propagated = result(report, "/scans/scan002.jpg");
        assertThat(propagated.status()).isEqualTo(LinkageStatus.PROPAGATED);
        assertThat(propagated.recordId()).isEqualTo("R1");
        assertThat(propagated.viaGroupKind()).isEqualTo(GroupKind.EXACT_DUPLICATE);
        assertThat(propagated.viaGroupKey()).isEqualTo("01/c1");
        assertThat(report.conflicts()).isEmpty();
    }

    @Test
    @DisplayName("a group linking to two different records propagates nothing and is flagged")
    void conflictingGroupWithholdsPropagation() {
        List<ImageRecord> records = List.of(
                hashed("/scans/A1_1.jpg", "c1", "01"),
                hashed("/scans/A2_2.jpg", "c1", "01"),
                hashed("/scans/loose.jpg", "c1", "01"));
        ExternalRecordTable table = ExternalRecordTable.of(List.of(
                ExternalRecord.of("R1", "A1", "1"),
                ExternalRecord.of("R2", "A2", "2")));

        LinkageReport report = link(records, table);

        assertThat(result(report, "/scans/A1_1.jpg").status()).isEqualTo(LinkageStatus.DIRECT);
        assertThat(result(report, "/scans/A2_2.jpg").status()).isEqualTo(LinkageStatus.DIRECT);
        LinkageResult loose = result(report, "/scans/loose.jpg");
        assertThat(loose.status()).isEqualTo(LinkageStatus.CONFLICTED);
        assertThat(loose.recordId()).isNull();
        assertThat(report.conflicts()).singleElement().satisfies(c -> {
            assertThat(c.groupKind()).isEqualTo(GroupKind.EXACT_DUPLICATE);
            assertThat(c.recordIds()).containsExactly("R1", "R2");
            assertThat(c.filePaths()).hasSize(3);
        });
    }

    @Test
    void ungroupedImageWithoutDirectMatchStaysUnlinked() {
        List<ImageRecord> records = List.of(
                hashed("/scans/ACC1_INV1.jpg", "c1", "01"),
                hashed("/scans/other.jpg", "c2", "02"));
        ExternalRecordTable table = ExternalRecordTable.of(List.of(ExternalRecord.of("R1", "ACC1", "INV1")));

        LinkageReport report = link(records, table);

        assertThat(result(report, "/scans/other.jpg")).isEqualTo(LinkageResult.unlinked("/scans/other.jpg", null));
    }

    @Test
    void keyWithoutMatchingRecordIsUnlinkedButKeepsItsKey() {
        LinkageReport report = link(List.of(hashed("/scans/ACC9_INV9.jpg", "c1", "01")), ExternalRecordTable.empty());

        assertThat(result(report, "/scans/ACC9_INV9.jpg"))
                .isEqualTo(LinkageResult.unlinked("/scans/ACC9_INV9.jpg", "ACC9\\INV9"));
    }

    @Test
    void similarityGroupIsUsedWhenImageHasNoExactDuplicate() {
        List<ImageRecord> records = List.of(
                image("/scans/ACC1_INV1.jpg", "c1", "01", "ffff", 100, 100, null),
                image("/scans/rescan.png", "c2", "02", "ffff", 50, 50, null));
        ExternalRecordTable table = ExternalRecordTable.of(List.of(ExternalRecord.of("R1", "ACC1", "INV1")));

        LinkageResult rescan = result(link(records, table), "/scans/rescan.png");

        assertThat(rescan.status()).isEqualTo(LinkageStatus.PROPAGATED);
        assertThat(rescan.recordId()).isEqualTo("R1");
        assertThat(rescan.viaGroupKind()).isEqualTo(GroupKind.SIMILAR);
    }

    @Test
    void exactDuplicateGroupTakesPrecedenceOverSimilarityGroup() {
        List<ImageRecord> records = List.of(
                image("/scans/ACC1_INV1.jpg", "c1", "01", "ffff", 100, 100, null),
                image("/scans/copy.jpg", "c1", "01", "ffff", 100, 100, null),
                image("/scans/ACC2_INV2.png", "c2", "02", "ffff", 100, 100, null));
        ExternalRecordTable table = ExternalRecordTable.of(List.of(
                ExternalRecord.of("R1", "ACC1", "INV1"),
                ExternalRecord.of("R2", "ACC2", "INV2")));

        LinkageReport report = link(records, table);

        LinkageResult copy = result(report, "/scans/copy.jpg");
        assertThat(copy.status()).isEqualTo(LinkageStatus.PROPAGATED);
        assertThat(copy.recordId()).isEqualTo("R1");
        assertThat(copy.viaGroupKind()).isEqualTo(GroupKind.EXACT_DUPLICATE);
        // the similarity group spans R1 and R2, it is still reported
        assertThat(report.conflicts()).extracting(IdentityConflict::groupKind).containsExactly(GroupKind.SIMILAR);
    }

    @Test
    void conflictInExactGroupIsNotOverriddenBySimilarityGroup() {
        List<ImageRecord> records = List.of(
                image("/scans/A1_1.jpg", "c1", "01", "aaaa", 1, 1, null),
                image("/scans/A2_2.jpg", "c1", "01", "bbbb", 1, 1, null),
                image("/scans/loose.jpg", "c1", "01", "cccc", 1, 1, null),
                image("/scans/A3_3.jpg", "c9", "09", "cccc", 1, 1, null));
        ExternalRecordTable table = ExternalRecordTable.of(List.of(
                ExternalRecord.of("R1", "A1", "1"),
                ExternalRecord.of("R2", "A2", "2"),
                ExternalRecord.of("R3", "A3", "3")));

        LinkageResult loose = result(link(records, table), "/scans/loose.jpg");

        assertThat(loose.status()).isEqualTo(LinkageStatus.CONFLICTED);
        assertThat(loose.viaGroupKind()).isEqualTo(GroupKind.EXACT_DUPLICATE);
    }

    @Test
    void exactGroupWithoutLinksFallsBackToSimilarityGroup() {
        List<ImageRecord> records = List.of(
                image("/scans/a.jpg", "c1", "01", "dddd", 1, 1, null),
                image("/scans/b.jpg", "c1", "01", "eeee", 1, 1, null),
                image("/scans/ACC5_INV5.jpg", "c5", "05", "dddd", 1, 1, null));
        ExternalRecordTable table = ExternalRecordTable.of(List.of(ExternalRecord.of("R5", "ACC5", "INV5")));

        LinkageReport report = link(records, table);

        assertThat(result(report, "/scans/a.jpg").status()).isEqualTo(LinkageStatus.PROPAGATED);
        assertThat(result(report, "/scans/a.jpg").viaGroupKind()).isEqualTo(GroupKind.SIMILAR);
        // b only shares an exact group with a, and a's record is not direct: no second hop
        assertThat(result(report, "/scans/b.jpg").status()).isEqualTo(LinkageStatus.UNLINKED);
    }

    @Test
    void markedUnlinkedFileIsNeverADirectMatch() {
        List<ImageRecord> records = List.of(
                hashed("/scans/ACC1_INV1_OGK.jpg", "c1", "01"),
                hashed("/scans/ACC1_INV1.jpg", "c1", "01"));
        ExternalRecordTable table = ExternalRecordTable.of(List.of(ExternalRecord.of("R1", "ACC1", "INV1")));

        LinkageReport report = link(records, table);

        assertThat(result(report, "/scans/ACC1_INV1_OGK.jpg").status()).isEqualTo(LinkageStatus.PROPAGATED);
        assertThat(result(report, "/scans/ACC1_INV1.jpg").status()).isEqualTo(LinkageStatus.DIRECT);
    }

    @Test
    void everyRecordGetsExactlyOneResultIncludingUnhashedOnes() {
        List<ImageRecord> records = List.of(
                ImageRecord.unhashed("/scans/ACC1_INV1.jpg"),
                hashed("/scans/b.jpg", "c1", "01"),
                hashed("/scans/a.jpg", "c1", "01"));
        ExternalRecordTable table = ExternalRecordTable.of(List.of(ExternalRecord.of("R1", "ACC1", "INV1")));

        LinkageReport report = link(records, table);

        assertThat(report.results()).extracting(LinkageResult::filePath)
                .containsExactly("/scans/ACC1_INV1.jpg", "/scans/a.jpg", "/scans/b.jpg");
        assertThat(result(report, "/scans/ACC1_INV1.jpg").status()).isEqualTo(LinkageStatus.DIRECT);
        assertThat(report.countByStatus())
                .containsEntry(LinkageStatus.DIRECT, 1)
                .containsEntry(LinkageStatus.UNLINKED, 2)
                .containsEntry(LinkageStatus.PROPAGATED, 0);
    }
}
