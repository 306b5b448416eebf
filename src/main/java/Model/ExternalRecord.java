package Model;

public record ExternalRecord(String recordId, String accessionNumber, String inventoryNumber, String codeAndNumber) {

    public ExternalRecord {
        if (recordId == null || recordId.isBlank()) throw new IllegalArgumentException("recordId is required");
        if (codeAndNumber == null || codeAndNumber.isBlank()) throw new IllegalArgumentException("codeAndNumber is required");
    }

    public static ExternalRecord of(String recordId, String accessionNumber, String inventoryNumber) {
        return of(recordId, accessionNumber, inventoryNumber, null);
    }

    public static ExternalRecord of(String recordId, String accessionNumber, String inventoryNumber, String suffix) {
        return new ExternalRecord(recordId, accessionNumber, inventoryNumber,
                CodeAndNumber.deriveKey(accessionNumber, inventoryNumber, suffix));
    }
}
