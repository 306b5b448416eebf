package Model;

/**
 * Builds the join key between file names and external records: {@code accession\inventory[suffix]}.
 */
public final class CodeAndNumber {

    public static final char SEPARATOR = '\\';

    private CodeAndNumber() {}

    public static String deriveKey(String accession, String inventory) {
        return deriveKey(accession, inventory, null);
    }

    /**
     * Fields are trimmed and purely numeric fields lose their leading zeros, so {@code 045} and {@code 45} join.
     *
     * @throws IllegalArgumentException if accession or inventory is blank, or any field contains the separator
     */
    public static String deriveKey(String accession, String inventory, String suffix) {
        String a = normalize(accession, "accession");
        String i = normalize(inventory, "inventory");
        String s = suffix == null || suffix.isBlank() ? "" : normalize(suffix, "suffix");
        return a + SEPARATOR + i + s;
    }

    static String normalize(String field, String name) {
        if (field == null || field.isBlank()) throw new IllegalArgumentException(name + " is blank");

        String v = field.trim();
        if (v.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException(name + " contains the key separator: " + field);
        }
        return isDigits(v) ? stripLeadingZeros(v) : v;
    }

    private static boolean isDigits(String v) {
        for (int i = 0; i < v.length(); i++) {
            if (!Character.isDigit(v.charAt(i))) return false;
        }
        return true;
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') i++;
        return digits.substring(i);
    }
}
