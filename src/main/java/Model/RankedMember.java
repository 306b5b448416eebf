package Model;

public record RankedMember(ImageRecord record, int rank) {

    public RankedMember {
        if (rank < 1) throw new IllegalArgumentException("rank starts at 1: " + rank);
    }

    public String filePath() {
        return record.filePath();
    }
}
