package se.kth.hayroll.seed;

import se.kth.hayroll.exception.MalformedTagException;

/** A line and column position in a compilation unit, written {@code line:col}. */
public final class LnCol {
    private final int line;
    private final int col;

    public LnCol(int line, int col) {
        this.line = line;
        this.col = col;
    }

    public static LnCol parse(String lnCol) {
        String[] parts = lnCol.trim().split(":");
        if (parts.length != 2) {
            throw new MalformedTagException("Expected line:col but got '" + lnCol + "'");
        }
        try {
            return new LnCol(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new MalformedTagException("Expected line:col but got '" + lnCol + "'", e);
        }
    }

    public int getLine() {
        return line;
    }

    public int getCol() {
        return col;
    }

    /** @return true if this position lies within {@code [begin, end]}, both ends inclusive. */
    public boolean isWithin(LnCol begin, LnCol end) {
        if (line < begin.line || line > end.line) {
            return false;
        }
        if (line == begin.line && col < begin.col) {
            return false;
        }
        return !(line == end.line && col > end.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LnCol)) return false;
        LnCol other = (LnCol) o;
        return line == other.line && col == other.col;
    }

    @Override
    public int hashCode() {
        return 31 * line + col;
    }

    @Override
    public String toString() {
        return line + ":" + col;
    }
}
