package se.kth.hayroll.seed;

import se.kth.hayroll.syntax.SyntaxNode;

/** A replacement of a range of source text, used to rewrite a region while peeling it. */
public final class Substitution {
    private final int start;
    private final int end;
    private final String text;

    public Substitution(int start, int end, String text) {
        this.start = start;
        this.end = end;
        this.text = text;
    }

    public static Substitution of(SyntaxNode first, SyntaxNode last, String text) {
        return new Substitution(first.getStart(), last.getEnd(), text);
    }

    public static Substitution of(CodeRegion region, String text) {
        return new Substitution(region.getStart(), region.getEnd(), text);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getText() {
        return text;
    }

    boolean isWithin(int from, int to) {
        return from <= start && end <= to;
    }
}
