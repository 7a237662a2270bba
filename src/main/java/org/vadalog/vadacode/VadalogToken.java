package org.vadalog.vadacode;

import java.util.*;

/**
 * A typed lexical unit of a Vadalog program.
 *
 * <p>Positions are 0-based. The kind is refined by the tree walker while the
 * program is being walked and frozen once the walk is over; modifiers and
 * tags only accumulate.</p>
 */
public class VadalogToken {
    private final int line;
    private final int column;
    private final int length;
    private final String uri;
    private final String text;
    private TokenKind kind;
    private boolean frozen;
    private final EnumSet<TokenModifier> modifiers;
    private final EnumSet<TokenTag> tags;

    public VadalogToken(int line, int column, int length, String uri, String text, TokenKind kind) {
        this.line = line;
        this.column = column;
        this.length = length;
        this.uri = uri;
        this.text = text;
        this.kind = kind;
        this.modifiers = EnumSet.noneOf(TokenModifier.class);
        this.tags = EnumSet.noneOf(TokenTag.class);
    }

    protected VadalogToken(VadalogToken other) {
        this(other.line, other.column, other.length, other.uri, other.text, other.kind);
        this.modifiers.addAll(other.modifiers);
        this.tags.addAll(other.tags);
        this.frozen = other.frozen;
    }

    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getLength() { return length; }
    public String getUri() { return uri; }
    public String getText() { return text; }
    public TokenKind getKind() { return kind; }

    public Set<TokenModifier> getModifiers() { return Collections.unmodifiableSet(modifiers); }
    public Set<TokenTag> getTags() { return Collections.unmodifiableSet(tags); }

    public boolean hasModifier(TokenModifier modifier) { return modifiers.contains(modifier); }
    public boolean hasTag(TokenTag tag) { return tags.contains(tag); }

    public void addModifier(TokenModifier modifier) {
        modifiers.add(modifier);
    }

    public void addTag(TokenTag tag) {
        tags.add(tag);
    }

    void reclassify(TokenKind newKind) {
        if (frozen) {
            throw new IllegalStateException("Token " + this + " can no longer change kind");
        }
        this.kind = newKind;
    }

    void freeze() {
        this.frozen = true;
    }

    public VadalogRange getRange() {
        return new VadalogRange(line, column, line, column + length);
    }

    /**
     * Whether the given 0-based position falls on this token.
     */
    public boolean contains(int line, int character) {
        return this.line == line && character >= column && character < column + length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VadalogToken)) return false;
        VadalogToken that = (VadalogToken) o;
        return line == that.line && column == that.column && length == that.length
                && Objects.equals(uri, that.uri) && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, length, uri, text);
    }

    @Override
    public String toString() {
        return kind.getLabel() + "'" + text + "'@" + line + ":" + column;
    }

    static final Comparator<VadalogToken> BY_POSITION =
            Comparator.comparingInt(VadalogToken::getLine).thenComparingInt(VadalogToken::getColumn);
}
