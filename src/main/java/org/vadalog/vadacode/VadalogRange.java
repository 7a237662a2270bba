package org.vadalog.vadacode;

import java.util.Objects;

/**
 * A 0-based text range, end exclusive.
 */
public class VadalogRange {
    private final int startLine;
    private final int startCharacter;
    private final int endLine;
    private final int endCharacter;

    public VadalogRange(int startLine, int startCharacter, int endLine, int endCharacter) {
        this.startLine = startLine;
        this.startCharacter = startCharacter;
        this.endLine = endLine;
        this.endCharacter = endCharacter;
    }

    public int getStartLine() { return startLine; }
    public int getStartCharacter() { return startCharacter; }
    public int getEndLine() { return endLine; }
    public int getEndCharacter() { return endCharacter; }

    public boolean contains(int line, int character) {
        if (line < startLine || line > endLine) {
            return false;
        }
        if (line == startLine && character < startCharacter) {
            return false;
        }
        return line != endLine || character < endCharacter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VadalogRange)) return false;
        VadalogRange that = (VadalogRange) o;
        return startLine == that.startLine && startCharacter == that.startCharacter
                && endLine == that.endLine && endCharacter == that.endCharacter;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startCharacter, endLine, endCharacter);
    }

    @Override
    public String toString() {
        return startLine + ":" + startCharacter + "-" + endLine + ":" + endCharacter;
    }
}
