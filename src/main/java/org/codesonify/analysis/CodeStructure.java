package org.codesonify.analysis;

import org.codesonify.analysis.lexer.TokenKind;

import java.util.List;

/**
 * A node of the structure tree: a function, class, loop or conditional with the structures nested inside it.
 *
 * @param kind The kind of the token that opened the structure.
 * @param name The structure name (the following identifier, or the keyword itself).
 * @param startLine The line of the opening token.
 * @param endLine The last line belonging to the structure.
 * @param nestingDepth The nesting depth of the opening token.
 * @param children The structures placed inside this one, in source order.
 */
public record CodeStructure(
        TokenKind kind,
        String name,
        int startLine,
        int endLine,
        int nestingDepth,
        List<CodeStructure> children
) {
    public CodeStructure {
        children = List.copyOf(children);
    }

    /**
     * Checks whether this structure lies inside the line range of another one.
     * @param parent The candidate enclosing structure.
     * @return {@code true} if this structure starts after and ends no later than {@code parent}.
     */
    public boolean isInside(CodeStructure parent) {
        return contains(parent.startLine, parent.endLine, startLine, endLine);
    }

    /**
     * The containment rule used to nest structures: the inner range starts strictly after the outer one
     * and ends no later than it.
     */
    static boolean contains(int outerStart, int outerEnd, int innerStart, int innerEnd) {
        return innerStart > outerStart && innerEnd <= outerEnd;
    }
}
