package org.codesonify.analysis;

import org.codesonify.analysis.lexer.Token;
import org.codesonify.analysis.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the structure tree from a token stream.
 * <p>
 * Every structural token (function, class, loop, conditional) opens a structure. A structure ends one line
 * before the first later token that sits on a later line at a smaller depth than the opening token, or on the
 * line of the last token if there is none. The closing line itself is therefore not part of the structure. Structures are then nested greedily: each one is tested
 * against the already placed roots from the most recent backwards and becomes a child of the first root
 * containing it, or a new root otherwise.
 */
public final class StructureExtractor {

    private StructureExtractor() {}

    /**
     * Extracts the structure tree.
     * @param tokens The tokens in source order.
     * @return The root structures in source order.
     */
    public static List<CodeStructure> extract(List<Token> tokens) {
        List<Node> roots = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.kind().isStructural()) {
                continue;
            }
            Node node = new Node(token, nameOf(tokens, i), endLineOf(tokens, i));
            place(roots, node);
        }
        return roots.stream().map(Node::toStructure).toList();
    }

    private static String nameOf(List<Token> tokens, int index) {
        if (index + 1 < tokens.size() && tokens.get(index + 1).kind() == TokenKind.UNKNOWN) {
            return tokens.get(index + 1).text();
        }
        return tokens.get(index).text();
    }

    private static int endLineOf(List<Token> tokens, int index) {
        Token start = tokens.get(index);
        int endLine = start.line();
        for (int j = index + 1; j < tokens.size(); j++) {
            Token candidate = tokens.get(j);
            if (candidate.nestingDepth() < start.nestingDepth() && candidate.line() > start.line()) {
                return candidate.line() - 1;
            }
            endLine = candidate.line();
        }
        return endLine;
    }

    private static void place(List<Node> roots, Node node) {
        for (int i = roots.size() - 1; i >= 0; i--) {
            Node root = roots.get(i);
            if (CodeStructure.contains(root.startLine, root.endLine, node.startLine, node.endLine)) {
                root.children.add(node);
                return;
            }
        }
        roots.add(node);
    }

    /** Mutable tree node used while the tree is assembled. */
    private static final class Node {
        private final TokenKind kind;
        private final String name;
        private final int startLine;
        private final int endLine;
        private final int depth;
        private final List<Node> children = new ArrayList<>();

        private Node(Token token, String name, int endLine) {
            this.kind = token.kind();
            this.name = name;
            this.startLine = token.line();
            this.endLine = endLine;
            this.depth = token.nestingDepth();
        }

        private CodeStructure toStructure() {
            return new CodeStructure(kind, name, startLine, endLine, depth,
                    children.stream().map(Node::toStructure).toList());
        }
    }
}
