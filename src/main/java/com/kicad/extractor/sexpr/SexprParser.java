package com.kicad.extractor.sexpr;

import com.kicad.extractor.sexpr.SexprToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parser for KiCad S-expression documents.
 * Converts tokens into an immutable tree of {@link SexprAtom} and {@link SexprList} nodes.
 *
 * A document is exactly one top-level list. Anything else (empty input, stray
 * atoms, trailing content, unbalanced parentheses) is a {@link GrammarException}.
 * Lists are built with an explicit stack so deeply nested input cannot overflow
 * the call stack.
 */
public class SexprParser {
    private static final Logger log = LoggerFactory.getLogger(SexprParser.class);

    /**
     * Parse a complete document.
     *
     * @param text raw schematic text
     * @return the root list
     * @throws GrammarException if the text is malformed
     */
    public SexprList parse(String text) {
        List<SexprToken> tokens = new SexprTokenizer(text).tokenize();
        SexprList root = parse(tokens);
        log.debug("Parsed S-expression document with root keyword '{}' ({} tokens)",
                root.keyword().orElse(""), tokens.size());
        return root;
    }

    public SexprList parse(List<SexprToken> tokens) {
        int pos = 0;
        SexprToken first = tokens.get(pos);

        if (first.getType() == TokenType.EOF) {
            throw new GrammarException("Empty document, expected '('", first.getLine(), first.getColumn());
        }
        if (first.getType() != TokenType.LPAREN) {
            throw new GrammarException("Expected '(' but found " + first.describe(), first.getLine(), first.getColumn());
        }

        Deque<OpenList> stack = new ArrayDeque<>();
        SexprList root = null;

        while (root == null) {
            SexprToken token = tokens.get(pos++);
            switch (token.getType()) {
                case LPAREN -> stack.push(new OpenList(token.getLine(), token.getColumn()));
                case RPAREN -> {
                    OpenList closed = stack.pop();
                    SexprList list = new SexprList(closed.children, closed.line, closed.column);
                    if (stack.isEmpty()) {
                        root = list;
                    } else {
                        stack.peek().children.add(list);
                    }
                }
                case SYMBOL, STRING -> stack.peek().children.add(new SexprAtom(
                        token.getValue(), token.getType() == TokenType.STRING, token.getLine(), token.getColumn()));
                case EOF -> {
                    OpenList unterminated = stack.peek();
                    throw new GrammarException("Unterminated list opened", unterminated.line, unterminated.column);
                }
            }
        }

        SexprToken trailing = tokens.get(pos);
        if (trailing.getType() != TokenType.EOF) {
            String message = trailing.getType() == TokenType.RPAREN
                    ? "Unbalanced ')'"
                    : "Unexpected " + trailing.describe() + " after end of document";
            throw new GrammarException(message, trailing.getLine(), trailing.getColumn());
        }

        return root;
    }

    private static final class OpenList {
        final int line;
        final int column;
        final List<SexprNode> children = new ArrayList<>();

        OpenList(int line, int column) {
            this.line = line;
            this.column = column;
        }
    }
}
