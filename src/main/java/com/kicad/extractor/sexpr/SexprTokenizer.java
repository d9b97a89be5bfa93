package com.kicad.extractor.sexpr;

import com.kicad.extractor.sexpr.SexprToken.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for KiCad S-expression sources.
 *
 * Recognizes parentheses, double-quoted strings with backslash escapes and bare
 * symbols. Everything else is whitespace.
 */
public class SexprTokenizer {

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public SexprTokenizer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Tokenize the entire source text. The last token is always {@link TokenType#EOF}.
     *
     * @throws GrammarException on an unterminated string or an invalid escape sequence
     */
    public List<SexprToken> tokenize() {
        List<SexprToken> tokens = new ArrayList<>();

        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            tokens.add(nextToken());
        }

        tokens.add(new SexprToken(TokenType.EOF, "", line, column));
        return tokens;
    }

    private void skipWhitespace() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                line++;
                column = 1;
                pos++;
            } else if (Character.isWhitespace(c)) {
                column++;
                pos++;
            } else {
                break;
            }
        }
    }

    private SexprToken nextToken() {
        char c = source.charAt(pos);
        int startLine = line;
        int startCol = column;

        if (c == '(') {
            advance();
            return new SexprToken(TokenType.LPAREN, "(", startLine, startCol);
        }
        if (c == ')') {
            advance();
            return new SexprToken(TokenType.RPAREN, ")", startLine, startCol);
        }
        if (c == '"') {
            return readString(startLine, startCol);
        }
        return readSymbol(startLine, startCol);
    }

    private SexprToken readString(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        advance(); // opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '"') {
                advance();
                return new SexprToken(TokenType.STRING, sb.toString(), startLine, startCol);
            }

            if (c == '\\') {
                int escLine = line;
                int escCol = column;
                advance();
                if (pos >= source.length()) {
                    break;
                }
                char escaped = source.charAt(pos);
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> throw new GrammarException(
                            "Invalid escape sequence '\\" + escaped + "' in string", escLine, escCol);
                }
                advance();
                continue;
            }

            sb.append(c);
            if (c == '\n') {
                pos++;
                line++;
                column = 1;
            } else {
                advance();
            }
        }

        throw new GrammarException("Unterminated string", startLine, startCol);
    }

    private SexprToken readSymbol(int startLine, int startCol) {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || c == '(' || c == ')') {
                break;
            }
            if (c == '"') {
                throw new GrammarException("Unexpected quote inside symbol '"
                        + source.substring(start, pos) + "'", line, column);
            }
            advance();
        }
        return new SexprToken(TokenType.SYMBOL, source.substring(start, pos), startLine, startCol);
    }

    private void advance() {
        pos++;
        column++;
    }
}
