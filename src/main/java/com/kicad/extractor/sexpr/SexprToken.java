package com.kicad.extractor.sexpr;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the S-expression tokenizer.
 */
@Data
@AllArgsConstructor
public class SexprToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        LPAREN,
        RPAREN,
        SYMBOL,
        STRING,
        EOF
    }

    public boolean isAtom() {
        return type == TokenType.SYMBOL || type == TokenType.STRING;
    }

    public String describe() {
        return switch (type) {
            case LPAREN -> "'('";
            case RPAREN -> "')'";
            case STRING -> "string \"" + value + "\"";
            case SYMBOL -> "symbol '" + value + "'";
            case EOF -> "end of input";
        };
    }
}
