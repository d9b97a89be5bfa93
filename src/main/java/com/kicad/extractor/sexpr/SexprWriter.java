package com.kicad.extractor.sexpr;

/**
 * Renders nodes back to S-expression text. Quoted atoms are re-escaped so that
 * {@link SexprParser} reads the output back to an equal tree.
 */
public final class SexprWriter {

    private static final String INDENT = "  ";

    private SexprWriter() {
        // Utility class
    }

    /**
     * Single-line rendering.
     */
    public static String compact(SexprNode node) {
        StringBuilder sb = new StringBuilder();
        node.accept(new CompactVisitor(sb));
        return sb.toString();
    }

    /**
     * Multi-line rendering: a list that contains other lists places each nested
     * list on its own indented line, flat lists stay on one line.
     */
    public static String pretty(SexprNode node) {
        StringBuilder sb = new StringBuilder();
        writePretty(node, 0, sb);
        sb.append('\n');
        return sb.toString();
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static String atomText(SexprAtom atom) {
        return atom.isQuoted() ? quote(atom.getText()) : atom.getText();
    }

    private static void writePretty(SexprNode node, int depth, StringBuilder sb) {
        if (node instanceof SexprAtom atom) {
            sb.append(atomText(atom));
            return;
        }
        SexprList list = (SexprList) node;
        if (list.childLists().isEmpty()) {
            sb.append(compact(list));
            return;
        }
        sb.append('(');
        boolean first = true;
        for (SexprNode child : list.getChildren()) {
            if (child instanceof SexprList) {
                sb.append('\n').append(INDENT.repeat(depth + 1));
                writePretty(child, depth + 1, sb);
            } else {
                if (!first) {
                    sb.append(' ');
                }
                writePretty(child, depth + 1, sb);
            }
            first = false;
        }
        sb.append('\n').append(INDENT.repeat(depth)).append(')');
    }

    private static final class CompactVisitor implements SexprNodeVisitor<Void> {
        private final StringBuilder sb;

        CompactVisitor(StringBuilder sb) {
            this.sb = sb;
        }

        @Override
        public Void visitAtom(SexprAtom atom) {
            sb.append(atomText(atom));
            return null;
        }

        @Override
        public Void visitList(SexprList list) {
            sb.append('(');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(' ');
                list.get(i).accept(this);
            }
            sb.append(')');
            return null;
        }
    }
}
