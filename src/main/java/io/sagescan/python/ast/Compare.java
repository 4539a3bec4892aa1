package io.sagescan.python.ast;

/**
 * An equality or identity comparison.
 *
 * @param operator {@code is}, {@code is not}, {@code ==} or {@code !=}
 * @param right    The right-hand operand
 */
public record Compare(String operator, Operand right, Span span) {

    public boolean isIdentity() {
        return operator.equals("is") || operator.equals("is not");
    }

    /**
     * Right-hand operand of a comparison, classified by what a literal check needs to know.
     *
     * @param text Source text of the operand's first token
     */
    public record Operand(Kind kind, String text) {

        public enum Kind {
            NUMBER,
            STRING,
            BYTES,
            FSTRING,
            SINGLETON,
            OTHER
        }

        /**
         * Number, string or bytes constant. None, True, False, Ellipsis and f-strings do not count.
         */
        public boolean isValueLiteral() {
            return kind == Kind.NUMBER || kind == Kind.STRING || kind == Kind.BYTES;
        }
    }
}
