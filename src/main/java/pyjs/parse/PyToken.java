package pyjs.parse;

/**
 * A lexical token. For {@link PyTokenKind#STRING} the lexeme is the decoded literal value, without quotes.
 */
public record PyToken(PyTokenKind kind, String lexeme, int line, int column) {
	public boolean is(PyTokenKind kind, String lexeme) {
		return this.kind == kind && this.lexeme.equals(lexeme);
	}
}
