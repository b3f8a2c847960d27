package pyjs.parse;

import pyjs.CompileException;
import pyjs.Diagnostic;

/**
 * Thrown by {@link PyLexer} for a malformed token or inconsistent indentation.
 */
public class LexException extends CompileException {
	public LexException(String message, int line, int column) {
		super(message, line, column);
	}

	@Override
	public Diagnostic.Stage getStage() {
		return Diagnostic.Stage.LEX;
	}
}
