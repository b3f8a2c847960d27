package pyjs.analysis;

import pyjs.CompileException;
import pyjs.Diagnostic;
import pyjs.ast.SourcePosition;

/**
 * An undefined name, illegal redeclaration or misplaced statement. The analyzer stops at the first one and
 * reports it as an error diagnostic.
 */
public class SemanticException extends CompileException {
	public SemanticException(String message, SourcePosition position) {
		super(message, position.line(), position.column());
	}

	@Override
	public Diagnostic.Stage getStage() {
		return Diagnostic.Stage.SEMANTIC;
	}
}
