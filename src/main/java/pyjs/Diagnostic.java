package pyjs;

import pyjs.ast.SourcePosition;

/**
 * A structured message produced by one pipeline stage. Column 0 means the column is unknown.
 */
public record Diagnostic(Stage stage, Severity severity, int line, int column, String message) {
	public enum Stage {
		LEX,
		PARSE,
		SEMANTIC
	}

	public enum Severity {
		ERROR,
		WARNING
	}

	public static Diagnostic warning(Stage stage, SourcePosition pos, String message) {
		return new Diagnostic(stage, Severity.WARNING, pos.line(), pos.column(), message);
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	@Override
	public String toString() {
		String where = column > 0 ? line + ":" + column : String.valueOf(line);
		return where + ": " + severity.name().toLowerCase() + ": " + message;
	}
}
