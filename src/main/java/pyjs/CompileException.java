package pyjs;

/**
 * Base class for the fatal conditions a pipeline stage reports by throwing.
 */
public abstract class CompileException extends RuntimeException {
	private final int line;
	private final int column;

	protected CompileException(String message, int line, int column) {
		super(message);
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public abstract Diagnostic.Stage getStage();

	public Diagnostic toDiagnostic() {
		return new Diagnostic(getStage(), Diagnostic.Severity.ERROR, line, column, getMessage());
	}
}
