package pyjs.ast;

/**
 * Source position for diagnostics. Lines and columns are 1-based.
 */
public record SourcePosition(int line, int column) {
	@Override
	public String toString() {
		return line + ":" + column;
	}
}
