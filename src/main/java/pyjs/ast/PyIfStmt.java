package pyjs.ast;

import java.util.List;

/**
 * An {@code if} statement. An {@code elif} chain is represented as a nested {@code PyIfStmt} that is the
 * only statement of {@link #elseBody()}; an absent {@code else} is an empty list.
 */
public record PyIfStmt(PyExpr condition, List<PyStmt> thenBody, List<PyStmt> elseBody, SourcePosition position)
		implements PyStmt {
	public boolean hasElse() {
		return !elseBody.isEmpty();
	}

	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitIf(this);
	}
}
