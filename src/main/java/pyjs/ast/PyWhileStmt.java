package pyjs.ast;

import java.util.List;

public record PyWhileStmt(PyExpr condition, List<PyStmt> body, SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitWhile(this);
	}
}
