package pyjs.ast;

import java.util.List;

public record PyForStmt(String loopVar, PyExpr iterable, List<PyStmt> body, SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitFor(this);
	}
}
