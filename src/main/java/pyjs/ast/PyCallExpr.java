package pyjs.ast;

import java.util.List;

public record PyCallExpr(PyExpr callee, List<PyExpr> args, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitCall(this);
	}
}
