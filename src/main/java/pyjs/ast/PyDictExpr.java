package pyjs.ast;

import java.util.List;

public record PyDictExpr(List<PyDictEntry> entries, SourcePosition position) implements PyExpr {
	@Override
	public <R> R accept(PyExprVisitor<R> visitor) {
		return visitor.visitDict(this);
	}
}
