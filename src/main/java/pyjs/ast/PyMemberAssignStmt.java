package pyjs.ast;

/**
 * Assignment to an attribute or subscript, e.g. {@code self.name = name} or {@code ages["bob"] = 3}.
 *
 * The target is always a {@link PyAttributeExpr} or a {@link PySubscriptExpr}.
 */
public record PyMemberAssignStmt(PyExpr target, PyExpr value, SourcePosition position) implements PyStmt {
	@Override
	public <R> R accept(PyStmtVisitor<R> visitor) {
		return visitor.visitMemberAssign(this);
	}
}
