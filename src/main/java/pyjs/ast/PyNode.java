package pyjs.ast;

public sealed interface PyNode permits PyProgram, PyStmt, PyExpr {
	SourcePosition position();
}
