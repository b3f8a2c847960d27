package pyjs.ast;

import java.util.List;

public record PyProgram(List<PyStmt> statements, SourcePosition position) implements PyNode {
}
