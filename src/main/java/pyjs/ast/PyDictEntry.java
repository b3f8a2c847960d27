package pyjs.ast;

public record PyDictEntry(PyExpr key, PyExpr value) {
}
