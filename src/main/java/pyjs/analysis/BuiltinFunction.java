package pyjs.analysis;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Built-in functions visible in every module, with the arity the translation supports and the type of their
 * result.
 */
public enum BuiltinFunction {
	PRINT("print", 0, Integer.MAX_VALUE, InferredType.UNKNOWN),
	LEN("len", 1, 1, InferredType.NUMBER),
	RANGE("range", 1, 3, InferredType.LIST),
	STR("str", 0, 1, InferredType.STRING),
	INT("int", 0, 1, InferredType.NUMBER),
	FLOAT("float", 0, 1, InferredType.NUMBER),
	BOOL("bool", 0, 1, InferredType.BOOL),
	LIST("list", 0, 1, InferredType.LIST),
	DICT("dict", 0, 0, InferredType.DICT),
	ABS("abs", 1, 1, InferredType.NUMBER),
	MIN("min", 1, Integer.MAX_VALUE, InferredType.UNKNOWN),
	MAX("max", 1, Integer.MAX_VALUE, InferredType.UNKNOWN);

	private static final Map<String, BuiltinFunction> BY_NAME = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(BuiltinFunction::pythonName, Function.identity()));

	private final String pythonName;
	private final int minArgs;
	private final int maxArgs;
	private final InferredType resultType;

	BuiltinFunction(String pythonName, int minArgs, int maxArgs, InferredType resultType) {
		this.pythonName = pythonName;
		this.minArgs = minArgs;
		this.maxArgs = maxArgs;
		this.resultType = resultType;
	}

	public String pythonName() {
		return pythonName;
	}

	public InferredType resultType() {
		return resultType;
	}

	public boolean acceptsArgumentCount(int count) {
		return count >= minArgs && count <= maxArgs;
	}

	public String describeArity() {
		if (minArgs == maxArgs) {
			return minArgs == 1 ? "exactly 1 argument" : "exactly " + minArgs + " arguments";
		}
		if (maxArgs == Integer.MAX_VALUE) {
			return "at least " + minArgs + (minArgs == 1 ? " argument" : " arguments");
		}
		return minArgs + " to " + maxArgs + " arguments";
	}

	public static BuiltinFunction byName(String name) {
		return BY_NAME.get(name);
	}
}
