package pyjs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pyjs.analysis.AnalysisResult;
import pyjs.analysis.SemanticAnalyzer;
import pyjs.ast.PyProgram;
import pyjs.parse.PyLexer;
import pyjs.parse.PyParser;
import pyjs.parse.PyToken;
import pyjs.print.JsPrinter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Public entrypoint for Python -> JavaScript translation.
 *
 * The stages run in order: lexer, parser, semantic analyzer, printer. The first error stops the pipeline and
 * no output is produced. Nothing is written to the console; problems come back as {@link Diagnostic}s.
 */
public final class Transpiler {
	private static final Logger LOG = LoggerFactory.getLogger(Transpiler.class);

	private final CompilerOptions options;

	public Transpiler() {
		this(new CompilerOptions());
	}

	public Transpiler(CompilerOptions options) {
		this.options = Objects.requireNonNull(options, "options");
	}

	public CompileResult compile(String source) {
		Objects.requireNonNull(source, "source");
		long started = System.nanoTime();

		Front front = front(source);
		if (front.analysis == null || front.analysis.hasErrors()) {
			LOG.debug("compile failed with {} diagnostics", front.diagnostics.size());
			return new CompileResult(Optional.empty(), front.diagnostics);
		}

		long printStarted = System.nanoTime();
		String js = new JsPrinter(options.indent()).print(front.program, front.analysis.model());
		LOG.debug("printed {} chars in {} us", js.length(), micros(printStarted));
		LOG.debug("compiled {} source chars in {} us", source.length(), micros(started));
		return new CompileResult(Optional.of(js), front.diagnostics);
	}

	/**
	 * Runs every stage except the printer.
	 */
	public List<Diagnostic> validate(String source) {
		Objects.requireNonNull(source, "source");
		return front(source).diagnostics;
	}

	private Front front(String source) {
		PyProgram program;
		try {
			long started = System.nanoTime();
			List<PyToken> tokens = new PyLexer(options.tabWidth()).lex(source);
			LOG.debug("lexed {} tokens in {} us", tokens.size(), micros(started));

			started = System.nanoTime();
			program = new PyParser().parse(tokens);
			LOG.debug("parsed {} top-level statements in {} us", program.statements().size(), micros(started));
		} catch (CompileException e) {
			Diagnostic diagnostic = e.toDiagnostic();
			LOG.debug("{} stage failed: {}", e.getStage(), diagnostic);
			return new Front(null, null, List.of(diagnostic));
		}

		long started = System.nanoTime();
		AnalysisResult analysis = new SemanticAnalyzer().analyze(program);
		LOG.debug("analyzed in {} us", micros(started));
		if (LOG.isTraceEnabled()) {
			analysis.diagnostics().forEach(d -> LOG.trace("{}", d));
		}
		return new Front(program, analysis, analysis.diagnostics());
	}

	private static long micros(long startedNanos) {
		return (System.nanoTime() - startedNanos) / 1_000;
	}

	private record Front(PyProgram program, AnalysisResult analysis, List<Diagnostic> diagnostics) {
	}
}
