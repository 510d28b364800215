package org.javai.vero;

import java.util.List;
import java.util.Objects;
import org.javai.vero.ast.PageNode;
import org.javai.vero.codegen.TranspileOptions;
import org.javai.vero.codegen.TranspileResult;
import org.javai.vero.codegen.VeroTranspiler;
import org.javai.vero.lexer.LexResult;
import org.javai.vero.lexer.VeroLexer;
import org.javai.vero.parser.ParseResult;
import org.javai.vero.parser.VeroParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for compiling Vero source: lexes, parses and transpiles in one call.
 * <p>
 * Every stage runs even when an earlier one reported problems, so editors get generated code
 * and all diagnostics at once. Callers decide whether to trust the output through
 * {@link CompilationResult#isTrustworthy()}.
 */
public class VeroCompiler {

	private static final Logger logger = LoggerFactory.getLogger(VeroCompiler.class);

	private final VeroTranspiler transpiler;

	public VeroCompiler() {
		this(new VeroTranspiler());
	}

	public VeroCompiler(TranspileOptions options) {
		this(new VeroTranspiler(options));
	}

	public VeroCompiler(VeroTranspiler transpiler) {
		this.transpiler = Objects.requireNonNull(transpiler, "transpiler must not be null");
	}

	public CompilationResult compile(String source) {
		return compile(source, List.of());
	}

	/**
	 * Compiles {@code source} with pages defined in other sources in scope. Only the pages
	 * defined in {@code source} are generated; a page it defines hides a shared page of the same
	 * name.
	 */
	public CompilationResult compile(String source, List<PageNode> sharedPages) {
		LexResult lexed = VeroLexer.tokenize(source);
		ParseResult parsed = VeroParser.parse(lexed.tokens());
		TranspileResult transpiled = transpiler.transpile(parsed.pages(), parsed.features(), sharedPages);

		logger.debug("Compiled {} page(s) and {} feature(s): {} lexical, {} syntax, {} generation error(s)",
				parsed.pages().size(), parsed.features().size(), lexed.errors().size(), parsed.errors().size(),
				transpiled.errors().size());
		return new CompilationResult(parsed.pages(), parsed.features(), transpiled.pages(), transpiled.tests(),
				lexed.errors(), parsed.errors(), transpiled.errors());
	}

	/**
	 * Lexes and parses without generating code.
	 */
	public CompilationResult check(String source) {
		LexResult lexed = VeroLexer.tokenize(source);
		ParseResult parsed = VeroParser.parse(lexed.tokens());
		return new CompilationResult(parsed.pages(), parsed.features(), null, null, lexed.errors(), parsed.errors(),
				null);
	}
}
