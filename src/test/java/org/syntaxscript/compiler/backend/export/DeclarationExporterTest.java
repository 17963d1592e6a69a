package org.syntaxscript.compiler.backend.export;

import org.syntaxscript.compiler.api.CompilationException;
import org.syntaxscript.compiler.api.CompilerErrorCode;
import org.syntaxscript.compiler.frontend.lexer.Lexer;
import org.syntaxscript.compiler.frontend.parser.Parser;
import org.syntaxscript.compiler.frontend.parser.ast.ProgramStatement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests the {@link DeclarationExporter} with the default converters of the
 * {@link ExportConverterRegistry}.
 */
public class DeclarationExporterTest {

	private static final String FILE = "decl.syx";

	private List<ExportedDescriptor> export(String source) throws CompilationException {
		ProgramStatement program = new Parser(new Lexer(source).scanTokens(), FILE, Parser.Grammar.DECLARATION).parse();
		return new DeclarationExporter(ExportConverterRegistry.initializeWithDefaults()).export(program, FILE);
	}

	/**
	 * Verifies that only exported statements produce descriptors, in source order, and that
	 * exported rules produce none.
	 */
	@Test
	@Tag("unit")
	void testOnlyExportedStatementsAreConverted() throws CompilationException {
		// Arrange
		String source = String.join("\n",
				"keyword hidden;",
				"export keyword shown;",
				"export rule 'function-value-return-enabled': true;",
				"export function print <string> { compile(ts) 'console.log'; }");

		// Act
		List<ExportedDescriptor> descriptors = export(source);

		// Assert
		assertThat(descriptors).extracting(ExportedDescriptor::exportType)
				.containsExactly(ExportType.KEYWORD, ExportType.FUNCTION);
		assertThat(descriptors.get(0)).isEqualTo(new ExportedKeyword("shown"));
	}

	/**
	 * Verifies the templates and imports of an exported operator.
	 */
	@Test
	@Tag("unit")
	void testOperatorDescriptor() throws CompilationException {
		// Arrange
		String source = String.join("\n",
				"export operator <int> +s '+' +s <int> {",
				"    compile(ts, js) int|0 +s '+' +s int|1;",
				"    compile(py) 'add(' int|0 ',' int|1 ')';",
				"    imports(py) 'operator';",
				"}");

		// Act
		List<ExportedDescriptor> descriptors = export(source);

		// Assert
		assertThat(descriptors).singleElement().isInstanceOfSatisfying(ExportedOperator.class, operator -> {
			assertThat(operator.pattern().source()).isEqualTo("([0-9]+)\\s*\\+\\s*([0-9]+)");
			assertThat(operator.outputGenerators()).containsOnlyKeys("ts", "js", "py");
			assertThat(operator.imports()).containsExactlyEntriesOf(Map.of("py", "operator"));
			Matcher matcher = operator.pattern().toPattern().matcher("1+2");
			assertThat(matcher.find()).isTrue();
			assertThat(operator.outputGenerators().get("py").render(matcher)).isEqualTo("add(1,2)");
		});
	}

	/**
	 * Verifies that a format listed by two compile statements of an operator is rejected.
	 */
	@Test
	@Tag("unit")
	void testDuplicateOperatorFormat() {
		// Arrange
		String source = "export operator <int> '!' { compile(ts) int|0; compile(js, ts) int|0; }";

		// Act
		CompilationException error = catchThrowableOfType(() -> export(source), CompilationException.class);

		// Assert
		assertThat(error.getCode()).isEqualTo(CompilerErrorCode.DUPLICATE_TARGET_FORMAT);
		assertThat(error.getMessage()).isEqualTo("Duplicate file format at compile statement 'ts'.");
		assertThat(error.getFile()).isEqualTo(FILE);
	}

	/**
	 * Verifies the argument patterns, renames and imports of an exported function.
	 */
	@Test
	@Tag("unit")
	void testFunctionDescriptor() throws CompilationException {
		// Arrange
		String source = String.join("\n",
				"export function randomizer <int> <int> {",
				"    compile(ts) 'Random.between';",
				"    imports(ts) 'random';",
				"}");

		// Act
		List<ExportedDescriptor> descriptors = export(source);

		// Assert
		assertThat(descriptors).singleElement().isInstanceOfSatisfying(ExportedFunction.class, function -> {
			assertThat(function.name()).isEqualTo("randomizer");
			assertThat(function.argumentPatterns()).containsExactly("([0-9]+)", "([0-9]+)");
			assertThat(function.formatNames()).containsEntry("ts", "Random.between");
			assertThat(function.imports()).containsEntry("ts", "random");
			assertThat(function.callPattern().matcher("randomizer(1,6)").matches()).isTrue();
			assertThat(function.callPattern().matcher("randomizer(1, 6)").matches()).isFalse();
		});
	}

	/**
	 * Verifies that the compile statement of a function must start with the new name.
	 */
	@Test
	@Tag("unit")
	void testFunctionTemplateNeedsString() {
		// Act
		CompilationException error = catchThrowableOfType(
				() -> export("export function f <int> { compile(ts) +s 'g'; }"), CompilationException.class);

		// Assert
		assertThat(error.getCode()).isEqualTo(CompilerErrorCode.INVALID_FUNCTION_TEMPLATE);
		assertThat(error.getMessage()).isEqualTo("Expected a string after compile statement parens.");
	}

	/**
	 * Verifies that an exported global carries the descriptors of its exported members only.
	 */
	@Test
	@Tag("unit")
	void testGlobalDescriptor() throws CompilationException {
		// Arrange
		String source = String.join("\n",
				"export global math {",
				"    export function sqrt <int> { compile(ts) 'Math.sqrt'; }",
				"    function hidden <int> { compile(ts) 'h'; }",
				"    export keyword pi;",
				"}");

		// Act
		List<ExportedDescriptor> descriptors = export(source);

		// Assert
		assertThat(descriptors).singleElement().isInstanceOfSatisfying(ExportedGlobal.class, global -> {
			assertThat(global.name()).isEqualTo("math");
			assertThat(global.members()).extracting(ExportedDescriptor::exportType)
					.containsExactly(ExportType.FUNCTION, ExportType.KEYWORD);
		});
	}
}
