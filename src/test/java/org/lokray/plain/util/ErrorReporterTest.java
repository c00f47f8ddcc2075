package org.lokray.plain.util;

import org.lokray.plain.PlainCompiler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorReporterTest
{
	@Test
	void pointsAtTheColumn()
	{
		String source = "let x be 1\nsay wx\n";
		UnboundNameError error = new UnboundNameError(2, 5, "wx", "did you mean 'x'?");

		assertEquals("[UnboundNameError] Line 2, Column 5: 'wx' is not defined\n"
				+ "    say wx\n"
				+ "        ^\n"
				+ "Hint: did you mean 'x'?", ErrorReporter.format(error, source));
	}

	@Test
	void omitsSourceLineWhenUnavailable()
	{
		SyntaxError error = new SyntaxError(7, 3, "Unexpected '2'");

		assertEquals("[SyntaxError] Line 7, Column 3: Unexpected '2'", ErrorReporter.format(error, "say 1\n"));
		assertEquals("[SyntaxError] Line 7, Column 3: Unexpected '2'", ErrorReporter.format(error, null));
	}

	@Test
	void caretStaysWithinTheLine()
	{
		LexError error = new LexError(1, 40, "Unterminated string");

		assertTrue(ErrorReporter.format(error, "say \"hi").endsWith("    say \"hi\n           ^"));
	}

	@Test
	void reportRemembersThatErrorsOccurred()
	{
		ErrorReporter reporter = new ErrorReporter();
		assertFalse(reporter.hasErrors());

		reporter.report(new SyntaxError(1, 1, "The program is empty."), "");
		assertTrue(reporter.hasErrors());

		reporter.reset();
		assertFalse(reporter.hasErrors());
	}

	@Test
	void formatsRealCompilerErrors()
	{
		String source = "lett x be 1\n";
		SyntaxError error = assertThrows(SyntaxError.class, () -> new PlainCompiler().compile(source));

		String report = ErrorReporter.format(error, source);
		assertTrue(report.startsWith("[SyntaxError] Line 1, Column 1: I don't understand 'lett x be 1'"), report);
		assertTrue(report.endsWith("Hint: did you mean 'let'?"));
		assertEquals(List.of("lett", "x", "be", "1"), error.getWindow());
	}
}
