package org.lokray.plain.grammar;

import org.lokray.plain.lexer.Token;

/**
 * A view of the upcoming tokens, relative to the parser's current position.
 * Offsets past the end of the stream return the EOF token.
 */
@FunctionalInterface
public interface TokenWindow
{
	Token get(int offset);
}
