package org.lokray.plain.lexer;

import org.lokray.plain.util.LexError;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads raw Plain source text and converts it into a stream of Tokens: words, numbers, strings,
 * punctuation, and the layout tokens NEWLINE, INDENT and DEDENT derived from leading whitespace.
 * <p>
 * The token stream is lazy and restartable: every call to {@link #iterator()} scans the source again
 * from the beginning, one logical line at a time. Lexical errors are raised as {@link LexError}
 * when the offending line is reached.
 */
public class Lexer implements Iterable<Token>
{
	private final String source; // The raw source code string

	/**
	 * Constructs a Lexer.
	 *
	 * @param source The source code string to tokenize.
	 */
	public Lexer(String source)
	{
		this.source = source;
	}

	@Override
	public Iterator<Token> iterator()
	{
		return new Scan();
	}

	/**
	 * Scans the entire source and returns every token, ending with EOF.
	 */
	public List<Token> scanTokens()
	{
		List<Token> tokens = new ArrayList<>();
		for(Token token : this)
		{
			tokens.add(token);
		}
		return tokens;
	}

	/**
	 * One pass over the source. Holds all positional state so that passes are independent.
	 */
	private final class Scan implements Iterator<Token>
	{
		private final Deque<Token> pending = new ArrayDeque<>();
		private final Deque<Integer> indentStack = new ArrayDeque<>();

		private int start = 0; // Current token's starting position in the source
		private int current = 0; // Current position in the source
		private int line = 1;
		private int column = 1;

		private int startLine = 1;
		private int startColumn = 1;

		private int bracketDepth = 0;
		private char indentChar = 0; // first indentation character seen in this source
		private boolean finished = false;

		Scan()
		{
			indentStack.push(0);
		}

		@Override
		public boolean hasNext()
		{
			fill();
			return !pending.isEmpty();
		}

		@Override
		public Token next()
		{
			if(!hasNext())
			{
				throw new NoSuchElementException("The token stream is exhausted");
			}
			return pending.poll();
		}

		private void fill()
		{
			while(pending.isEmpty() && !finished)
			{
				if(isAtEnd())
				{
					while(indentStack.peek() > 0)
					{
						indentStack.pop();
						pending.add(new Token(TokenType.DEDENT, "", null, line, column));
					}
					pending.add(new Token(TokenType.EOF, "", null, line, column));
					finished = true;
				}
				else
				{
					scanLine();
				}
			}
		}

		/**
		 * Scans one logical line: its indentation, then tokens up to the line break.
		 * Blank and comment-only lines produce nothing.
		 */
		private void scanLine()
		{
			int lineStart = current;
			boolean sawSpace = false;
			boolean sawTab = false;
			while(peek() == ' ' || peek() == '\t')
			{
				if(advance() == ' ')
				{
					sawSpace = true;
				}
				else
				{
					sawTab = true;
				}
			}
			int width = current - lineStart;

			if(isAtEnd() || peek() == '\n' || peek() == '\r' || peek() == '#' || (peek() == '/' && peekNext() == '/'))
			{
				skipRestOfLine();
				return;
			}

			if(sawSpace && sawTab)
			{
				throw new LexError(line, 1, "Indentation mixes tabs and spaces");
			}
			if(width > 0)
			{
				char used = sawTab ? '\t' : ' ';
				if(indentChar == 0)
				{
					indentChar = used;
				}
				else if(indentChar != used)
				{
					throw new LexError(line, 1, "Indentation uses " + describe(used) + " but earlier lines use " + describe(indentChar));
				}
			}
			handleIndentation(width);

			while(true)
			{
				while(peek() == ' ' || peek() == '\t' || peek() == '\r')
				{
					advance();
				}
				if(isAtEnd())
				{
					pending.add(new Token(TokenType.NEWLINE, "", null, line, column));
					return;
				}
				if(peek() == '#')
				{
					while(!isAtEnd() && peek() != '\n')
					{
						advance();
					}
					continue;
				}
				if(peek() == '\n')
				{
					if(bracketDepth > 0)
					{
						advance(); // implicit line join inside brackets
						continue;
					}
					pending.add(new Token(TokenType.NEWLINE, "\n", null, line, column));
					advance();
					return;
				}
				start = current;
				startLine = line;
				startColumn = column;
				scanToken();
			}
		}

		private void handleIndentation(int width)
		{
			int top = indentStack.peek();
			if(width > top)
			{
				indentStack.push(width);
				pending.add(new Token(TokenType.INDENT, source.substring(current - width, current), null, line, 1));
				return;
			}
			while(width < indentStack.peek())
			{
				indentStack.pop();
				pending.add(new Token(TokenType.DEDENT, "", null, line, 1));
			}
			if(width != indentStack.peek())
			{
				throw new LexError(line, width + 1, "Unindent does not match any outer indentation level");
			}
		}

		/**
		 * Scans a single token from the source code.
		 */
		private void scanToken()
		{
			char c = advance();

			switch(c)
			{
				case '(':
					bracketDepth++;
					addToken(TokenType.LEFT_PAREN);
					break;
				case ')':
					closeBracket();
					addToken(TokenType.RIGHT_PAREN);
					break;
				case '[':
					bracketDepth++;
					addToken(TokenType.LEFT_BRACKET);
					break;
				case ']':
					closeBracket();
					addToken(TokenType.RIGHT_BRACKET);
					break;
				case '{':
					bracketDepth++;
					addToken(TokenType.LEFT_BRACE);
					break;
				case '}':
					closeBracket();
					addToken(TokenType.RIGHT_BRACE);
					break;
				case ',':
					addToken(TokenType.COMMA);
					break;
				case '.':
					addToken(TokenType.DOT);
					break;
				case ':':
					addToken(TokenType.COLON);
					break;
				case '+':
					addToken(TokenType.PLUS);
					break;
				case '-':
					addToken(TokenType.MINUS);
					break;
				case '*':
					addToken(match('*') ? TokenType.STAR_STAR : TokenType.STAR);
					break;
				case '/':
					addToken(TokenType.SLASH);
					break;
				case '%':
					addToken(TokenType.PERCENT);
					break;
				case '=':
					addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
					break;
				case '!':
					if(!match('='))
					{
						throw new LexError(startLine, startColumn, "Unexpected character '!'");
					}
					addToken(TokenType.BANG_EQUAL);
					break;
				case '<':
					addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
					break;
				case '>':
					addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
					break;
				case '"':
				case '\'':
					string(c);
					break;
				default:
					if(isDigit(c))
					{
						number();
					}
					else if(isAlpha(c))
					{
						word();
					}
					else
					{
						throw new LexError(startLine, startColumn, "Unexpected character '" + c + "'");
					}
			}
		}

		private void closeBracket()
		{
			if(bracketDepth > 0)
			{
				bracketDepth--;
			}
		}

		private void string(char quote)
		{
			StringBuilder value = new StringBuilder();
			while(!isAtEnd() && peek() != quote)
			{
				if(peek() == '\n')
				{
					throw new LexError(startLine, startColumn, "Unterminated string");
				}
				char c = advance();
				if(c == '\\' && !isAtEnd() && peek() != '\n')
				{
					char escaped = advance();
					switch(escaped)
					{
						case 'n':
							value.append('\n');
							break;
						case 't':
							value.append('\t');
							break;
						case 'r':
							value.append('\r');
							break;
						case '\\':
						case '"':
						case '\'':
							value.append(escaped);
							break;
						default:
							value.append('\\').append(escaped);
					}
				}
				else
				{
					value.append(c);
				}
			}
			if(isAtEnd())
			{
				throw new LexError(startLine, startColumn, "Unterminated string");
			}
			advance(); // closing quote
			addToken(TokenType.STRING, value.toString());
		}

		private void number()
		{
			while(isDigit(peek()))
			{
				advance();
			}
			if(peek() == '.' && isDigit(peekNext()))
			{
				advance();
				while(isDigit(peek()))
				{
					advance();
				}
			}
			addToken(TokenType.NUMBER, new BigDecimal(source.substring(start, current)));
		}

		private void word()
		{
			while(isAlphaNumeric(peek()) || (peek() == '\'' && isAlpha(peekNext())))
			{
				advance();
			}
			addToken(TokenType.WORD);
		}

		private void skipRestOfLine()
		{
			while(!isAtEnd() && peek() != '\n')
			{
				advance();
			}
			if(!isAtEnd())
			{
				advance();
			}
		}

		private void addToken(TokenType type)
		{
			addToken(type, null);
		}

		private void addToken(TokenType type, Object literal)
		{
			pending.add(new Token(type, source.substring(start, current), literal, startLine, startColumn));
		}

		private boolean match(char expected)
		{
			if(isAtEnd() || source.charAt(current) != expected)
			{
				return false;
			}
			advance();
			return true;
		}

		private char advance()
		{
			char c = source.charAt(current++);
			if(c == '\n')
			{
				line++;
				column = 1;
			}
			else
			{
				column++;
			}
			return c;
		}

		private char peek()
		{
			return isAtEnd() ? '\0' : source.charAt(current);
		}

		private char peekNext()
		{
			return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
		}

		private boolean isAtEnd()
		{
			return current >= source.length();
		}
	}

	private static String describe(char indentChar)
	{
		return indentChar == '\t' ? "tabs" : "spaces";
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isAlpha(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isAlphaNumeric(char c)
	{
		return isAlpha(c) || isDigit(c);
	}
}
