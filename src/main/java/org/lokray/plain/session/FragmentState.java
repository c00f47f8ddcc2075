package org.lokray.plain.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one submitted fragment. A fragment moves forward one stage at a time,
 * and may be rejected from any stage before generation.
 */
public enum FragmentState
{
	RECEIVED,
	LEXED,
	PARSED,
	ANALYZED,
	GENERATED,
	COMMITTED,
	REJECTED;

	private static final Set<FragmentState> REJECTABLE = EnumSet.of(RECEIVED, LEXED, PARSED, ANALYZED);

	public boolean canAdvanceTo(FragmentState next)
	{
		if(next == REJECTED)
		{
			return REJECTABLE.contains(this);
		}
		return this != REJECTED && next.ordinal() == ordinal() + 1 && next != REJECTED;
	}

	public boolean isTerminal()
	{
		return this == COMMITTED || this == REJECTED;
	}
}
