package org.lokray.plain.util;

import java.util.Collection;

/**
 * Edit-distance helpers used to build the "did you mean" hints attached to errors.
 */
public final class Suggestions
{
	private Suggestions()
	{
	}

	/**
	 * Finds the candidate closest to {@code target}.
	 *
	 * @return The best candidate within a distance proportional to the target's length, or null.
	 */
	public static String nearest(String target, Collection<String> candidates)
	{
		String best = null;
		int bestDistance = Integer.MAX_VALUE;
		int limit = Math.max(1, Math.min(3, target.length() / 3));
		for(String candidate : candidates)
		{
			if(candidate.equals(target))
			{
				continue;
			}
			int distance = distance(target.toLowerCase(), candidate.toLowerCase());
			if(distance <= limit && distance < bestDistance)
			{
				best = candidate;
				bestDistance = distance;
			}
		}
		return best;
	}

	public static int distance(String a, String b)
	{
		int[] previous = new int[b.length() + 1];
		int[] current = new int[b.length() + 1];
		for(int j = 0; j <= b.length(); j++)
		{
			previous[j] = j;
		}
		for(int i = 1; i <= a.length(); i++)
		{
			current[0] = i;
			for(int j = 1; j <= b.length(); j++)
			{
				int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
				current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
			}
			int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous[b.length()];
	}
}
