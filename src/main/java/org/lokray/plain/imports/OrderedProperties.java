package org.lokray.plain.imports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Properties that remember the order in which keys were read.
 */
class OrderedProperties extends Properties
{
	private final List<String> order = new ArrayList<>();

	@Override
	public synchronized Object put(Object key, Object value)
	{
		if(!containsKey(key))
		{
			order.add(String.valueOf(key));
		}
		return super.put(key, value);
	}

	List<String> orderedKeys()
	{
		return Collections.unmodifiableList(order);
	}
}
