package org.javai.paradox.script;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe {@link StringCache} that can be shared by parsers running in parallel.
 */
public final class InterningStringCache implements StringCache {

	private final ConcurrentMap<String, String> pool = new ConcurrentHashMap<>();

	@Override
	public String intern(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		String existing = pool.putIfAbsent(value, value);
		return existing != null ? existing : value;
	}

	public int size() {
		return pool.size();
	}

	public void clear() {
		pool.clear();
	}
}
