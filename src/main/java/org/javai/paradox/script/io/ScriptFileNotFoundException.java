package org.javai.paradox.script.io;

import java.nio.file.Path;

public class ScriptFileNotFoundException extends ScriptIOException {

	private final Path path;

	public ScriptFileNotFoundException(Path path) {
		super("File not found: " + path);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}
}
