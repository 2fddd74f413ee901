package com.projecttree.order.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "tree-order" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class OrderOptions {

	@Option(names = { "--items", "-i" }, required = true, description = "File listing the evaluated includes, one per line, in display order")
	private Path itemsFile;

	@Option(names = { "--project-dir",
			"-d" }, description = "Directory the includes are relative to (defaults to the directory of the items file)")
	private Path projectDir;

	@Option(names = { "--show-all", "-a" }, description = "Also show files on disk that are not in the item list")
	private boolean showAll;

	@Option(names = { "--item-type", "-t" }, defaultValue = "Compile", description = "Item type given to listed files (default: Compile)")
	private String itemType;

	@Option(names = { "--verbose", "-v" }, description = "Enable debug logging")
	private boolean verbose;

	// ---- Getters only; picocli sets fields reflectively ----

}
