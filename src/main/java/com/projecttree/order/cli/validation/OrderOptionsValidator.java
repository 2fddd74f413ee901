package com.projecttree.order.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.projecttree.order.cli.exception.OptionsValidationException;
import com.projecttree.order.cli.model.OrderOptions;
import com.projecttree.order.cli.model.ValidatedOrderOptions;

public class OrderOptionsValidator {

	public ValidatedOrderOptions validate(OrderOptions o) {
		List<String> errors = new ArrayList<>();

		Path itemsFile = null;
		if (o.getItemsFile() == null) {
			errors.add("Item list file is required (--items / -i).");
		} else {
			itemsFile = o.getItemsFile().toAbsolutePath().normalize();
			if (!Files.isRegularFile(itemsFile)) {
				errors.add("Item list file does not exist or is not a file: " + o.getItemsFile());
			}
		}

		Path projectDir = null;
		if (o.getProjectDir() != null) {
			projectDir = o.getProjectDir().toAbsolutePath().normalize();
			if (!existsDirectory(projectDir)) {
				errors.add("Project directory does not exist or is not a directory: " + o.getProjectDir());
			}
		} else if (itemsFile != null) {
			projectDir = itemsFile.getParent();
		}

		if (isBlank(o.getItemType())) {
			errors.add("Item type must not be blank (--item-type / -t).");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedOrderOptions(itemsFile, projectDir, projectName(projectDir));
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static String projectName(Path projectDir) {
		Path fileName = projectDir.getFileName();
		return fileName == null ? projectDir.toString() : fileName.toString();
	}
}
