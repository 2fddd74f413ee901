package com.projecttree.order.cli.exception;

import java.util.List;

/**
 * Carries every problem found in the command-line options at once.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() == 1 ? errors.get(0) : errors.size() + " invalid options: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
