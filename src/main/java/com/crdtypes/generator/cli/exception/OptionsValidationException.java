package com.crdtypes.generator.cli.exception;

import java.util.List;

/**
 * Reports every problem found with the "generate" options at once, so a
 * single run shows the user all of them.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(describe(errors));
		if (errors.isEmpty()) {
			throw new IllegalArgumentException("At least one validation error is required");
		}
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

	private static String describe(List<String> errors) {
		if (errors.size() == 1) {
			return errors.get(0);
		}
		return errors.size() + " invalid options:" + System.lineSeparator()
				+ String.join(System.lineSeparator(), errors);
	}
}
