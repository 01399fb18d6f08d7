package org.prw.common.exception;

import java.util.List;
import java.util.Map;

/**
 * Thrown when an input batch lacks columns the run needs. Raised before any output is
 * written, so a run that fails this way leaves every store untouched.
 */
public class DataShapeException extends Exception {

	private static final long serialVersionUID = 4120937756021448183L;

	private final Map<String, List<String>> missingColumns;

	public DataShapeException(Map<String, List<String>> missingColumns) {
		super("Input batches are missing required columns: " + missingColumns);
		this.missingColumns = missingColumns;
	}

	/**
	 * @return dataset name to the required columns that dataset did not provide
	 */
	public Map<String, List<String>> getMissingColumns() {
		return missingColumns;
	}
}
