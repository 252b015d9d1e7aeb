package works.smokeshow;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum SuiteResult {
	PASSED("passed"),
	FAILED("failed"),
	PARTIAL("partial"),
	;

	/**
	 * Value of <code>test.suite.result</code>.
	 */
	private final String id;

	/**
	 * A suite with no test cases at all is {@link #PARTIAL}: it neither passed nor failed anything.
	 */
	public static SuiteResult of(int passed, int failed) {
		int total = passed + failed;
		if (total > 0 && failed == 0) {
			return PASSED;
		} else if (total > 0 && passed == 0) {
			return FAILED;
		} else {
			return PARTIAL;
		}
	}
}
