package works.smokeshow;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum TestOutcome {
	PASSED("passed"),
	FAILED("failed"),
	;

	/**
	 * Value of <code>test.case.result</code>.
	 */
	private final String id;
}
