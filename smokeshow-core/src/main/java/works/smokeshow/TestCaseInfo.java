package works.smokeshow;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * Describes a test case to {@link SuiteRun#testCase}.
 * Only the name is required.
 */
@Value
@Builder
@Accessors(fluent = true)
public class TestCaseInfo {
	@NonNull String name;
	@Nullable String caseId;
	@Singular List<String> tags;
	@Nullable String description;

	/**
	 * How many times the surrounding framework has already retried this test case.
	 * Recorded for information only.
	 */
	@Nullable Integer retryCount;

	public static TestCaseInfo named(String name) {
		return builder().name(name).build();
	}

	/**
	 * @return the case ID if there is one, else the name
	 */
	public String label() {
		return (caseId == null || caseId.isBlank()) ? name : caseId;
	}
}
