package works.smokeshow;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * The built-in instrumented actions. The {@link #id} is used in span names and
 * as the value of <code>test.action.type</code>.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum ActionType {
	NAVIGATE("navigate"),
	CLICK("click"),
	FILL("fill"),
	ASSERT_VISIBLE("assert_visible"),
	ASSERT_TEXT("assert_text"),
	ASSERT_COUNT("assert_count"),
	ASSERT_URL("assert_url"),
	;

	private final String id;
}
